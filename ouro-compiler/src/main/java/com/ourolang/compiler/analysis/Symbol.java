package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.FunctionSignature;
import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 符号表中的符号
 *
 * <p>创建后只允许补上一次类型（未标注类型的变量在推断完成后补上）。</p>
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final SourceLocation declaredAt;
    private final AstNode declaration;    // 声明的 AST 节点，内置类型为 null
    private int scopeId = -1;             // 定义进作用域时写入

    private TypeDefinition type;          // 变量类型 / 函数返回类型 / 类型符号自身
    private FunctionSignature signature;  // 仅函数

    public Symbol(String name, SymbolKind kind, TypeDefinition type,
                  SourceLocation declaredAt, AstNode declaration) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.declaredAt = declaredAt != null ? declaredAt : SourceLocation.UNKNOWN;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public TypeDefinition getType() { return type; }
    public FunctionSignature getSignature() { return signature; }
    public SourceLocation getDeclaredAt() { return declaredAt; }
    public AstNode getDeclaration() { return declaration; }
    public int getScopeId() { return scopeId; }

    public boolean hasType() { return type != null; }
    public boolean isConstant() { return kind == SymbolKind.CONSTANT; }

    void setScopeId(int scopeId) {
        if (this.scopeId >= 0 && this.scopeId != scopeId) {
            throw new IllegalStateException("Symbol '" + name + "' already belongs to scope " + this.scopeId);
        }
        this.scopeId = scopeId;
    }

    /**
     * 补上解析 / 推断出的类型，只允许一次
     */
    public void attachType(TypeDefinition resolved) {
        if (type != null && !type.sameAs(resolved)) {
            throw new IllegalStateException("Type of '" + name + "' is already " + type.getName());
        }
        this.type = resolved;
    }

    /**
     * 补上函数签名（同时把返回类型作为符号类型），只允许一次
     */
    public void attachSignature(FunctionSignature sig) {
        if (signature != null) {
            throw new IllegalStateException("Signature of '" + name + "' is already attached");
        }
        this.signature = sig;
        attachType(sig.getReturnType());
    }

    @Override
    public String toString() {
        return kind + " " + name + (type != null ? ": " + type.getName() : "");
    }
}
