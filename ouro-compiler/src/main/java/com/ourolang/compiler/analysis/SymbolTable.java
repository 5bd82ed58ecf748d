package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.FunctionSignature;
import com.ourolang.compiler.analysis.types.PrimitiveTypes;
import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.FunctionDecl;
import com.ourolang.compiler.ast.decl.TypeDecl;
import com.ourolang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 符号表：管理作用域树、声明到符号以及引用到符号的映射。
 *
 * <p>每个编译单元新建一个实例，不跨线程共享。全局作用域在构造时预置所有原始类型。</p>
 */
public final class SymbolTable {
    private final Scope globalScope;
    private Scope currentScope;
    private int nextScopeId = 1;

    private final Map<AstNode, Scope> nodeToScope = new IdentityHashMap<AstNode, Scope>();
    private final Map<AstNode, Symbol> declarationSymbols = new IdentityHashMap<AstNode, Symbol>();
    private final Map<Expression, Symbol> references = new IdentityHashMap<Expression, Symbol>();
    private final Map<TypeDecl, TypeDefinition> typeDefinitions = new IdentityHashMap<TypeDecl, TypeDefinition>();
    private final Map<FunctionDecl, FunctionSignature> signatures =
            new IdentityHashMap<FunctionDecl, FunctionSignature>();

    public SymbolTable() {
        this.globalScope = new Scope(0, Scope.ScopeType.GLOBAL, null, null);
        this.currentScope = globalScope;
        for (TypeDefinition primitive : PrimitiveTypes.all().values()) {
            globalScope.define(new Symbol(primitive.getName(), SymbolKind.TYPE, primitive,
                    SourceLocation.UNKNOWN, null));
        }
    }

    public Scope getGlobalScope() { return globalScope; }
    public Scope getCurrentScope() { return currentScope; }

    // ============ 作用域 ============

    /**
     * 进入 node 对应的作用域；第一次进入时创建，之后再进入复用同一个作用域
     */
    public Scope enterScope(Scope.ScopeType type, AstNode node) {
        Scope scope = node != null ? nodeToScope.get(node) : null;
        if (scope == null) {
            scope = new Scope(nextScopeId++, type, currentScope, node);
            if (node != null) {
                nodeToScope.put(node, scope);
            }
        } else if (scope.getParent() != currentScope) {
            throw new IllegalStateException("Scope " + scope + " re-entered from a different parent");
        }
        currentScope = scope;
        return scope;
    }

    /**
     * 进入类型体作用域并记录所属类型
     */
    public Scope enterTypeScope(AstNode node, TypeDefinition owner) {
        Scope scope = enterScope(Scope.ScopeType.TYPE, node);
        scope.setOwnerType(owner);
        return scope;
    }

    public void exitScope() {
        if (currentScope == globalScope) {
            throw new IllegalStateException("Cannot exit the global scope");
        }
        currentScope = currentScope.getParent();
    }

    /** AST 节点对应的作用域，未建立时返回 null */
    public Scope getScope(AstNode node) {
        return nodeToScope.get(node);
    }

    // ============ 符号 ============

    /**
     * 在当前作用域定义符号，同名已存在时抛出 {@link SymbolException}；遮蔽外层同名符号是允许的
     */
    public Symbol define(Symbol symbol) {
        currentScope.define(symbol);
        if (symbol.getDeclaration() != null) {
            declarationSymbols.put(symbol.getDeclaration(), symbol);
        }
        return symbol;
    }

    /** 从当前作用域向外查找 */
    public Symbol lookup(String name) {
        return currentScope.resolve(name);
    }

    /** 仅在当前作用域查找 */
    public Symbol lookupLocal(String name) {
        return currentScope.resolveLocal(name);
    }

    /**
     * 从当前作用域向外查找第一个同名类型，找不到返回 null
     */
    public TypeDefinition resolveType(String name) {
        for (Scope s = currentScope; s != null; s = s.getParent()) {
            Symbol symbol = s.resolveLocal(name);
            if (symbol != null && symbol.getKind() == SymbolKind.TYPE) {
                return symbol.getType();
            }
        }
        return null;
    }

    /** 声明节点（VarDecl、FunctionDecl、Parameter、TypeDecl 等）对应的符号 */
    public Symbol getDeclarationSymbol(AstNode declaration) {
        return declarationSymbols.get(declaration);
    }

    // ============ 声明 → 类型信息 ============

    public void recordTypeDefinition(TypeDecl declaration, TypeDefinition definition) {
        typeDefinitions.put(declaration, definition);
    }

    /** 类型声明对应的类型定义（重复定义的声明也有自己的定义） */
    public TypeDefinition getTypeDefinition(TypeDecl declaration) {
        return typeDefinitions.get(declaration);
    }

    public void recordSignature(FunctionDecl declaration, FunctionSignature signature) {
        signatures.put(declaration, signature);
    }

    /** 函数 / 方法 / 构造器的已解析签名 */
    public FunctionSignature getSignature(FunctionDecl declaration) {
        return signatures.get(declaration);
    }

    // ============ 引用绑定 ============

    public void bindReference(Expression reference, Symbol symbol) {
        references.put(reference, symbol);
    }

    /** 标识符引用绑定到的符号，未绑定（未定义）返回 null */
    public Symbol getReferencedSymbol(Expression reference) {
        return references.get(reference);
    }

    /** 获取所有指定类型的符号（遍历整棵作用域树） */
    public List<Symbol> getAllSymbolsOfKind(SymbolKind kind) {
        List<Symbol> result = new ArrayList<Symbol>();
        collectSymbolsOfKind(globalScope, kind, result);
        return result;
    }

    private void collectSymbolsOfKind(Scope scope, SymbolKind kind, List<Symbol> result) {
        for (Symbol sym : scope.getSymbols().values()) {
            if (sym.getKind() == kind) {
                result.add(sym);
            }
        }
        for (Scope child : scope.getChildren()) {
            collectSymbolsOfKind(child, kind, result);
        }
    }
}
