package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.stmt.Block;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 函数 / 方法 / 构造器（init）声明
 */
public class FunctionDecl extends Declaration {
    public static final String CONSTRUCTOR_NAME = "init";

    private final List<TypeParameter> typeParams;
    private final List<Parameter> params;
    private final TypeRef returnType;   // 可选，缺省为 Void
    private final Block body;           // 接口方法 / 抽象方法为 null

    public FunctionDecl(SourceLocation location, List<Modifier> modifiers, String name,
                        List<TypeParameter> typeParams, List<Parameter> params,
                        TypeRef returnType, Block body) {
        super(location, modifiers, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean isConstructor() {
        return CONSTRUCTOR_NAME.equals(name);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
