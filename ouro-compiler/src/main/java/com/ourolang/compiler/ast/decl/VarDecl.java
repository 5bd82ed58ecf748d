package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.expr.Expression;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 变量 / 常量声明（全局、属性或局部）
 */
public class VarDecl extends Declaration {
    private final boolean constant;
    private final TypeRef typeAnnotation;   // 可选
    private final Expression initializer;   // 可选

    public VarDecl(SourceLocation location, List<Modifier> modifiers, String name,
                   boolean constant, TypeRef typeAnnotation, Expression initializer) {
        super(location, modifiers, name);
        this.constant = constant;
        this.typeAnnotation = typeAnnotation;
        this.initializer = initializer;
    }

    public boolean isConstant() {
        return constant;
    }

    public TypeRef getTypeAnnotation() {
        return typeAnnotation;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
