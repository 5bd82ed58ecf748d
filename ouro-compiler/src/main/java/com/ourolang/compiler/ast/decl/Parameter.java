package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.expr.Expression;
import com.ourolang.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;
    private final Expression defaultValue;  // 可选

    public Parameter(SourceLocation location, String name, TypeRef type, Expression defaultValue) {
        super(location);
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
