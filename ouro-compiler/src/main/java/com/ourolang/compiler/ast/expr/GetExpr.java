package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 成员访问 obj.name
 */
public class GetExpr extends Expression {
    private final Expression object;
    private final String name;

    public GetExpr(SourceLocation location, Expression object, String name) {
        super(location);
        this.object = object;
        this.name = name;
    }

    public Expression getObject() {
        return object;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGetExpr(this, context);
    }
}
