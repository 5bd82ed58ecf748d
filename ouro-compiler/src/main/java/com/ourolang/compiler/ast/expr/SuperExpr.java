package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * super.member
 */
public class SuperExpr extends Expression {
    private final String member;

    public SuperExpr(SourceLocation location, String member) {
        super(location);
        this.member = member;
    }

    public String getMember() {
        return member;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSuperExpr(this, context);
    }
}
