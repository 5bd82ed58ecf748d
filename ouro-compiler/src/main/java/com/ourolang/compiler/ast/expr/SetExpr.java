package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 属性赋值 obj.name = value（含复合赋值）
 */
public class SetExpr extends Expression {
    private final Expression object;
    private final String name;
    private final AssignExpr.AssignOp operator;
    private final Expression value;

    public SetExpr(SourceLocation location, Expression object, String name,
                   AssignExpr.AssignOp operator, Expression value) {
        super(location);
        this.object = object;
        this.name = name;
        this.operator = operator;
        this.value = value;
    }

    public Expression getObject() {
        return object;
    }

    public String getName() {
        return name;
    }

    public AssignExpr.AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSetExpr(this, context);
    }
}
