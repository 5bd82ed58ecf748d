package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数 / 方法调用，或以类型名调用的构造
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = arguments;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
