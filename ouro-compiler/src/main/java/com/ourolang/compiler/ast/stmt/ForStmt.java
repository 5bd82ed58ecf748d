package com.ourolang.compiler.ast.stmt;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.expr.Expression;

/**
 * C 风格三段式 for 循环，三段均可省略
 */
public class ForStmt extends Statement {
    private final Statement initializer;  // DeclarationStmt 或 ExpressionStmt，可选
    private final Expression condition;   // 可选
    private final Expression increment;   // 可选
    private final Statement body;

    public ForStmt(SourceLocation location, Statement initializer, Expression condition,
                   Expression increment, Statement body) {
        super(location);
        this.initializer = initializer;
        this.condition = condition;
        this.increment = increment;
        this.body = body;
    }

    public Statement getInitializer() {
        return initializer;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getIncrement() {
        return increment;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
