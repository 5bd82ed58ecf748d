package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组字面量 [a, b, c]
 */
public class ArrayLiteralExpr extends Expression {
    private final List<Expression> elements;

    public ArrayLiteralExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteralExpr(this, context);
    }
}
