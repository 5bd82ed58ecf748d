package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.lexer.LiteralValue;

/**
 * 字面量表达式（整数、浮点、字符串、字符、布尔、null）
 */
public class Literal extends Expression {
    private final LiteralValue value;

    public Literal(SourceLocation location, LiteralValue value) {
        super(location);
        this.value = value;
    }

    public LiteralValue getValue() {
        return value;
    }

    public LiteralValue.Kind getKind() {
        return value.getKind();
    }

    public boolean isNull() {
        return value.is(LiteralValue.Kind.NONE);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
