package com.ourolang.compiler.lexer;

/**
 * 词法单元
 *
 * <p>lexeme 是源码中的原文（EOF 为空串）；字符串等字面量的解码值在 {@link #getLiteral()}。
 * 行列从 1 开始，offset 从 0 开始。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final LiteralValue literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, LiteralValue literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal != null ? literal : LiteralValue.NONE;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() { return type; }
    public String getLexeme() { return lexeme; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }

    /** 字面量值，无字面量的 Token 返回 {@link LiteralValue#NONE} */
    public LiteralValue getLiteral() {
        return literal;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name()).append(" '").append(lexeme).append('\'');
        if (!literal.is(LiteralValue.Kind.NONE)) {
            sb.append(" = ").append(literal);
        }
        return sb.append(" @").append(line).append(':').append(column).toString();
    }
}
