package com.ourolang.compiler.parser;

import com.ourolang.compiler.lexer.Token;

/**
 * 容错解析中收集的语法错误
 */
public final class ParseError {
    private final ParseException.Kind kind;
    private final String message;
    private final Token token;

    public ParseError(ParseException.Kind kind, String message, Token token) {
        this.kind = kind;
        this.message = message;
        this.token = token;
    }

    static ParseError of(ParseException e) {
        return new ParseError(e.getKind(), e.getMessage(), e.getToken());
    }

    public ParseException.Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    /** 出错 token 的长度，至少为 1，便于编辑器标出范围 */
    public int getLength() {
        return token != null ? Math.max(1, token.getLexeme().length()) : 1;
    }

    @Override
    public String toString() {
        return message;
    }
}
