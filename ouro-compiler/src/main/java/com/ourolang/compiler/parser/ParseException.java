package com.ourolang.compiler.parser;

import com.ourolang.compiler.lexer.Token;

/**
 * 解析异常
 */
public class ParseException extends RuntimeException {

    /**
     * 语法错误种类
     */
    public enum Kind {
        /** 当前 token 不能出现在此处 */
        UNEXPECTED_TOKEN,
        /** 缺少期望的 token */
        EXPECTED_TOKEN,
        /** 修饰符重复或互相冲突 */
        INVALID_MODIFIER,
        /** 嵌套层数超过上限 */
        NESTING_TOO_DEEP
    }

    private final Kind kind;
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(Kind.UNEXPECTED_TOKEN, message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        this(Kind.EXPECTED_TOKEN, message, token, expected);
    }

    public ParseException(Kind kind, String message, Token token, String expected) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.expected = expected;
    }

    public Kind getKind() {
        return kind;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 不带位置后缀的原始消息 */
    public String getDescription() {
        return super.getMessage();
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        return sb.toString();
    }
}
