package com.ourolang.compiler.lexer;

/**
 * 词法错误
 *
 * <p>第一个错误即终止扫描，调用方拿不到任何部分 Token。</p>
 */
public class LexerException extends RuntimeException {

    /**
     * 词法错误种类
     */
    public enum Kind {
        INVALID_CHARACTER,
        UNTERMINATED_STRING,
        UNTERMINATED_CHAR,
        INVALID_ESCAPE_SEQUENCE,
        UNTERMINATED_BLOCK_COMMENT,
        INVALID_NUMBER,
        INVALID_CHAR_LITERAL
    }

    private final Kind kind;
    private final String fileName;
    private final int line;
    private final int column;

    public LexerException(Kind kind, String message, String fileName, int line, int column) {
        super(message);
        this.kind = kind;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public Kind getKind() {
        return kind;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        return String.format("[%s:%d:%d] Lexer error: %s", fileName, line, column, super.getMessage());
    }

    /** 不带位置前缀的原始描述 */
    public String getDescription() {
        return super.getMessage();
    }
}
