package com.ourolang.compiler.compiler;

import com.ourolang.compiler.analysis.SymbolError;
import com.ourolang.compiler.lexer.LexerException;
import com.ourolang.compiler.parser.ParseError;
import com.ourolang.compiler.parser.ParseException;

import java.util.Objects;

/**
 * 编译诊断。行列从 1 开始，与 Token 一致。
 */
public final class Diagnostic {

    /** 产生诊断的阶段 */
    public enum Stage {
        LEXER,
        PARSER,
        SEMANTIC
    }

    public enum Severity {
        ERROR,
        WARNING,
        INFO,
        HINT
    }

    private final Stage stage;
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final int length;

    public Diagnostic(Stage stage, Severity severity, String message, int line, int column, int length) {
        this.stage = stage;
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.length = Math.max(1, length);
    }

    static Diagnostic of(LexerException e) {
        return new Diagnostic(Stage.LEXER, Severity.ERROR, e.getDescription(), e.getLine(), e.getColumn(), 1);
    }

    static Diagnostic of(ParseException e) {
        int length = e.getToken() != null ? e.getToken().getLexeme().length() : 1;
        return new Diagnostic(Stage.PARSER, Severity.ERROR, e.getMessage(), e.getLine(), e.getColumn(), length);
    }

    static Diagnostic of(ParseError error) {
        return new Diagnostic(Stage.PARSER, Severity.ERROR, error.getMessage(),
                error.getLine(), error.getColumn(), error.getLength());
    }

    static Diagnostic of(SymbolError error) {
        return new Diagnostic(Stage.SEMANTIC, Severity.ERROR, error.getMessage(),
                error.getLine(), error.getColumn(), 1);
    }

    public Stage getStage() { return stage; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getLength() { return length; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic other = (Diagnostic) o;
        return line == other.line && column == other.column && length == other.length
                && stage == other.stage && severity == other.severity
                && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, severity, message, line, column, length);
    }

    @Override
    public String toString() {
        return String.format("%s %s [%d:%d] %s", stage, severity, line, column, message);
    }
}
