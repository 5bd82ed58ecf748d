package com.ourolang.compiler.analysis;

import com.ourolang.compiler.ast.SourceLocation;

/**
 * 语义 / 类型错误（不可变诊断值）
 */
public final class SymbolError {

    public enum Kind {
        DUPLICATE_DEFINITION,
        UNDEFINED_TYPE,
        UNDEFINED_SYMBOL,
        TYPE_MISMATCH,
        CONFORMANCE_GAP,
        INVALID_INHERITANCE,
        CIRCULAR_INHERITANCE,
        INVALID_OVERRIDE,
        ABSTRACT_INSTANTIATION,
        INVALID_OPERATION
    }

    private final Kind kind;
    private final String message;
    private final int line;
    private final int column;
    private final String expected;  // 仅 TYPE_MISMATCH
    private final String actual;    // 仅 TYPE_MISMATCH

    public SymbolError(Kind kind, String message, int line, int column) {
        this(kind, message, line, column, null, null);
    }

    private SymbolError(Kind kind, String message, int line, int column, String expected, String actual) {
        this.kind = kind;
        this.message = message;
        this.line = line;
        this.column = column;
        this.expected = expected;
        this.actual = actual;
    }

    // ============ 工厂方法 ============

    public static SymbolError duplicateDefinition(String name, SourceLocation loc) {
        return new SymbolError(Kind.DUPLICATE_DEFINITION,
                "Duplicate definition of '" + name + "'", loc.getLine(), loc.getColumn());
    }

    public static SymbolError undefinedType(String name, SourceLocation loc) {
        return new SymbolError(Kind.UNDEFINED_TYPE,
                "Undefined type '" + name + "'", loc.getLine(), loc.getColumn());
    }

    public static SymbolError undefinedSymbol(String name, SourceLocation loc) {
        return new SymbolError(Kind.UNDEFINED_SYMBOL,
                "Undefined symbol '" + name + "'", loc.getLine(), loc.getColumn());
    }

    public static SymbolError typeMismatch(String expected, String actual, int line, int column) {
        return new SymbolError(Kind.TYPE_MISMATCH,
                "Type mismatch: expected '" + expected + "', got '" + actual + "'",
                line, column, expected, actual);
    }

    public static SymbolError conformanceGap(String typeName, String member, String required, SourceLocation loc) {
        return new SymbolError(Kind.CONFORMANCE_GAP,
                "Type '" + typeName + "' does not implement '" + member + "' required by '" + required + "'",
                loc.getLine(), loc.getColumn());
    }

    public static SymbolError invalidInheritance(String message, SourceLocation loc) {
        return new SymbolError(Kind.INVALID_INHERITANCE, message, loc.getLine(), loc.getColumn());
    }

    public static SymbolError circularInheritance(String typeName, SourceLocation loc) {
        return new SymbolError(Kind.CIRCULAR_INHERITANCE,
                "Circular inheritance involving '" + typeName + "'", loc.getLine(), loc.getColumn());
    }

    public static SymbolError invalidOverride(String name, SourceLocation loc) {
        return new SymbolError(Kind.INVALID_OVERRIDE,
                "Method '" + name + "' overrides nothing", loc.getLine(), loc.getColumn());
    }

    public static SymbolError abstractInstantiation(String typeName, SourceLocation loc) {
        return new SymbolError(Kind.ABSTRACT_INSTANTIATION,
                "Cannot instantiate abstract type '" + typeName + "'", loc.getLine(), loc.getColumn());
    }

    public static SymbolError invalidOperation(String message, SourceLocation loc) {
        return new SymbolError(Kind.INVALID_OPERATION, message, loc.getLine(), loc.getColumn());
    }

    // ============ 访问器 ============

    public Kind getKind() { return kind; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getExpected() { return expected; }
    public String getActual() { return actual; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolError)) return false;
        SymbolError other = (SymbolError) o;
        return kind == other.kind && line == other.line && column == other.column
                && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        h = 31 * h + message.hashCode();
        h = 31 * h + line;
        return 31 * h + column;
    }

    @Override
    public String toString() {
        return "[" + line + ":" + column + "] " + kind + ": " + message;
    }
}
