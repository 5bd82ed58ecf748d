package com.ourolang.compiler.lexer;

import java.util.Objects;

/**
 * Token 携带的字面量值
 *
 * <p>按 {@link Kind} 区分的带标签联合体，每种取值只能通过对应的访问器读取，
 * 类型不符时抛出 {@link IllegalStateException}。</p>
 */
public final class LiteralValue {

    /**
     * 字面量标签
     */
    public enum Kind {
        INTEGER,
        FLOAT,
        STRING,
        CHARACTER,
        BOOLEAN,
        NONE
    }

    public static final LiteralValue NONE = new LiteralValue(Kind.NONE, null);
    public static final LiteralValue TRUE = new LiteralValue(Kind.BOOLEAN, Boolean.TRUE);
    public static final LiteralValue FALSE = new LiteralValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private LiteralValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static LiteralValue ofInteger(long value) {
        return new LiteralValue(Kind.INTEGER, value);
    }

    public static LiteralValue ofFloat(double value) {
        return new LiteralValue(Kind.FLOAT, value);
    }

    public static LiteralValue ofString(String value) {
        return new LiteralValue(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    /** 字符字面量以 Unicode 码点保存，可以是增补平面字符 */
    public static LiteralValue ofChar(int codePoint) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Invalid code point: " + codePoint);
        }
        return new LiteralValue(Kind.CHARACTER, codePoint);
    }

    public static LiteralValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean is(Kind kind) {
        return this.kind == kind;
    }

    public long asInteger() {
        expect(Kind.INTEGER);
        return (Long) value;
    }

    public double asFloat() {
        expect(Kind.FLOAT);
        return (Double) value;
    }

    public String asString() {
        expect(Kind.STRING);
        return (String) value;
    }

    public int asCodePoint() {
        expect(Kind.CHARACTER);
        return (Integer) value;
    }

    public boolean asBoolean() {
        expect(Kind.BOOLEAN);
        return (Boolean) value;
    }

    private void expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Literal is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralValue)) return false;
        LiteralValue other = (LiteralValue) o;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NONE:
                return "none";
            case STRING:
                return "\"" + value + "\"";
            case CHARACTER:
                return "'" + new String(Character.toChars((Integer) value)) + "'";
            default:
                return String.valueOf(value);
        }
    }
}
