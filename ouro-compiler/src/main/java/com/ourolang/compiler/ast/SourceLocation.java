package com.ourolang.compiler.ast;

import java.util.Objects;

/**
 * 源码位置：起始 token 的行列（从 1 开始）、字符偏移（从 0 开始）与长度。
 *
 * <p>值对象，按内容比较。内置类型等没有源码的符号使用 {@link #UNKNOWN}。</p>
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 1, 1, 0, 0);

    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = Math.max(0, length);
    }

    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }
    public int getLength() { return length; }

    /**
     * 结束列（不含），至少覆盖一个字符
     */
    public int getEndColumn() {
        return column + Math.max(1, length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && offset == that.offset
                && length == that.length && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column, offset, length);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
