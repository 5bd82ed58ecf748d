package com.ourolang.compiler.formatter;

/**
 * 代码格式化配置
 */
public class FormatConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;

    public FormatConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public FormatConfig setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0: " + indentSize);
        }
        this.indentSize = indentSize;
        return this;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public FormatConfig setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
        return this;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (!useSpaces) {
            return "\t";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
