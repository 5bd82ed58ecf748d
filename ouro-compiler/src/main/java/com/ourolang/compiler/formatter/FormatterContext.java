package com.ourolang.compiler.formatter;

/**
 * 格式化上下文，跟踪输出缓冲区和缩进层级
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public FormatterContext(FormatConfig config) {
        this.indentUnit = config.getIndentString();
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（行首自动补缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    public void newLine() {
        output.append('\n');
        atLineStart = true;
    }

    /**
     * 追加空行，不会产生连续的多个空行
     */
    public void blankLine() {
        int len = output.length();
        if (len == 0 || (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n')) {
            return;
        }
        if (output.charAt(len - 1) != '\n') {
            output.append('\n');
        }
        output.append('\n');
        atLineStart = true;
    }

    public String getOutput() {
        return output.toString();
    }
}
