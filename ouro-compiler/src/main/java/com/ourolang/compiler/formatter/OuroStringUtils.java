package com.ourolang.compiler.formatter;

/**
 * 字符串 / 字符字面量的源码转义
 *
 * <p>输出只使用词法分析器认识的转义：{@code \n \t \r \0 \\ \" \'} 与 {@code &#92;u{X}}。</p>
 */
public final class OuroStringUtils {

    private OuroStringUtils() {}

    /** 转义字符串内容（用于双引号包裹的字符串） */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\'') {
                sb.append(c);
            } else {
                appendEscaped(sb, c);
            }
        }
        return sb.toString();
    }

    /** 转义单个码点（用于单引号包裹的字符字面量） */
    public static String escapeChar(int codePoint) {
        if (codePoint == '"') {
            return "\"";
        }
        if (Character.isSupplementaryCodePoint(codePoint)) {
            return new String(Character.toChars(codePoint));
        }
        StringBuilder sb = new StringBuilder(4);
        appendEscaped(sb, (char) codePoint);
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, char c) {
        switch (c) {
            case '\\': sb.append("\\\\"); break;
            case '"':  sb.append("\\\""); break;
            case '\'': sb.append("\\'"); break;
            case '\n': sb.append("\\n"); break;
            case '\r': sb.append("\\r"); break;
            case '\t': sb.append("\\t"); break;
            case '\0': sb.append("\\0"); break;
            default:
                if (Character.isISOControl(c)) {
                    sb.append("\\u{").append(Integer.toHexString(c)).append('}');
                } else {
                    sb.append(c);
                }
        }
    }
}
