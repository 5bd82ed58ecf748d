package com.ourolang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * OuroLang 词法分析器
 *
 * <p>单遍扫描，按最长匹配识别多字符操作符。遇到第一个错误即抛出
 * {@link LexerException}，不返回部分结果。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 Token 的起始位置
    private int startLine = 1;
    private int startColumn = 1;

    private boolean scanned = false;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("class", TokenType.KW_CLASS);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("enum", TokenType.KW_ENUM);
        map.put("interface", TokenType.KW_INTERFACE);
        map.put("var", TokenType.KW_VAR);
        map.put("const", TokenType.KW_CONST);
        map.put("func", TokenType.KW_FUNC);
        map.put("init", TokenType.KW_INIT);
        map.put("extension", TokenType.KW_EXTENSION);
        map.put("typealias", TokenType.KW_TYPEALIAS);
        map.put("protocol", TokenType.KW_PROTOCOL);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("switch", TokenType.KW_SWITCH);
        map.put("case", TokenType.KW_CASE);
        map.put("default", TokenType.KW_DEFAULT);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("while", TokenType.KW_WHILE);
        map.put("do", TokenType.KW_DO);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("return", TokenType.KW_RETURN);
        map.put("throw", TokenType.KW_THROW);
        map.put("throws", TokenType.KW_THROWS);
        map.put("rethrows", TokenType.KW_RETHROWS);
        map.put("try", TokenType.KW_TRY);
        map.put("catch", TokenType.KW_CATCH);
        map.put("finally", TokenType.KW_FINALLY);
        map.put("yield", TokenType.KW_YIELD);
        map.put("defer", TokenType.KW_DEFER);

        // 字面量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);

        // 修饰符
        map.put("public", TokenType.KW_PUBLIC);
        map.put("private", TokenType.KW_PRIVATE);
        map.put("protected", TokenType.KW_PROTECTED);
        map.put("internal", TokenType.KW_INTERNAL);
        map.put("fileprivate", TokenType.KW_FILEPRIVATE);
        map.put("static", TokenType.KW_STATIC);
        map.put("final", TokenType.KW_FINAL);
        map.put("abstract", TokenType.KW_ABSTRACT);
        map.put("sealed", TokenType.KW_SEALED);
        map.put("override", TokenType.KW_OVERRIDE);
        map.put("lazy", TokenType.KW_LAZY);
        map.put("async", TokenType.KW_ASYNC);
        map.put("await", TokenType.KW_AWAIT);

        // 类型操作
        map.put("is", TokenType.KW_IS);
        map.put("as", TokenType.KW_AS);
        map.put("extends", TokenType.KW_EXTENDS);
        map.put("implements", TokenType.KW_IMPLEMENTS);
        map.put("super", TokenType.KW_SUPER);
        map.put("this", TokenType.KW_THIS);
        // "permits" 是软关键词，仅在类头识别

        // 模块
        map.put("import", TokenType.KW_IMPORT);
        map.put("package", TokenType.KW_PACKAGE);
        map.put("module", TokenType.KW_MODULE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合（供 LSP 等外部工具使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表
     *
     * <p>结果总是以唯一一个 EOF 结尾；同一个 Lexer 重复调用返回同一结果。</p>
     *
     * @throws LexerException 第一个词法错误
     */
    public List<Token> scanTokens() {
        if (!scanned) {
            while (!isAtEnd()) {
                start = current;
                startLine = line;
                startColumn = column;
                scanToken();
            }
            tokens.add(new Token(TokenType.EOF, "", LiteralValue.NONE, line, column, current));
            scanned = true;
        }
        return Collections.unmodifiableList(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.BIT_NOT); break;

            // 可能是多字符的 Token，总是先尝试最长匹配
            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else if (match('.')) {
                    addToken(TokenType.RANGE);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case ':':
                addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('*')) {
                    addToken(match('=') ? TokenType.POWER_ASSIGN : TokenType.POWER);
                } else {
                    addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                }
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    // 多行注释
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '=':
                if (match('=')) addToken(TokenType.EQ);
                else if (match('>')) addToken(TokenType.DOUBLE_ARROW);
                else addToken(TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                if (peek() == '=' && peekNext() == '>') {
                    advance();
                    advance();
                    addToken(TokenType.SPACESHIP);
                } else if (match('=')) {
                    addToken(TokenType.LE);
                } else if (match('<')) {
                    addToken(match('=') ? TokenType.SHL_ASSIGN : TokenType.SHL);
                } else {
                    addToken(TokenType.LT);
                }
                break;

            case '>':
                if (match('=')) {
                    addToken(TokenType.GE);
                } else if (match('>')) {
                    if (match('>')) {
                        addToken(match('=') ? TokenType.USHR_ASSIGN : TokenType.USHR);
                    } else {
                        addToken(match('=') ? TokenType.SHR_ASSIGN : TokenType.SHR);
                    }
                } else {
                    addToken(TokenType.GT);
                }
                break;

            case '&':
                if (match('&')) addToken(TokenType.AND);
                else if (match('=')) addToken(TokenType.BIT_AND_ASSIGN);
                else addToken(TokenType.BIT_AND);
                break;

            case '|':
                if (match('|')) addToken(TokenType.OR);
                else if (match('=')) addToken(TokenType.BIT_OR_ASSIGN);
                else addToken(TokenType.BIT_OR);
                break;

            case '^':
                addToken(match('=') ? TokenType.BIT_XOR_ASSIGN : TokenType.BIT_XOR);
                break;

            case '?':
                if (match('?')) {
                    addToken(match('=') ? TokenType.NULL_COALESCE_ASSIGN : TokenType.NULL_COALESCE);
                } else {
                    addToken(TokenType.QUESTION);
                }
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
            case '\n':
                break;

            // 字符串
            case '"':
                if (peek() == '"' && peekNext() == '"') {
                    advance(); // 消耗第二个 "
                    advance(); // 消耗第三个 "
                    multilineString();
                } else {
                    string();
                }
                break;

            // 字符
            case '\'':
                character();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error(LexerException.Kind.INVALID_CHARACTER,
                            "Unexpected character '" + c + "'", startLine, startColumn);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, LiteralValue.NONE);
    }

    private void addToken(TokenType type, LiteralValue literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    private LexerException error(LexerException.Kind kind, String message, int atLine, int atColumn) {
        return new LexerException(kind, message, fileName, atLine, atColumn);
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"') {
            if (isAtEnd() || peek() == '\n') {
                throw error(LexerException.Kind.UNTERMINATED_STRING,
                        "Unterminated string", startLine, startColumn);
            }
            if (peek() == '\\') {
                appendEscape(value);
            } else {
                value.append(advance());
            }
        }
        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, LiteralValue.ofString(value.toString()));
    }

    /** 三引号字符串：原样保留内容，可跨行 */
    private void multilineString() {
        while (!isAtEnd()) {
            if (peek() == '"' && peekNext() == '"'
                    && current + 2 < source.length() && source.charAt(current + 2) == '"') {
                advance();
                advance();
                advance();
                String value = source.substring(start + 3, current - 3);
                addToken(TokenType.STRING_LITERAL, LiteralValue.ofString(value));
                return;
            }
            advance();
        }
        throw error(LexerException.Kind.UNTERMINATED_STRING,
                "Unterminated multiline string", startLine, startColumn);
    }

    /**
     * 解码一个转义序列（当前位于反斜杠），追加到 out
     */
    private void appendEscape(StringBuilder out) {
        int escLine = line;
        int escColumn = column;
        advance(); // 反斜杠
        if (isAtEnd()) {
            throw error(LexerException.Kind.INVALID_ESCAPE_SEQUENCE,
                    "Incomplete escape sequence", escLine, escColumn);
        }
        char c = advance();
        switch (c) {
            case 'n': out.append('\n'); return;
            case 't': out.append('\t'); return;
            case 'r': out.append('\r'); return;
            case '0': out.append('\0'); return;
            case '\\': out.append('\\'); return;
            case '"': out.append('"'); return;
            case '\'': out.append('\''); return;
            case 'u': out.appendCodePoint(unicodeEscape(escLine, escColumn)); return;
            default:
                throw error(LexerException.Kind.INVALID_ESCAPE_SEQUENCE,
                        "Invalid escape sequence '\\" + c + "'", escLine, escColumn);
        }
    }

    /** \\uXXXX 或 \\u{X...}（1-6 位） */
    private int unicodeEscape(int escLine, int escColumn) {
        StringBuilder hex = new StringBuilder();
        if (match('{')) {
            while (isHexDigit(peek()) && hex.length() < 6) hex.append(advance());
            if (!match('}') || hex.length() == 0) {
                throw error(LexerException.Kind.INVALID_ESCAPE_SEQUENCE,
                        "Invalid unicode escape", escLine, escColumn);
            }
        } else {
            for (int i = 0; i < 4; i++) {
                if (!isHexDigit(peek())) {
                    throw error(LexerException.Kind.INVALID_ESCAPE_SEQUENCE,
                            "Invalid unicode escape: \\u" + hex, escLine, escColumn);
                }
                hex.append(advance());
            }
        }
        int codePoint = Integer.parseInt(hex.toString(), 16);
        if (!Character.isValidCodePoint(codePoint)) {
            throw error(LexerException.Kind.INVALID_ESCAPE_SEQUENCE,
                    "Invalid unicode code point: " + hex, escLine, escColumn);
        }
        return codePoint;
    }

    private void character() {
        if (isAtEnd() || peek() == '\n') {
            throw error(LexerException.Kind.UNTERMINATED_CHAR,
                    "Unterminated character literal", startLine, startColumn);
        }
        if (peek() == '\'') {
            throw error(LexerException.Kind.INVALID_CHAR_LITERAL,
                    "Empty character literal", startLine, startColumn);
        }

        StringBuilder value = new StringBuilder(2);
        if (peek() == '\\') {
            appendEscape(value);
        } else {
            char c = advance();
            value.append(c);
            if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                value.append(advance());
            }
        }

        if (isAtEnd() || peek() == '\n') {
            throw error(LexerException.Kind.UNTERMINATED_CHAR,
                    "Unterminated character literal", startLine, startColumn);
        }
        if (peek() != '\'' || value.codePointCount(0, value.length()) != 1) {
            throw error(LexerException.Kind.INVALID_CHAR_LITERAL,
                    "Character literal must contain exactly one character", startLine, startColumn);
        }
        advance(); // 闭合的 '

        addToken(TokenType.CHAR_LITERAL, LiteralValue.ofChar(value.codePointAt(0)));
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        // 检查进制
        if (source.charAt(start) == '0') {
            char next = Character.toLowerCase(peek());
            if (next == 'x') {
                radixNumber(16);
                return;
            } else if (next == 'b') {
                radixNumber(2);
                return;
            } else if (next == 'o') {
                radixNumber(8);
                return;
            }
        }

        advanceDigits();
        boolean isFloat = false;

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            advanceDigits();
            isFloat = true;
        }

        // 指数部分（仅当后面确实跟着数字）
        if ((peek() == 'e' || peek() == 'E') && startsExponent()) {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            advanceDigits();
            isFloat = true;
        }

        rejectTrailingIdentifier();
        String text = stripUnderscores(source.substring(start, current));
        if (isFloat) {
            parseAndAddFloat(text);
        } else {
            parseAndAddInteger(text, 10);
        }
    }

    private boolean startsExponent() {
        char next = peekNext();
        if (isDigit(next)) return true;
        return (next == '+' || next == '-')
                && current + 2 < source.length() && isDigit(source.charAt(current + 2));
    }

    private void radixNumber(int radix) {
        advance(); // 消费 'x' / 'b' / 'o'
        while (isRadixDigit(peek(), radix) || peek() == '_') advance();

        rejectTrailingIdentifier();
        String text = stripUnderscores(source.substring(start + 2, current));
        if (text.isEmpty()) {
            throw error(LexerException.Kind.INVALID_NUMBER,
                    "Missing digits in number literal: " + source.substring(start, current),
                    startLine, startColumn);
        }
        parseAndAddInteger(text, radix);
    }

    private static boolean isRadixDigit(char c, int radix) {
        switch (radix) {
            case 2: return c == '0' || c == '1';
            case 8: return c >= '0' && c <= '7';
            default: return isHexDigit(c);
        }
    }

    /** 数字后紧跟字母或数字（如 123abc、0b102）视为非法数字 */
    private void rejectTrailingIdentifier() {
        if (isAlphaNumeric(peek())) {
            while (isAlphaNumeric(peek())) advance();
            throw error(LexerException.Kind.INVALID_NUMBER,
                    "Invalid number literal: " + source.substring(start, current),
                    startLine, startColumn);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            addToken(TokenType.IDENTIFIER, LiteralValue.ofString(text));
            return;
        }
        switch (type) {
            case KW_TRUE: addToken(type, LiteralValue.TRUE); break;
            case KW_FALSE: addToken(type, LiteralValue.FALSE); break;
            default: addToken(type); break;
        }
    }

    /** 块注释不嵌套：第一个 *\/ 即结束 */
    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw error(LexerException.Kind.UNTERMINATED_BLOCK_COMMENT,
                "Unterminated block comment", line, column);
    }

    // ========== 数字解析辅助方法（统一溢出错误处理）==========

    private void parseAndAddInteger(String text, int radix) {
        try {
            addToken(TokenType.INT_LITERAL, LiteralValue.ofInteger(Long.parseLong(text, radix)));
        } catch (NumberFormatException e) {
            throw error(LexerException.Kind.INVALID_NUMBER,
                    "Invalid integer literal: " + source.substring(start, current), startLine, startColumn);
        }
    }

    private void parseAndAddFloat(String text) {
        try {
            addToken(TokenType.FLOAT_LITERAL, LiteralValue.ofFloat(Double.parseDouble(text)));
        } catch (NumberFormatException e) {
            throw error(LexerException.Kind.INVALID_NUMBER,
                    "Invalid float literal: " + source.substring(start, current), startLine, startColumn);
        }
    }
}
