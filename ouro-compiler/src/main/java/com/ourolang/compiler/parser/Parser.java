package com.ourolang.compiler.parser;

import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.lexer.LiteralValue;
import com.ourolang.compiler.lexer.Token;
import com.ourolang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ourolang.compiler.lexer.TokenType.*;

/**
 * OuroLang 语法分析器（递归下降）
 *
 * <p>Parser 自身只负责 token 游标与错误恢复，具体语法由
 * {@link DeclParser}、{@link StmtParser}、{@link ExprParser}、{@link TypeParser} 处理。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    /** 可变副本：关闭泛型时需要把 {@code >>} 拆成两个 {@code >} */
    private final List<Token> tokens;
    final String fileName;
    private final int maxNestingDepth;

    private int position;
    private int depth;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens) {
        this(tokens, "<input>", DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(List<Token> tokens, String fileName) {
        this(tokens, fileName, DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(List<Token> tokens, String fileName, int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.tokens = new ArrayList<Token>(tokens);
        this.fileName = fileName;
        this.maxNestingDepth = maxNestingDepth;
        // 保证流以 EOF 结尾，游标永远不会越界
        if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).is(EOF)) {
            Token last = this.tokens.isEmpty() ? null : this.tokens.get(this.tokens.size() - 1);
            int line = last != null ? last.getLine() : 1;
            int column = last != null ? last.getColumn() + last.getLexeme().length() : 1;
            int offset = last != null ? last.getOffset() + last.getLexeme().length() : 0;
            this.tokens.add(new Token(EOF, "", LiteralValue.NONE, line, column, offset));
        }
        this.current = this.tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回刚消费的 token
     */
    Token advance() {
        previous = current;
        if (!current.is(EOF)) {
            position++;
            current = tokens.get(position);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 检查当前 token 是否为上下文关键字（以标识符形式出现，如 permits）
     */
    boolean checkContextual(String word) {
        return check(IDENTIFIER) && word.equals(current.getLexeme());
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 期望泛型的右尖括号；{@code >>}、{@code >>>}、{@code >=} 会被就地拆分
     */
    Token expectCloseAngle(String message) {
        splitCloseAngle();
        return expect(GT, message);
    }

    private void splitCloseAngle() {
        TokenType rest;
        switch (current.getType()) {
            case SHR: rest = GT; break;
            case USHR: rest = SHR; break;
            case GE: rest = ASSIGN; break;
            case SHR_ASSIGN: rest = GE; break;
            default: return;
        }
        Token t = current;
        Token head = new Token(GT, ">", LiteralValue.NONE, t.getLine(), t.getColumn(), t.getOffset());
        Token tail = new Token(rest, t.getLexeme().substring(1), LiteralValue.NONE,
                t.getLine(), t.getColumn() + 1, t.getOffset() + 1);
        tokens.set(position, head);
        tokens.add(position + 1, tail);
        current = head;
    }

    /**
     * 进入一层嵌套（表达式 / 语句），超过上限时报错
     */
    void enterNesting() {
        if (++depth > maxNestingDepth) {
            depth = 0;
            throw new ParseException(ParseException.Kind.NESTING_TOO_DEEP,
                    "Nesting exceeds maximum depth of " + maxNestingDepth, current, null);
        }
    }

    void exitNesting() {
        exitNesting(1);
    }

    void exitNesting(int levels) {
        depth = Math.max(0, depth - levels);
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 当前 token 是否可以开始一个声明
     */
    boolean isDeclarationStart() {
        return current.getType().isModifier()
                || checkAny(KW_CLASS, KW_STRUCT, KW_ENUM, KW_INTERFACE, KW_FUNC, KW_VAR, KW_CONST);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个 token 流，遇到第一个语法错误即抛出 {@link ParseException}
     */
    public List<Declaration> parse() {
        List<Declaration> declarations = new ArrayList<Declaration>();
        while (!isAtEnd()) {
            declarations.add(declParser.parseDeclaration());
        }
        return Collections.unmodifiableList(declarations);
    }

    /**
     * 容错解析：遇到错误时跳过到下一个声明继续解析。
     * 返回的 ParseResult 包含已成功解析的声明和收集到的错误列表。
     */
    public ParseResult parseTolerant() {
        List<Declaration> declarations = new ArrayList<Declaration>();
        List<ParseError> errors = new ArrayList<ParseError>();
        while (!isAtEnd()) {
            int start = position;
            try {
                declarations.add(declParser.parseDeclaration());
            } catch (ParseException e) {
                errors.add(ParseError.of(e));
                depth = 0;
                synchronize(start);
            }
        }
        return new ParseResult(declarations, errors);
    }

    /**
     * 错误恢复：跳过 token 直到回到顶层花括号深度，然后停在下一个声明起始处，
     * 或越过顶层的 {@code ;} / 闭合的 {@code }} 之后。
     */
    private void synchronize(int declarationStart) {
        int open = 0;
        for (int i = declarationStart; i < position; i++) {
            TokenType type = tokens.get(i).getType();
            if (type == LBRACE) open++;
            else if (type == RBRACE) open--;
        }
        boolean progressed = position > declarationStart;
        while (!isAtEnd()) {
            if (open <= 0 && progressed && isDeclarationStart()) {
                return;
            }
            Token skipped = advance();
            progressed = true;
            if (skipped.is(LBRACE)) {
                open++;
            } else if (skipped.is(RBRACE)) {
                if (--open <= 0) return;
            } else if (skipped.is(SEMICOLON) && open <= 0) {
                return;
            }
        }
    }
}
