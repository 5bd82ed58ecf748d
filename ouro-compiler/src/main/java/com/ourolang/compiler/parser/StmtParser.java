package com.ourolang.compiler.parser;

import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.VarDecl;
import com.ourolang.compiler.ast.expr.Expression;
import com.ourolang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ourolang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        parser.enterNesting();
        try {
            switch (parser.current.getType()) {
                case LBRACE: return parseBlock();
                case KW_IF: return parseIfStmt();
                case KW_WHILE: return parseWhileStmt();
                case KW_FOR: return parseForStmt();
                case KW_RETURN: return parseReturnStmt();
                case KW_BREAK: return parseBreakStmt();
                case KW_CONTINUE: return parseContinueStmt();
                case KW_VAR:
                case KW_CONST:
                    return parseDeclarationStmt();
                default:
                    return parseExpressionStmt();
            }
        } finally {
            parser.exitNesting();
        }
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }
        parser.expect(RBRACE, "Expected '}' after block");
        return new Block(loc, statements);
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '(' after 'if'");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after if condition");

        Statement thenBranch = parseStatement();
        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parseStatement();
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after while condition");
        Statement body = parseStatement();
        return new WhileStmt(loc, condition, body);
    }

    // for (init; condition; increment) body，三个子句均可省略
    private ForStmt parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '(' after 'for'");

        Statement initializer = null;
        if (parser.match(SEMICOLON)) {
            // 无初始化子句
        } else if (parser.checkAny(KW_VAR, KW_CONST)) {
            initializer = parseDeclarationStmt();
        } else {
            initializer = parseExpressionStmt();
        }

        Expression condition = null;
        if (!parser.check(SEMICOLON)) {
            condition = parser.exprParser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after loop condition");

        Expression increment = null;
        if (!parser.check(RPAREN)) {
            increment = parser.exprParser.parseExpression();
        }
        parser.expect(RPAREN, "Expected ')' after for clauses");

        Statement body = parseStatement();
        return new ForStmt(loc, initializer, condition, increment, body);
    }

    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.exprParser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after return value");
        return new ReturnStmt(loc, value);
    }

    private BreakStmt parseBreakStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_BREAK, "Expected 'break'");
        parser.expect(SEMICOLON, "Expected ';' after 'break'");
        return new BreakStmt(loc);
    }

    private ContinueStmt parseContinueStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_CONTINUE, "Expected 'continue'");
        parser.expect(SEMICOLON, "Expected ';' after 'continue'");
        return new ContinueStmt(loc);
    }

    private DeclarationStmt parseDeclarationStmt() {
        SourceLocation loc = parser.location();
        VarDecl decl = parser.declParser.parseVarDecl(Collections.<Modifier>emptyList());
        return new DeclarationStmt(loc, decl);
    }

    private ExpressionStmt parseExpressionStmt() {
        SourceLocation loc = parser.location();
        Expression expr = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after expression");
        return new ExpressionStmt(loc, expr);
    }
}
