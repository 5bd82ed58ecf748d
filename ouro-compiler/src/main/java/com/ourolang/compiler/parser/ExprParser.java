package com.ourolang.compiler.parser;

import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.expr.*;
import com.ourolang.compiler.lexer.LiteralValue;
import com.ourolang.compiler.lexer.Token;
import com.ourolang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.ourolang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：赋值 → ?: → ?? → || → &amp;&amp; → | → ^ → &amp; → 相等 → 关系
 * → 移位 → 加减 → 乘除 → ** → 前缀 → 后缀 → 基本表达式。</p>
 *
 * <p>左结合链每多一个运算符，生成的语法树就深一层，因此链长也计入嵌套深度上限。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        parser.enterNesting();
        try {
            return parseAssignExpr();
        } finally {
            parser.exitNesting();
        }
    }

    // 赋值表达式（最低优先级，右结合）
    private Expression parseAssignExpr() {
        Expression left = parseConditionalExpr();

        if (parser.current.getType().isAssignmentOp()) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseExpression();  // 右结合

            AssignExpr.AssignOp assignOp = toAssignOp(op);
            if (left instanceof VariableExpr || left instanceof IndexExpr) {
                return new AssignExpr(loc, left, assignOp, right);
            }
            if (left instanceof GetExpr) {
                GetExpr get = (GetExpr) left;
                return new SetExpr(loc, get.getObject(), get.getName(), assignOp, right);
            }
            throw new ParseException("Invalid assignment target", op);
        }

        return left;
    }

    private static AssignExpr.AssignOp toAssignOp(Token op) {
        switch (op.getType()) {
            case ASSIGN: return AssignExpr.AssignOp.ASSIGN;
            case PLUS_ASSIGN: return AssignExpr.AssignOp.ADD_ASSIGN;
            case MINUS_ASSIGN: return AssignExpr.AssignOp.SUB_ASSIGN;
            case MUL_ASSIGN: return AssignExpr.AssignOp.MUL_ASSIGN;
            case DIV_ASSIGN: return AssignExpr.AssignOp.DIV_ASSIGN;
            case MOD_ASSIGN: return AssignExpr.AssignOp.MOD_ASSIGN;
            case POWER_ASSIGN: return AssignExpr.AssignOp.POW_ASSIGN;
            case BIT_AND_ASSIGN: return AssignExpr.AssignOp.BIT_AND_ASSIGN;
            case BIT_OR_ASSIGN: return AssignExpr.AssignOp.BIT_OR_ASSIGN;
            case BIT_XOR_ASSIGN: return AssignExpr.AssignOp.BIT_XOR_ASSIGN;
            case SHL_ASSIGN: return AssignExpr.AssignOp.SHL_ASSIGN;
            case SHR_ASSIGN: return AssignExpr.AssignOp.SHR_ASSIGN;
            case USHR_ASSIGN: return AssignExpr.AssignOp.USHR_ASSIGN;
            case NULL_COALESCE_ASSIGN: return AssignExpr.AssignOp.NULL_COALESCE_ASSIGN;
            default: throw new ParseException("Unexpected assignment operator", op);
        }
    }

    // 三元表达式 condition ? thenExpr : elseExpr（右结合）
    private Expression parseConditionalExpr() {
        Expression condition = parseNullCoalesceExpr();

        if (parser.match(QUESTION)) {
            SourceLocation loc = parser.previousLocation();
            Expression thenExpr = parseExpression();
            parser.expect(COLON, "Expected ':' in conditional expression");
            parser.enterNesting();
            try {
                Expression elseExpr = parseConditionalExpr();  // 右结合
                return new ConditionalExpr(loc, condition, thenExpr, elseExpr);
            } finally {
                parser.exitNesting();
            }
        }

        return condition;
    }

    // 空值合并 ??
    private Expression parseNullCoalesceExpr() {
        Expression left = parseOrExpr();
        int links = 0;
        try {
            while (parser.match(NULL_COALESCE)) {
                parser.enterNesting();
                links++;
                SourceLocation loc = parser.previousLocation();
                Expression right = parseOrExpr();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.NULL_COALESCE, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 逻辑或 ||
    private Expression parseOrExpr() {
        Expression left = parseAndExpr();
        int links = 0;
        try {
            while (parser.match(OR)) {
                parser.enterNesting();
                links++;
                SourceLocation loc = parser.previousLocation();
                Expression right = parseAndExpr();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 逻辑与 &&
    private Expression parseAndExpr() {
        Expression left = parseBitOrExpr();
        int links = 0;
        try {
            while (parser.match(AND)) {
                parser.enterNesting();
                links++;
                SourceLocation loc = parser.previousLocation();
                Expression right = parseBitOrExpr();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 按位或 |
    private Expression parseBitOrExpr() {
        Expression left = parseBitXorExpr();
        int links = 0;
        try {
            while (parser.match(BIT_OR)) {
                parser.enterNesting();
                links++;
                SourceLocation loc = parser.previousLocation();
                Expression right = parseBitXorExpr();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_OR, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 按位异或 ^
    private Expression parseBitXorExpr() {
        Expression left = parseBitAndExpr();
        int links = 0;
        try {
            while (parser.match(BIT_XOR)) {
                parser.enterNesting();
                links++;
                SourceLocation loc = parser.previousLocation();
                Expression right = parseBitAndExpr();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_XOR, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 按位与 &
    private Expression parseBitAndExpr() {
        Expression left = parseEqualityExpr();
        int links = 0;
        try {
            while (parser.match(BIT_AND)) {
                parser.enterNesting();
                links++;
                SourceLocation loc = parser.previousLocation();
                Expression right = parseEqualityExpr();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_AND, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 相等性 == !=
    private Expression parseEqualityExpr() {
        Expression left = parseRelationalExpr();
        int links = 0;
        try {
            while (parser.checkAny(EQ, NE)) {
                parser.enterNesting();
                links++;
                Token op = parser.advance();
                SourceLocation loc = parser.previousLocation();
                Expression right = parseRelationalExpr();
                BinaryExpr.BinaryOp binOp = op.is(EQ) ? BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE;
                left = new BinaryExpr(loc, left, binOp, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 关系 < <= > >= <=>
    private Expression parseRelationalExpr() {
        Expression left = parseShiftExpr();
        int links = 0;
        try {
            while (parser.checkAny(LT, LE, GT, GE, SPACESHIP)) {
                parser.enterNesting();
                links++;
                Token op = parser.advance();
                SourceLocation loc = parser.previousLocation();
                Expression right = parseShiftExpr();
                BinaryExpr.BinaryOp binOp;
                switch (op.getType()) {
                    case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                    case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                    case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                    case GE: binOp = BinaryExpr.BinaryOp.GE; break;
                    default: binOp = BinaryExpr.BinaryOp.COMPARE; break;
                }
                left = new BinaryExpr(loc, left, binOp, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 移位 << >> >>>
    private Expression parseShiftExpr() {
        Expression left = parseAdditiveExpr();
        int links = 0;
        try {
            while (parser.checkAny(SHL, SHR, USHR)) {
                parser.enterNesting();
                links++;
                Token op = parser.advance();
                SourceLocation loc = parser.previousLocation();
                Expression right = parseAdditiveExpr();
                BinaryExpr.BinaryOp binOp;
                switch (op.getType()) {
                    case SHL: binOp = BinaryExpr.BinaryOp.SHL; break;
                    case SHR: binOp = BinaryExpr.BinaryOp.SHR; break;
                    default: binOp = BinaryExpr.BinaryOp.USHR; break;
                }
                left = new BinaryExpr(loc, left, binOp, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();
        int links = 0;
        try {
            while (parser.checkAny(PLUS, MINUS)) {
                parser.enterNesting();
                links++;
                Token op = parser.advance();
                SourceLocation loc = parser.previousLocation();
                Expression right = parseMultiplicativeExpr();
                BinaryExpr.BinaryOp binOp = op.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
                left = new BinaryExpr(loc, left, binOp, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 乘除模 * / %
    private Expression parseMultiplicativeExpr() {
        Expression left = parsePowerExpr();
        int links = 0;
        try {
            while (parser.checkAny(MUL, DIV, MOD)) {
                parser.enterNesting();
                links++;
                Token op = parser.advance();
                SourceLocation loc = parser.previousLocation();
                Expression right = parsePowerExpr();
                BinaryExpr.BinaryOp binOp;
                switch (op.getType()) {
                    case MUL: binOp = BinaryExpr.BinaryOp.MUL; break;
                    case DIV: binOp = BinaryExpr.BinaryOp.DIV; break;
                    default: binOp = BinaryExpr.BinaryOp.MOD; break;
                }
                left = new BinaryExpr(loc, left, binOp, right);
            }
            return left;
        } finally {
            parser.exitNesting(links);
        }
    }

    // 乘方 **（右结合）
    private Expression parsePowerExpr() {
        Expression base = parseUnaryExpr();
        if (parser.match(POWER)) {
            SourceLocation loc = parser.previousLocation();
            parser.enterNesting();
            try {
                Expression exponent = parsePowerExpr();
                return new BinaryExpr(loc, base, BinaryExpr.BinaryOp.POW, exponent);
            } finally {
                parser.exitNesting();
            }
        }
        return base;
    }

    // 前缀 - + ! ~
    private Expression parseUnaryExpr() {
        if (parser.checkAny(MINUS, PLUS, NOT, BIT_NOT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            UnaryExpr.UnaryOp unaryOp;
            switch (op.getType()) {
                case MINUS: unaryOp = UnaryExpr.UnaryOp.NEG; break;
                case PLUS: unaryOp = UnaryExpr.UnaryOp.POS; break;
                case NOT: unaryOp = UnaryExpr.UnaryOp.NOT; break;
                default: unaryOp = UnaryExpr.UnaryOp.BIT_NOT; break;
            }
            parser.enterNesting();
            try {
                return new UnaryExpr(loc, unaryOp, parseUnaryExpr());
            } finally {
                parser.exitNesting();
            }
        }
        return parsePostfixExpr();
    }

    // 后缀：调用、成员访问、索引
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        int links = 0;
        try {
            while (true) {
                if (parser.match(LPAREN)) {
                    SourceLocation loc = parser.previousLocation();
                    List<Expression> args = new ArrayList<Expression>();
                    if (!parser.check(RPAREN)) {
                        do {
                            args.add(parseExpression());
                        } while (parser.match(COMMA));
                    }
                    parser.expect(RPAREN, "Expected ')' after arguments");
                    expr = new CallExpr(loc, expr, args);
                } else if (parser.match(DOT)) {
                    SourceLocation loc = parser.location();
                    String name = expectMemberName();
                    expr = new GetExpr(loc, expr, name);
                } else if (parser.match(LBRACKET)) {
                    SourceLocation loc = parser.previousLocation();
                    Expression index = parseExpression();
                    parser.expect(RBRACKET, "Expected ']' after index");
                    expr = new IndexExpr(loc, expr, index);
                } else {
                    break;
                }
                parser.enterNesting();
                links++;
            }
            return expr;
        } finally {
            parser.exitNesting(links);
        }
    }

    /**
     * 成员名：标识符或关键字（. 后允许关键字作为成员名，如 {@code x.init}）
     */
    private String expectMemberName() {
        if (parser.check(IDENTIFIER) || parser.current.getType().isKeyword()) {
            return parser.advance().getLexeme();
        }
        throw new ParseException("Expected member name after '.'", parser.current, "IDENTIFIER");
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();
        TokenType type = parser.current.getType();

        switch (type) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case STRING_LITERAL:
            case CHAR_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
                return new Literal(loc, parser.advance().getLiteral());
            case KW_NULL:
                parser.advance();
                return new Literal(loc, LiteralValue.NONE);
            case IDENTIFIER:
                return new VariableExpr(loc, parser.advance().getLexeme());
            case KW_THIS:
                parser.advance();
                return new ThisExpr(loc);
            case KW_SUPER: {
                parser.advance();
                parser.expect(DOT, "Expected '.' after 'super'");
                String member = expectMemberName();
                return new SuperExpr(loc, member);
            }
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')' after expression");
                return new GroupingExpr(loc, inner);
            }
            case LBRACKET:
                return parseArrayLiteral();
            default:
                throw new ParseException("Expected expression", parser.current);
        }
    }

    // [a, b, c]，允许末尾逗号
    private Expression parseArrayLiteral() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACKET, "Expected '['");
        List<Expression> elements = new ArrayList<Expression>();
        while (!parser.check(RBRACKET)) {
            elements.add(parseExpression());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACKET, "Expected ']' after array elements");
        return new ArrayLiteralExpr(loc, elements);
    }
}
