package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        POW("**"),

        // 位运算
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),
        SHL("<<"),
        SHR(">>"),
        USHR(">>>"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),
        COMPARE("<=>"),

        // 逻辑
        AND("&&"),
        OR("||"),

        // 空值合并
        NULL_COALESCE("??");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isArithmetic() {
            switch (this) {
                case ADD: case SUB: case MUL: case DIV: case MOD: case POW:
                    return true;
                default:
                    return false;
            }
        }

        public boolean isBitwise() {
            switch (this) {
                case BIT_AND: case BIT_OR: case BIT_XOR: case SHL: case SHR: case USHR:
                    return true;
                default:
                    return false;
            }
        }

        public boolean isRelational() {
            switch (this) {
                case LT: case GT: case LE: case GE: case COMPARE:
                    return true;
                default:
                    return false;
            }
        }
    }
}
