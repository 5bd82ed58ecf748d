package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 赋值表达式，目标为变量或下标；属性赋值见 {@link SetExpr}
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }

    /**
     * 赋值运算符，复合赋值携带对应的二元运算
     */
    public enum AssignOp {
        ASSIGN("=", null),
        ADD_ASSIGN("+=", BinaryExpr.BinaryOp.ADD),
        SUB_ASSIGN("-=", BinaryExpr.BinaryOp.SUB),
        MUL_ASSIGN("*=", BinaryExpr.BinaryOp.MUL),
        DIV_ASSIGN("/=", BinaryExpr.BinaryOp.DIV),
        MOD_ASSIGN("%=", BinaryExpr.BinaryOp.MOD),
        POW_ASSIGN("**=", BinaryExpr.BinaryOp.POW),
        BIT_AND_ASSIGN("&=", BinaryExpr.BinaryOp.BIT_AND),
        BIT_OR_ASSIGN("|=", BinaryExpr.BinaryOp.BIT_OR),
        BIT_XOR_ASSIGN("^=", BinaryExpr.BinaryOp.BIT_XOR),
        SHL_ASSIGN("<<=", BinaryExpr.BinaryOp.SHL),
        SHR_ASSIGN(">>=", BinaryExpr.BinaryOp.SHR),
        USHR_ASSIGN(">>>=", BinaryExpr.BinaryOp.USHR),
        NULL_COALESCE_ASSIGN("??=", BinaryExpr.BinaryOp.NULL_COALESCE);

        private final String source;
        private final BinaryExpr.BinaryOp binaryOp;

        AssignOp(String source, BinaryExpr.BinaryOp binaryOp) {
            this.source = source;
            this.binaryOp = binaryOp;
        }

        public String toSourceString() {
            return source;
        }

        /** 复合赋值对应的二元运算，普通赋值返回 null */
        public BinaryExpr.BinaryOp getBinaryOp() {
            return binaryOp;
        }

        public boolean isCompound() {
            return binaryOp != null;
        }
    }
}
