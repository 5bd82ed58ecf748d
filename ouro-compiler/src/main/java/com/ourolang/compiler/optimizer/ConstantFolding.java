package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.expr.BinaryExpr;
import com.ourolang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.ourolang.compiler.ast.expr.Expression;
import com.ourolang.compiler.ast.expr.GroupingExpr;
import com.ourolang.compiler.ast.expr.Literal;
import com.ourolang.compiler.ast.expr.UnaryExpr;
import com.ourolang.compiler.lexer.LiteralValue;
import com.ourolang.compiler.lexer.LiteralValue.Kind;

import java.util.List;

/**
 * 常量折叠。
 *
 * <p>整数按 Int（32 位，溢出回绕）计算，任一操作数超出 32 位时按 64 位计算；
 * 含浮点操作数时按 Double 计算。除数为零、结果非有限值时不折叠。
 * 折叠出的字面量使用被折叠表达式的源码位置。</p>
 */
public class ConstantFolding extends AstTransformer implements OptimizationPass {

    @Override
    public String getName() {
        return "ConstantFolding";
    }

    @Override
    public List<Declaration> run(List<Declaration> declarations) {
        return transformDecls(declarations);
    }

    @Override
    protected Expression transformExpr(Expression expr) {
        Expression result = super.transformExpr(expr);
        Expression folded = null;
        if (result instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) result;
            if (bin.getLeft() instanceof Literal && bin.getRight() instanceof Literal) {
                folded = foldBinary((Literal) bin.getLeft(), bin.getOperator(), (Literal) bin.getRight(),
                        bin.getLocation());
            }
        } else if (result instanceof UnaryExpr) {
            UnaryExpr un = (UnaryExpr) result;
            if (un.getOperand() instanceof Literal) {
                folded = foldUnary(un.getOperator(), (Literal) un.getOperand(), un.getLocation());
            }
        } else if (result instanceof GroupingExpr) {
            GroupingExpr g = (GroupingExpr) result;
            if (g.getExpression() instanceof Literal) {
                folded = new Literal(g.getLocation(), ((Literal) g.getExpression()).getValue());
            }
        }
        return folded != null ? typed(folded, result) : result;
    }

    // ==================== 二元 ====================

    private Expression foldBinary(Literal left, BinaryOp op, Literal right, SourceLocation loc) {
        Kind lk = left.getKind();
        Kind rk = right.getKind();

        // 字符串
        if (lk == Kind.STRING && rk == Kind.STRING) {
            String l = left.getValue().asString();
            String r = right.getValue().asString();
            if (op == BinaryOp.ADD) {
                return literal(loc, LiteralValue.ofString(l + r));
            }
            return compare(l.compareTo(r), op, loc);
        }

        // 逻辑运算
        if (lk == Kind.BOOLEAN && rk == Kind.BOOLEAN) {
            boolean l = left.getValue().asBoolean();
            boolean r = right.getValue().asBoolean();
            switch (op) {
                case AND: return bool(loc, l && r);
                case OR:  return bool(loc, l || r);
                case EQ:  return bool(loc, l == r);
                case NE:  return bool(loc, l != r);
                default:  return null;
            }
        }

        if (lk == Kind.CHARACTER && rk == Kind.CHARACTER) {
            return compare(Integer.compare(left.getValue().asCodePoint(), right.getValue().asCodePoint()), op, loc);
        }

        if (!isNumeric(lk) || !isNumeric(rk)) {
            return null;
        }
        if (op.isRelational() || op == BinaryOp.EQ || op == BinaryOp.NE) {
            int cmp = lk == Kind.INTEGER && rk == Kind.INTEGER
                    ? Long.compare(left.getValue().asInteger(), right.getValue().asInteger())
                    : Double.compare(toDouble(left), toDouble(right));
            return compare(cmp, op, loc);
        }
        if (lk == Kind.FLOAT || rk == Kind.FLOAT) {
            return foldDouble(toDouble(left), op, toDouble(right), loc);
        }
        long l = left.getValue().asInteger();
        long r = right.getValue().asInteger();
        return fitsInt(l) && fitsInt(r) ? foldInt((int) l, op, (int) r, loc) : foldLong(l, op, r, loc);
    }

    private Expression foldInt(int l, BinaryOp op, int r, SourceLocation loc) {
        if ((op == BinaryOp.DIV || op == BinaryOp.MOD) && r == 0) return null;
        int res;
        switch (op) {
            case ADD: res = l + r; break;
            case SUB: res = l - r; break;
            case MUL: res = l * r; break;
            case DIV: res = l / r; break;
            case MOD: res = l % r; break;
            case POW:
                if (r < 0) return null;
                res = 1;
                for (int base = l, e = r; e > 0; e >>= 1, base *= base) {
                    if ((e & 1) != 0) res *= base;
                }
                break;
            case BIT_AND: res = l & r; break;
            case BIT_OR:  res = l | r; break;
            case BIT_XOR: res = l ^ r; break;
            case SHL:  res = l << r; break;
            case SHR:  res = l >> r; break;
            case USHR: res = l >>> r; break;
            default: return null;
        }
        return literal(loc, LiteralValue.ofInteger(res));
    }

    private Expression foldLong(long l, BinaryOp op, long r, SourceLocation loc) {
        if ((op == BinaryOp.DIV || op == BinaryOp.MOD) && r == 0) return null;
        long res;
        switch (op) {
            case ADD: res = l + r; break;
            case SUB: res = l - r; break;
            case MUL: res = l * r; break;
            case DIV: res = l / r; break;
            case MOD: res = l % r; break;
            case POW:
                if (r < 0) return null;
                res = 1;
                for (long base = l, e = r; e > 0; e >>= 1, base *= base) {
                    if ((e & 1) != 0) res *= base;
                }
                break;
            case BIT_AND: res = l & r; break;
            case BIT_OR:  res = l | r; break;
            case BIT_XOR: res = l ^ r; break;
            case SHL:  res = l << r; break;
            case SHR:  res = l >> r; break;
            case USHR: res = l >>> r; break;
            default: return null;
        }
        return literal(loc, LiteralValue.ofInteger(res));
    }

    private Expression foldDouble(double l, BinaryOp op, double r, SourceLocation loc) {
        if ((op == BinaryOp.DIV || op == BinaryOp.MOD) && r == 0.0) return null;
        double res;
        switch (op) {
            case ADD: res = l + r; break;
            case SUB: res = l - r; break;
            case MUL: res = l * r; break;
            case DIV: res = l / r; break;
            case MOD: res = l % r; break;
            case POW: res = Math.pow(l, r); break;
            default: return null;
        }
        if (Double.isNaN(res) || Double.isInfinite(res)) return null;
        return literal(loc, LiteralValue.ofFloat(res));
    }

    private Expression compare(int cmp, BinaryOp op, SourceLocation loc) {
        switch (op) {
            case EQ: return bool(loc, cmp == 0);
            case NE: return bool(loc, cmp != 0);
            case LT: return bool(loc, cmp < 0);
            case GT: return bool(loc, cmp > 0);
            case LE: return bool(loc, cmp <= 0);
            case GE: return bool(loc, cmp >= 0);
            case COMPARE: return literal(loc, LiteralValue.ofInteger(Integer.signum(cmp)));
            default: return null;
        }
    }

    // ==================== 一元 ====================

    private Expression foldUnary(UnaryExpr.UnaryOp op, Literal operand, SourceLocation loc) {
        Kind kind = operand.getKind();
        switch (op) {
            case POS:
                return isNumeric(kind) ? literal(loc, operand.getValue()) : null;
            case NEG:
                if (kind == Kind.FLOAT) {
                    return literal(loc, LiteralValue.ofFloat(-operand.getValue().asFloat()));
                }
                if (kind == Kind.INTEGER) {
                    long v = operand.getValue().asInteger();
                    return literal(loc, LiteralValue.ofInteger(fitsInt(v) ? -(int) v : -v));
                }
                return null;
            case NOT:
                return kind == Kind.BOOLEAN ? bool(loc, !operand.getValue().asBoolean()) : null;
            case BIT_NOT:
                if (kind != Kind.INTEGER) return null;
                long v = operand.getValue().asInteger();
                return literal(loc, LiteralValue.ofInteger(fitsInt(v) ? ~(int) v : ~v));
            default:
                return null;
        }
    }

    // ==================== 辅助 ====================

    private static boolean isNumeric(Kind kind) {
        return kind == Kind.INTEGER || kind == Kind.FLOAT;
    }

    private static boolean fitsInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    private static double toDouble(Literal lit) {
        return lit.getKind() == Kind.FLOAT ? lit.getValue().asFloat() : (double) lit.getValue().asInteger();
    }

    private static Literal literal(SourceLocation loc, LiteralValue value) {
        return new Literal(loc, value);
    }

    private static Literal bool(SourceLocation loc, boolean value) {
        return new Literal(loc, LiteralValue.ofBoolean(value));
    }
}
