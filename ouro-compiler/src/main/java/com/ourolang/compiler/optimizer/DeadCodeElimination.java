package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.expr.Expression;
import com.ourolang.compiler.ast.expr.Literal;
import com.ourolang.compiler.ast.stmt.*;
import com.ourolang.compiler.lexer.LiteralValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 死代码消除。
 * - return/break/continue 后的不可达代码
 * - 条件为字面量的 if 替换为实际执行的分支（由常量折叠先处理条件）
 * - while(false) 删除
 */
public class DeadCodeElimination extends AstTransformer implements OptimizationPass {

    @Override
    public String getName() {
        return "DeadCodeElimination";
    }

    @Override
    public List<Declaration> run(List<Declaration> declarations) {
        return transformDecls(declarations);
    }

    @Override
    protected Statement transformStmt(Statement stmt) {
        Statement result = super.transformStmt(stmt);

        if (result instanceof IfStmt) {
            IfStmt is = (IfStmt) result;
            Boolean cond = booleanLiteral(is.getCondition());
            if (cond != null) {
                // 未执行的 if 且无 else：删除
                Statement taken = cond ? is.getThenBranch() : is.getElseBranch();
                if (taken instanceof DeclarationStmt) {
                    // 保持变量只在原分支内可见
                    List<Statement> single = new ArrayList<>(1);
                    single.add(taken);
                    return new Block(taken.getLocation(), single);
                }
                return taken;
            }
            return result;
        }
        if (result instanceof WhileStmt) {
            Boolean cond = booleanLiteral(((WhileStmt) result).getCondition());
            return Boolean.FALSE.equals(cond) ? null : result;
        }
        if (!(result instanceof Block)) return result;

        Block block = (Block) result;
        List<Statement> stmts = block.getStatements();
        if (stmts.isEmpty()) return block;

        // 找到第一个终止语句（return/break/continue）
        int terminatorIndex = -1;
        for (int i = 0; i < stmts.size(); i++) {
            if (isTerminator(stmts.get(i))) {
                terminatorIndex = i;
                break;
            }
        }

        // 如果存在终止语句且后面还有语句，截断
        if (terminatorIndex >= 0 && terminatorIndex < stmts.size() - 1) {
            List<Statement> trimmed = new ArrayList<>(stmts.subList(0, terminatorIndex + 1));
            return new Block(block.getLocation(), trimmed);
        }

        return block;
    }

    private static boolean isTerminator(Statement stmt) {
        return stmt instanceof ReturnStmt
                || stmt instanceof BreakStmt
                || stmt instanceof ContinueStmt;
    }

    private static Boolean booleanLiteral(Expression expr) {
        if (expr instanceof Literal && ((Literal) expr).getKind() == LiteralValue.Kind.BOOLEAN) {
            return ((Literal) expr).getValue().asBoolean();
        }
        return null;
    }
}
