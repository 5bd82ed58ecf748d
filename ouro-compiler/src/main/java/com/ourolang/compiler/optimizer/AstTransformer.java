package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.ast.expr.*;
import com.ourolang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点；输入树不会被修改。
 * 子类覆盖 transformExpr / transformStmt 实现优化 pass。
 */
public class AstTransformer {

    // ==================== 声明 ====================

    protected List<Declaration> transformDecls(List<Declaration> decls) {
        if (decls == null || decls.isEmpty()) return decls;
        List<Declaration> result = null;
        for (int i = 0; i < decls.size(); i++) {
            Declaration original = decls.get(i);
            Declaration transformed = transformDecl(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(decls.size());
                for (int j = 0; j < i; j++) result.add(decls.get(j));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : decls;
    }

    protected Declaration transformDecl(Declaration decl) {
        if (decl instanceof FunctionDecl) return transformFunction((FunctionDecl) decl);
        if (decl instanceof VarDecl) return transformVar((VarDecl) decl);
        if (decl instanceof ClassDecl) {
            ClassDecl cd = (ClassDecl) decl;
            List<VarDecl> props = transformVars(cd.getProperties());
            List<FunctionDecl> methods = transformFunctions(cd.getMethods());
            if (props == cd.getProperties() && methods == cd.getMethods()) return decl;
            return named(new ClassDecl(cd.getLocation(), cd.getModifiers(), cd.getName(), cd.getTypeParams(),
                    cd.getSuperclass(), cd.getInterfaces(), cd.getPermittedSubclasses(), props, methods), cd);
        }
        if (decl instanceof StructDecl) {
            StructDecl sd = (StructDecl) decl;
            List<VarDecl> props = transformVars(sd.getProperties());
            List<FunctionDecl> methods = transformFunctions(sd.getMethods());
            if (props == sd.getProperties() && methods == sd.getMethods()) return decl;
            return named(new StructDecl(sd.getLocation(), sd.getModifiers(), sd.getName(), sd.getTypeParams(),
                    sd.getInterfaces(), props, methods), sd);
        }
        if (decl instanceof EnumDecl) {
            EnumDecl ed = (EnumDecl) decl;
            List<EnumCase> cases = transformCases(ed.getCases());
            List<FunctionDecl> methods = transformFunctions(ed.getMethods());
            if (cases == ed.getCases() && methods == ed.getMethods()) return decl;
            return named(new EnumDecl(ed.getLocation(), ed.getModifiers(), ed.getName(), ed.getRawType(),
                    cases, methods), ed);
        }
        if (decl instanceof InterfaceDecl) {
            InterfaceDecl id = (InterfaceDecl) decl;
            List<FunctionDecl> methods = transformFunctions(id.getMethods());
            if (methods == id.getMethods()) return decl;
            return named(new InterfaceDecl(id.getLocation(), id.getModifiers(), id.getName(), id.getTypeParams(),
                    id.getInterfaces(), methods), id);
        }
        return decl;
    }

    protected FunctionDecl transformFunction(FunctionDecl fd) {
        List<Parameter> params = null;
        for (int i = 0; i < fd.getParams().size(); i++) {
            Parameter p = fd.getParams().get(i);
            Expression def = transformExpr(p.getDefaultValue());
            if (def != p.getDefaultValue() && params == null) {
                params = new ArrayList<>(fd.getParams().subList(0, i));
            }
            if (params != null) {
                params.add(def == p.getDefaultValue() ? p : new Parameter(p.getLocation(), p.getName(), p.getType(), def));
            }
        }
        Statement body = fd.getBody() != null ? transformStmt(fd.getBody()) : null;
        Block newBody = body == null || body instanceof Block
                ? (Block) body
                : new Block(fd.getBody().getLocation(), single(body));
        if (newBody == null && fd.getBody() != null) {
            newBody = new Block(fd.getBody().getLocation(), new ArrayList<Statement>());
        }
        if (params == null && newBody == fd.getBody()) return fd;
        return named(new FunctionDecl(fd.getLocation(), fd.getModifiers(), fd.getName(), fd.getTypeParams(),
                params != null ? params : fd.getParams(), fd.getReturnType(), newBody), fd);
    }

    protected VarDecl transformVar(VarDecl var) {
        Expression init = transformExpr(var.getInitializer());
        if (init == var.getInitializer()) return var;
        return named(new VarDecl(var.getLocation(), var.getModifiers(), var.getName(), var.isConstant(),
                var.getTypeAnnotation(), init), var);
    }

    private List<VarDecl> transformVars(List<VarDecl> vars) {
        List<VarDecl> result = null;
        for (int i = 0; i < vars.size(); i++) {
            VarDecl transformed = transformVar(vars.get(i));
            if (transformed != vars.get(i) && result == null) {
                result = new ArrayList<>(vars.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : vars;
    }

    private List<FunctionDecl> transformFunctions(List<FunctionDecl> functions) {
        List<FunctionDecl> result = null;
        for (int i = 0; i < functions.size(); i++) {
            FunctionDecl transformed = transformFunction(functions.get(i));
            if (transformed != functions.get(i) && result == null) {
                result = new ArrayList<>(functions.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : functions;
    }

    private List<EnumCase> transformCases(List<EnumCase> cases) {
        List<EnumCase> result = null;
        for (int i = 0; i < cases.size(); i++) {
            EnumCase ec = cases.get(i);
            Expression raw = transformExpr(ec.getRawValue());
            if (raw != ec.getRawValue() && result == null) {
                result = new ArrayList<>(cases.subList(0, i));
            }
            if (result != null) {
                result.add(raw == ec.getRawValue() ? ec : new EnumCase(ec.getLocation(), ec.getName(), raw));
            }
        }
        return result != null ? result : cases;
    }

    /** 新声明沿用原声明的名称位置 */
    private static <T extends Declaration> T named(T copy, Declaration original) {
        copy.setNameLocation(original.getNameLocation());
        return copy;
    }

    // ==================== 语句 ====================

    /**
     * 变换语句；返回 null 表示删除该语句（仅在语句列表中有效）
     */
    protected Statement transformStmt(Statement stmt) {
        if (stmt == null) return null;
        if (stmt instanceof ExpressionStmt) {
            ExpressionStmt es = (ExpressionStmt) stmt;
            Expression expr = transformExpr(es.getExpression());
            if (expr == es.getExpression()) return stmt;
            return new ExpressionStmt(es.getLocation(), expr);
        }
        if (stmt instanceof DeclarationStmt) {
            DeclarationStmt ds = (DeclarationStmt) stmt;
            VarDecl var = transformVar(ds.getDeclaration());
            if (var == ds.getDeclaration()) return stmt;
            return new DeclarationStmt(ds.getLocation(), var);
        }
        if (stmt instanceof ReturnStmt) {
            ReturnStmt ret = (ReturnStmt) stmt;
            Expression value = transformExpr(ret.getValue());
            if (value == ret.getValue()) return stmt;
            return new ReturnStmt(ret.getLocation(), value);
        }
        if (stmt instanceof IfStmt) {
            IfStmt is = (IfStmt) stmt;
            Expression cond = transformExpr(is.getCondition());
            Statement then = orEmpty(transformStmt(is.getThenBranch()), is.getThenBranch());
            Statement els = is.getElseBranch() != null
                    ? orEmpty(transformStmt(is.getElseBranch()), is.getElseBranch()) : null;
            if (cond == is.getCondition() && then == is.getThenBranch()
                    && els == is.getElseBranch()) return stmt;
            return new IfStmt(is.getLocation(), cond, then, els);
        }
        if (stmt instanceof WhileStmt) {
            WhileStmt ws = (WhileStmt) stmt;
            Expression cond = transformExpr(ws.getCondition());
            Statement body = orEmpty(transformStmt(ws.getBody()), ws.getBody());
            if (cond == ws.getCondition() && body == ws.getBody()) return stmt;
            return new WhileStmt(ws.getLocation(), cond, body);
        }
        if (stmt instanceof ForStmt) {
            ForStmt fs = (ForStmt) stmt;
            Statement init = transformStmt(fs.getInitializer());
            Expression cond = transformExpr(fs.getCondition());
            Expression incr = transformExpr(fs.getIncrement());
            Statement body = orEmpty(transformStmt(fs.getBody()), fs.getBody());
            if (init == fs.getInitializer() && cond == fs.getCondition()
                    && incr == fs.getIncrement() && body == fs.getBody()) return stmt;
            return new ForStmt(fs.getLocation(), init, cond, incr, body);
        }
        if (stmt instanceof Block) {
            Block blk = (Block) stmt;
            List<Statement> stmts = transformStmts(blk.getStatements());
            if (stmts == blk.getStatements()) return stmt;
            return new Block(blk.getLocation(), stmts);
        }
        // BreakStmt / ContinueStmt 为叶节点
        return stmt;
    }

    protected List<Statement> transformStmts(List<Statement> stmts) {
        if (stmts == null || stmts.isEmpty()) return stmts;
        List<Statement> result = null;
        for (int i = 0; i < stmts.size(); i++) {
            Statement original = stmts.get(i);
            Statement transformed = transformStmt(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(stmts.size());
                for (int j = 0; j < i; j++) result.add(stmts.get(j));
            }
            if (result != null && transformed != null) result.add(transformed);
        }
        return result != null ? result : stmts;
    }

    /** 被删除的分支 / 循环体以空块代替 */
    private static Statement orEmpty(Statement transformed, Statement original) {
        return transformed != null ? transformed : new Block(original.getLocation(), new ArrayList<Statement>());
    }

    private static List<Statement> single(Statement stmt) {
        List<Statement> list = new ArrayList<>(1);
        list.add(stmt);
        return list;
    }

    // ==================== 表达式 ====================

    protected Expression transformExpr(Expression expr) {
        if (expr == null) return null;
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            Expression left = transformExpr(bin.getLeft());
            Expression right = transformExpr(bin.getRight());
            if (left == bin.getLeft() && right == bin.getRight()) return expr;
            return typed(new BinaryExpr(bin.getLocation(), left, bin.getOperator(), right), expr);
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr un = (UnaryExpr) expr;
            Expression operand = transformExpr(un.getOperand());
            if (operand == un.getOperand()) return expr;
            return typed(new UnaryExpr(un.getLocation(), un.getOperator(), operand), expr);
        }
        if (expr instanceof GroupingExpr) {
            GroupingExpr g = (GroupingExpr) expr;
            Expression inner = transformExpr(g.getExpression());
            if (inner == g.getExpression()) return expr;
            return typed(new GroupingExpr(g.getLocation(), inner), expr);
        }
        if (expr instanceof AssignExpr) {
            AssignExpr ae = (AssignExpr) expr;
            Expression target = transformExpr(ae.getTarget());
            Expression value = transformExpr(ae.getValue());
            if (target == ae.getTarget() && value == ae.getValue()) return expr;
            return typed(new AssignExpr(ae.getLocation(), target, ae.getOperator(), value), expr);
        }
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            Expression callee = transformExpr(call.getCallee());
            List<Expression> args = transformExprs(call.getArguments());
            if (callee == call.getCallee() && args == call.getArguments()) return expr;
            return typed(new CallExpr(call.getLocation(), callee, args), expr);
        }
        if (expr instanceof GetExpr) {
            GetExpr get = (GetExpr) expr;
            Expression object = transformExpr(get.getObject());
            if (object == get.getObject()) return expr;
            return typed(new GetExpr(get.getLocation(), object, get.getName()), expr);
        }
        if (expr instanceof SetExpr) {
            SetExpr set = (SetExpr) expr;
            Expression object = transformExpr(set.getObject());
            Expression value = transformExpr(set.getValue());
            if (object == set.getObject() && value == set.getValue()) return expr;
            return typed(new SetExpr(set.getLocation(), object, set.getName(), set.getOperator(), value), expr);
        }
        if (expr instanceof IndexExpr) {
            IndexExpr idx = (IndexExpr) expr;
            Expression target = transformExpr(idx.getTarget());
            Expression index = transformExpr(idx.getIndex());
            if (target == idx.getTarget() && index == idx.getIndex()) return expr;
            return typed(new IndexExpr(idx.getLocation(), target, index), expr);
        }
        if (expr instanceof ArrayLiteralExpr) {
            ArrayLiteralExpr arr = (ArrayLiteralExpr) expr;
            List<Expression> elements = transformExprs(arr.getElements());
            if (elements == arr.getElements()) return expr;
            return typed(new ArrayLiteralExpr(arr.getLocation(), elements), expr);
        }
        if (expr instanceof ConditionalExpr) {
            ConditionalExpr ce = (ConditionalExpr) expr;
            Expression cond = transformExpr(ce.getCondition());
            Expression then = transformExpr(ce.getThenExpr());
            Expression els = transformExpr(ce.getElseExpr());
            if (cond == ce.getCondition() && then == ce.getThenExpr()
                    && els == ce.getElseExpr()) return expr;
            return typed(new ConditionalExpr(ce.getLocation(), cond, then, els), expr);
        }
        // Literal / VariableExpr / ThisExpr / SuperExpr 为叶节点
        return expr;
    }

    protected List<Expression> transformExprs(List<Expression> exprs) {
        if (exprs == null || exprs.isEmpty()) return exprs;
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression transformed = transformExpr(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(exprs.size());
                for (int j = 0; j < i; j++) result.add(exprs.get(j));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : exprs;
    }

    /** 新节点沿用原节点的推断类型 */
    protected static <T extends Expression> T typed(T copy, Expression original) {
        copy.setResolvedType(original.getResolvedType());
        return copy;
    }
}
