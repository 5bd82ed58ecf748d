package com.ourolang.compiler.formatter;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.ast.expr.*;
import com.ourolang.compiler.ast.stmt.*;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;
import com.ourolang.compiler.lexer.LiteralValue;

import java.util.List;

/**
 * OuroLang AST 代码格式化器
 *
 * <p>遍历 AST，按统一格式规则输出源码。输出可被重新解析，
 * 且再次格式化得到相同文本。</p>
 */
public class OuroFormatter implements AstVisitor<Void, FormatterContext> {

    /**
     * 格式化声明列表
     */
    public String format(List<Declaration> declarations, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        for (int i = 0; i < declarations.size(); i++) {
            declarations.get(i).accept(this, ctx);
            ctx.newLine();
            // 顶层声明之间空一行
            if (i < declarations.size() - 1) {
                ctx.newLine();
            }
        }
        return ctx.getOutput();
    }

    /**
     * 使用默认配置格式化
     */
    public String format(List<Declaration> declarations) {
        return format(declarations, new FormatConfig());
    }

    // ============ 声明 ============

    @Override
    public Void visitClassDecl(ClassDecl node, FormatterContext ctx) {
        formatModifiers(node.getModifiers(), ctx);
        ctx.append("class ");
        ctx.append(node.getName());
        formatTypeParams(node.getTypeParams(), ctx);

        // 父类必须排在第一位
        StringBuilder header = new StringBuilder();
        if (node.hasSuperclass()) {
            header.append(node.getSuperclass().getDisplayName());
        }
        for (TypeRef itf : node.getInterfaces()) {
            if (header.length() > 0) header.append(", ");
            header.append(itf.getDisplayName());
        }
        if (header.length() > 0) {
            ctx.append(": ");
            ctx.append(header.toString());
        }
        if (!node.getPermittedSubclasses().isEmpty()) {
            ctx.append(" permits ");
            ctx.append(String.join(", ", node.getPermittedSubclasses()));
        }
        formatTypeBody(node, ctx);
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, FormatterContext ctx) {
        formatModifiers(node.getModifiers(), ctx);
        ctx.append("struct ");
        ctx.append(node.getName());
        formatTypeParams(node.getTypeParams(), ctx);
        formatTypeList(node.getInterfaces(), ctx);
        formatTypeBody(node, ctx);
        return null;
    }

    @Override
    public Void visitInterfaceDecl(InterfaceDecl node, FormatterContext ctx) {
        formatModifiers(node.getModifiers(), ctx);
        ctx.append("interface ");
        ctx.append(node.getName());
        formatTypeParams(node.getTypeParams(), ctx);
        formatTypeList(node.getInterfaces(), ctx);
        formatTypeBody(node, ctx);
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, FormatterContext ctx) {
        formatModifiers(node.getModifiers(), ctx);
        ctx.append("enum ");
        ctx.append(node.getName());
        if (node.getRawType() != null) {
            ctx.append(": ");
            ctx.append(node.getRawType().getDisplayName());
        }
        if (node.getCases().isEmpty() && node.getMethods().isEmpty()) {
            ctx.append(" {}");
            return null;
        }
        ctx.append(" {");
        ctx.newLine();
        ctx.indent();
        for (EnumCase c : node.getCases()) {
            visitEnumCase(c, ctx);
            ctx.newLine();
        }
        formatMemberList(node.getMethods(), !node.getCases().isEmpty(), ctx);
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitEnumCase(EnumCase node, FormatterContext ctx) {
        ctx.append("case ");
        ctx.append(node.getName());
        if (node.hasRawValue()) {
            ctx.append(" = ");
            formatExpression(node.getRawValue(), ctx);
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, FormatterContext ctx) {
        formatModifiers(node.getModifiers(), ctx);
        if (node.isConstructor()) {
            ctx.append("init");
        } else {
            ctx.append("func ");
            ctx.append(node.getName());
            formatTypeParams(node.getTypeParams(), ctx);
        }

        ctx.append("(");
        List<Parameter> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) ctx.append(", ");
            visitParameter(params.get(i), ctx);
        }
        ctx.append(")");

        if (node.getReturnType() != null) {
            ctx.append(" -> ");
            ctx.append(node.getReturnType().getDisplayName());
        }

        if (node.hasBody()) {
            ctx.append(" ");
            formatBlock(node.getBody(), ctx);
        } else {
            ctx.append(";");
        }
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, FormatterContext ctx) {
        ctx.append(node.getName());
        ctx.append(": ");
        ctx.append(node.getType().getDisplayName());
        if (node.hasDefaultValue()) {
            ctx.append(" = ");
            formatExpression(node.getDefaultValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitVarDecl(VarDecl node, FormatterContext ctx) {
        formatModifiers(node.getModifiers(), ctx);
        ctx.append(node.isConstant() ? "const " : "var ");
        ctx.append(node.getName());
        if (node.getTypeAnnotation() != null) {
            ctx.append(": ");
            ctx.append(node.getTypeAnnotation().getDisplayName());
        }
        if (node.hasInitializer()) {
            ctx.append(" = ");
            formatExpression(node.getInitializer(), ctx);
        }
        ctx.append(";");
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, FormatterContext ctx) {
        formatBlock(node, ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        formatExpression(node.getExpression(), ctx);
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitDeclarationStmt(DeclarationStmt node, FormatterContext ctx) {
        return visitVarDecl(node.getDeclaration(), ctx);
    }

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        ctx.append("if (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        node.getThenBranch().accept(this, ctx);

        if (node.hasElse()) {
            ctx.append(" else ");
            node.getElseBranch().accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FormatterContext ctx) {
        ctx.append("while (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        node.getBody().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, FormatterContext ctx) {
        ctx.append("for (");
        // 初始化子句自带分号
        if (node.getInitializer() != null) {
            node.getInitializer().accept(this, ctx);
        } else {
            ctx.append(";");
        }
        if (node.getCondition() != null) {
            ctx.append(" ");
            formatExpression(node.getCondition(), ctx);
        }
        ctx.append(";");
        if (node.getIncrement() != null) {
            ctx.append(" ");
            formatExpression(node.getIncrement(), ctx);
        }
        ctx.append(") ");
        node.getBody().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        ctx.append("return");
        if (node.hasValue()) {
            ctx.append(" ");
            formatExpression(node.getValue(), ctx);
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FormatterContext ctx) {
        ctx.append("break;");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FormatterContext ctx) {
        ctx.append("continue;");
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, FormatterContext ctx) {
        formatExpression(node.getLeft(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatExpression(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, FormatterContext ctx) {
        ctx.append(node.getOperator().toSourceString());
        Expression operand = node.getOperand();
        // "- -x" 不能写成 "--x"
        if (isSignOperator(node.getOperator()) && (isNegativeLiteral(operand)
                || (operand instanceof UnaryExpr && isSignOperator(((UnaryExpr) operand).getOperator())))) {
            ctx.append(" ");
        }
        formatExpression(operand, ctx);
        return null;
    }

    @Override
    public Void visitGroupingExpr(GroupingExpr node, FormatterContext ctx) {
        ctx.append("(");
        formatExpression(node.getExpression(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, FormatterContext ctx) {
        LiteralValue value = node.getValue();
        switch (value.getKind()) {
            case STRING:
                ctx.append("\"" + OuroStringUtils.escapeString(value.asString()) + "\"");
                break;
            case CHARACTER:
                ctx.append("'" + OuroStringUtils.escapeChar(value.asCodePoint()) + "'");
                break;
            case FLOAT:
                ctx.append(Double.toString(value.asFloat()));
                break;
            case INTEGER:
                ctx.append(Long.toString(value.asInteger()));
                break;
            case BOOLEAN:
                ctx.append(value.asBoolean() ? "true" : "false");
                break;
            default:
                ctx.append("null");
        }
        return null;
    }

    @Override
    public Void visitVariableExpr(VariableExpr node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatExpression(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, FormatterContext ctx) {
        formatPostfixTarget(node.getCallee(), ctx);
        ctx.append("(");
        formatArguments(node.getArguments(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitGetExpr(GetExpr node, FormatterContext ctx) {
        formatPostfixTarget(node.getObject(), ctx);
        ctx.append(".");
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitSetExpr(SetExpr node, FormatterContext ctx) {
        formatPostfixTarget(node.getObject(), ctx);
        ctx.append(".");
        ctx.append(node.getName());
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatExpression(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitThisExpr(ThisExpr node, FormatterContext ctx) {
        ctx.append("this");
        return null;
    }

    @Override
    public Void visitSuperExpr(SuperExpr node, FormatterContext ctx) {
        ctx.append("super.");
        ctx.append(node.getMember());
        return null;
    }

    @Override
    public Void visitArrayLiteralExpr(ArrayLiteralExpr node, FormatterContext ctx) {
        ctx.append("[");
        formatArguments(node.getElements(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, FormatterContext ctx) {
        formatPostfixTarget(node.getTarget(), ctx);
        ctx.append("[");
        formatExpression(node.getIndex(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, FormatterContext ctx) {
        formatExpression(node.getCondition(), ctx);
        ctx.append(" ? ");
        formatExpression(node.getThenExpr(), ctx);
        ctx.append(" : ");
        formatExpression(node.getElseExpr(), ctx);
        return null;
    }

    // ============ 辅助方法 ============

    private void formatExpression(Expression expr, FormatterContext ctx) {
        expr.accept(this, ctx);
    }

    /**
     * 后缀运算的目标。负数字面量（常量折叠的产物）需要加括号，
     * 否则 {@code -1.abs()} 会被解析为 {@code -(1.abs())}。
     */
    private void formatPostfixTarget(Expression expr, FormatterContext ctx) {
        if (isNegativeLiteral(expr)) {
            ctx.append("(");
            formatExpression(expr, ctx);
            ctx.append(")");
        } else {
            formatExpression(expr, ctx);
        }
    }

    private static boolean isSignOperator(UnaryExpr.UnaryOp op) {
        return op == UnaryExpr.UnaryOp.NEG || op == UnaryExpr.UnaryOp.POS;
    }

    private static boolean isNegativeLiteral(Expression expr) {
        if (!(expr instanceof Literal)) return false;
        LiteralValue value = ((Literal) expr).getValue();
        switch (value.getKind()) {
            case INTEGER: return value.asInteger() < 0;
            case FLOAT:   return value.asFloat() < 0 || Double.doubleToRawLongBits(value.asFloat()) == Long.MIN_VALUE;
            default:      return false;
        }
    }

    private void formatArguments(List<Expression> args, FormatterContext ctx) {
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatExpression(args.get(i), ctx);
        }
    }

    private void formatBlock(Block block, FormatterContext ctx) {
        if (block.isEmpty()) {
            ctx.append("{}");
            return;
        }
        ctx.append("{");
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
    }

    /**
     * 类型体：属性在前，方法（含构造器）在后，成员之间空一行
     */
    private void formatTypeBody(TypeDecl node, FormatterContext ctx) {
        if (node.getProperties().isEmpty() && node.getMethods().isEmpty()) {
            ctx.append(" {}");
            return;
        }
        ctx.append(" {");
        ctx.newLine();
        ctx.indent();
        for (VarDecl property : node.getProperties()) {
            visitVarDecl(property, ctx);
            ctx.newLine();
        }
        formatMemberList(node.getMethods(), !node.getProperties().isEmpty(), ctx);
        ctx.dedent();
        ctx.append("}");
    }

    private void formatMemberList(List<FunctionDecl> methods, boolean separateFromPrevious,
                                  FormatterContext ctx) {
        for (int i = 0; i < methods.size(); i++) {
            if (i > 0 || separateFromPrevious) {
                ctx.blankLine();
            }
            visitFunctionDecl(methods.get(i), ctx);
            ctx.newLine();
        }
    }

    private void formatModifiers(List<Modifier> modifiers, FormatterContext ctx) {
        for (Modifier modifier : modifiers) {
            ctx.append(modifier.toSourceString());
            ctx.append(" ");
        }
    }

    private void formatTypeParams(List<TypeParameter> typeParams, FormatterContext ctx) {
        if (typeParams.isEmpty()) return;
        ctx.append("<");
        for (int i = 0; i < typeParams.size(); i++) {
            if (i > 0) ctx.append(", ");
            ctx.append(typeParams.get(i).getName());
        }
        ctx.append(">");
    }

    private void formatTypeList(List<TypeRef> types, FormatterContext ctx) {
        if (types.isEmpty()) return;
        ctx.append(": ");
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) ctx.append(", ");
            ctx.append(types.get(i).getDisplayName());
        }
    }
}
