package com.ourolang.compiler.ast;

import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.ast.expr.*;
import com.ourolang.compiler.ast.stmt.*;
import com.ourolang.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitClassDecl(ClassDecl node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitEnumDecl(EnumDecl node, C ctx) { return null; }

    default R visitEnumCase(EnumCase node, C ctx) { return null; }

    default R visitInterfaceDecl(InterfaceDecl node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitVarDecl(VarDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitDeclarationStmt(DeclarationStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitGroupingExpr(GroupingExpr node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitVariableExpr(VariableExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitGetExpr(GetExpr node, C ctx) { return null; }

    default R visitSetExpr(SetExpr node, C ctx) { return null; }

    default R visitThisExpr(ThisExpr node, C ctx) { return null; }

    default R visitSuperExpr(SuperExpr node, C ctx) { return null; }

    default R visitArrayLiteralExpr(ArrayLiteralExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitSimpleType(SimpleType node, C ctx) { return null; }

    default R visitArrayType(ArrayType node, C ctx) { return null; }

    default R visitGenericType(GenericType node, C ctx) { return null; }

    default R visitTypeParameter(TypeParameter node, C ctx) { return null; }
}
