package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.FunctionSignature;
import com.ourolang.compiler.analysis.types.Member;
import com.ourolang.compiler.analysis.types.PrimitiveTypes;
import com.ourolang.compiler.analysis.types.TypeCompatibility;
import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.ast.expr.*;
import com.ourolang.compiler.ast.stmt.*;
import com.ourolang.compiler.lexer.LiteralValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 类型检查器：在语义分析结果之上推断每个表达式的类型并检查兼容性。
 *
 * <p>所有错误都累积返回，不会在第一个错误处停止。{@code <error>} 类型与任何类型兼容，
 * 因此一个未定义的符号只报告一次，不会在外层表达式中级联出新的错误。</p>
 *
 * <p>推断出的类型写回 {@link Expression#setResolvedType}，未标注类型的变量在此补上类型。
 * 全局变量与属性可以在声明之前被引用：引用处发现类型尚未推断时，立即检查该声明的初始化表达式；
 * 初始化表达式依赖自身时报告 INVALID_OPERATION。</p>
 */
public final class TypeChecker implements AstVisitor<TypeDefinition, Void> {

    private SymbolTable symbolTable;
    private List<SymbolError> errors;

    // 遍历上下文
    private TypeDefinition currentOwner;
    private TypeDefinition currentReturnType;
    private int loopDepth;

    /** 尚未检查的全局变量与属性 -> 所属类型（全局变量为 null） */
    private final Map<VarDecl, TypeDefinition> pendingVars = new HashMap<VarDecl, TypeDefinition>();
    /** 正在推断的声明，用于发现循环依赖 */
    private final Set<VarDecl> inferring = new HashSet<VarDecl>();
    private final Map<Member, VarDecl> propertyDecls = new HashMap<Member, VarDecl>();

    /**
     * 先运行语义分析，再做类型检查；返回两者的全部错误，类型正确的输入返回空列表
     */
    public List<SymbolError> check(List<Declaration> declarations) {
        return check(new SemanticAnalyzer().analyze(declarations));
    }

    /**
     * 对已有的分析结果做类型检查
     */
    public List<SymbolError> check(AnalysisResult analysis) {
        symbolTable = analysis.getSymbolTable();
        errors = new ArrayList<SymbolError>(analysis.getErrors());
        currentOwner = null;
        currentReturnType = null;
        loopDepth = 0;
        pendingVars.clear();
        inferring.clear();
        propertyDecls.clear();

        List<Declaration> declarations = analysis.getDeclarations();
        for (Declaration decl : declarations) {
            if (decl instanceof VarDecl) {
                pendingVars.put((VarDecl) decl, null);
            } else if (decl instanceof TypeDecl) {
                TypeDefinition def = symbolTable.getTypeDefinition((TypeDecl) decl);
                for (VarDecl property : ((TypeDecl) decl).getProperties()) {
                    pendingVars.put(property, def);
                    Member member = def != null ? def.getDeclaredMember(property.getName()) : null;
                    if (member != null && member.isProperty()) {
                        propertyDecls.put(member, property);
                    }
                }
            }
        }

        // 属性与枚举原始值先于函数体：方法体里引用的未标注属性需要已推断的类型
        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                checkTypeHeader((TypeDecl) decl);
            }
        }
        for (Declaration decl : declarations) {
            if (decl instanceof VarDecl) {
                checkPending((VarDecl) decl);
            }
        }
        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                TypeDecl td = (TypeDecl) decl;
                currentOwner = symbolTable.getTypeDefinition(td);
                for (FunctionDecl method : td.getMethods()) {
                    checkFunction(method);
                }
                currentOwner = null;
            } else if (decl instanceof FunctionDecl) {
                checkFunction((FunctionDecl) decl);
            }
        }
        return errors;
    }

    // ============ 声明 ============

    private void checkTypeHeader(TypeDecl td) {
        TypeDefinition def = symbolTable.getTypeDefinition(td);
        currentOwner = def;
        try {
            if (td instanceof EnumDecl) {
                TypeDefinition rawType = def.getRawType();
                for (EnumCase ec : ((EnumDecl) td).getCases()) {
                    if (!ec.hasRawValue()) continue;
                    TypeDefinition actual = typeOf(ec.getRawValue());
                    if (rawType == null) {
                        errors.add(SymbolError.invalidOperation("Enum '" + td.getName()
                                + "' has no raw type, case '" + ec.getName() + "' cannot have a value",
                                ec.getRawValue().getLocation()));
                    } else if (!isAssignableValue(ec.getRawValue(), actual, rawType)) {
                        errors.add(SymbolError.typeMismatch(rawType.getName(), actual.getName(),
                                ec.getRawValue().getLine(), ec.getRawValue().getColumn()));
                    }
                }
            }
            for (VarDecl property : td.getProperties()) {
                checkPending(property);
            }
        } finally {
            currentOwner = null;
        }
    }

    /**
     * 检查尚未检查过的全局变量 / 属性；已检查过的直接跳过，保证每个声明只报告一次错误
     */
    private void checkPending(VarDecl var) {
        if (!pendingVars.containsKey(var)) {
            return;
        }
        TypeDefinition owner = pendingVars.remove(var);

        TypeDefinition savedOwner = currentOwner;
        TypeDefinition savedReturn = currentReturnType;
        int savedLoopDepth = loopDepth;
        currentOwner = owner;
        currentReturnType = null;
        loopDepth = 0;
        inferring.add(var);
        try {
            TypeDefinition type = checkVarDecl(var);
            if (owner != null && type != null) {
                Member member = owner.getDeclaredMember(var.getName());
                if (member != null && member.isProperty() && member.getType() == null) {
                    member.attachType(type);
                }
            }
        } finally {
            inferring.remove(var);
            currentOwner = savedOwner;
            currentReturnType = savedReturn;
            loopDepth = savedLoopDepth;
        }
    }

    /**
     * 在引用处补上尚未推断的全局变量 / 属性类型
     */
    private void inferOnDemand(VarDecl var, Expression use) {
        if (inferring.contains(var)) {
            errors.add(SymbolError.invalidOperation("Cannot infer the type of '" + var.getName()
                    + "': its initializer depends on itself", use.getLocation()));
            Symbol symbol = symbolTable.getDeclarationSymbol(var);
            if (symbol != null && !symbol.hasType()) {
                symbol.attachType(PrimitiveTypes.ERROR);
            }
            TypeDefinition owner = ownerOf(var);
            Member member = owner != null ? owner.getDeclaredMember(var.getName()) : null;
            if (member != null && member.getType() == null) {
                member.attachType(PrimitiveTypes.ERROR);
            }
            return;
        }
        checkPending(var);
    }

    private TypeDefinition ownerOf(VarDecl property) {
        for (Map.Entry<Member, VarDecl> entry : propertyDecls.entrySet()) {
            if (entry.getValue() == property) {
                return entry.getKey().getOwner();
            }
        }
        return null;
    }

    /**
     * 检查变量声明，返回变量的最终类型（未能确定时为 null）
     */
    private TypeDefinition checkVarDecl(VarDecl var) {
        Symbol symbol = symbolTable.getDeclarationSymbol(var);
        TypeDefinition declared = var.getTypeAnnotation() != null && symbol != null ? symbol.getType() : null;
        if (!var.hasInitializer()) {
            return declared;
        }

        TypeDefinition actual = typeOf(var.getInitializer());
        if (var.getTypeAnnotation() != null) {
            if (declared != null && !isAssignableValue(var.getInitializer(), actual, declared)) {
                errors.add(SymbolError.typeMismatch(declared.getName(), actual.getName(),
                        var.getInitializer().getLine(), var.getInitializer().getColumn()));
            }
            return declared;
        }

        TypeDefinition inferred = actual;
        if (actual.isNullType() || actual == PrimitiveTypes.VOID) {
            errors.add(SymbolError.invalidOperation("Cannot infer the type of '" + var.getName()
                    + "' from a " + actual.getName() + " value", var.getInitializer().getLocation()));
            inferred = PrimitiveTypes.ERROR;
        }
        if (symbol != null && !symbol.hasType()) {
            symbol.attachType(inferred);
        }
        return inferred;
    }

    private void checkFunction(FunctionDecl fd) {
        FunctionSignature sig = symbolTable.getSignature(fd);
        for (Parameter p : fd.getParams()) {
            if (p.getDefaultValue() == null) continue;
            Symbol paramSymbol = symbolTable.getDeclarationSymbol(p);
            TypeDefinition expected = paramSymbol != null ? paramSymbol.getType() : null;
            TypeDefinition actual = typeOf(p.getDefaultValue());
            if (expected != null && !isAssignableValue(p.getDefaultValue(), actual, expected)) {
                errors.add(SymbolError.typeMismatch(expected.getName(), actual.getName(),
                        p.getDefaultValue().getLine(), p.getDefaultValue().getColumn()));
            }
        }
        if (!fd.hasBody()) {
            return;
        }

        TypeDefinition savedReturn = currentReturnType;
        int savedLoopDepth = loopDepth;
        currentReturnType = sig != null ? sig.getReturnType() : PrimitiveTypes.ERROR;
        loopDepth = 0;
        try {
            for (Statement stmt : fd.getBody().getStatements()) {
                stmt.accept(this, null);
            }
        } finally {
            currentReturnType = savedReturn;
            loopDepth = savedLoopDepth;
        }
    }

    // ============ 语句 ============

    @Override
    public TypeDefinition visitBlock(Block node, Void ctx) {
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, null);
        }
        return null;
    }

    @Override
    public TypeDefinition visitExpressionStmt(ExpressionStmt node, Void ctx) {
        typeOf(node.getExpression());
        return null;
    }

    @Override
    public TypeDefinition visitDeclarationStmt(DeclarationStmt node, Void ctx) {
        checkVarDecl(node.getDeclaration());
        return null;
    }

    @Override
    public TypeDefinition visitIfStmt(IfStmt node, Void ctx) {
        checkCondition(node.getCondition());
        node.getThenBranch().accept(this, null);
        if (node.getElseBranch() != null) {
            node.getElseBranch().accept(this, null);
        }
        return null;
    }

    @Override
    public TypeDefinition visitWhileStmt(WhileStmt node, Void ctx) {
        checkCondition(node.getCondition());
        checkLoopBody(node.getBody());
        return null;
    }

    @Override
    public TypeDefinition visitForStmt(ForStmt node, Void ctx) {
        if (node.getInitializer() != null) {
            node.getInitializer().accept(this, null);
        }
        if (node.getCondition() != null) {
            checkCondition(node.getCondition());
        }
        if (node.getIncrement() != null) {
            typeOf(node.getIncrement());
        }
        checkLoopBody(node.getBody());
        return null;
    }

    private void checkLoopBody(Statement body) {
        loopDepth++;
        try {
            body.accept(this, null);
        } finally {
            loopDepth--;
        }
    }

    @Override
    public TypeDefinition visitReturnStmt(ReturnStmt node, Void ctx) {
        TypeDefinition expected = currentReturnType != null ? currentReturnType : PrimitiveTypes.VOID;
        if (node.getValue() == null) {
            if (expected != PrimitiveTypes.VOID && !expected.isError()) {
                errors.add(SymbolError.invalidOperation("Missing return value in function returning '"
                        + expected.getName() + "'", node.getLocation()));
            }
            return null;
        }

        TypeDefinition actual = typeOf(node.getValue());
        if (expected == PrimitiveTypes.VOID) {
            if (!actual.isError()) {
                errors.add(SymbolError.typeMismatch(PrimitiveTypes.VOID.getName(), actual.getName(),
                        node.getValue().getLine(), node.getValue().getColumn()));
            }
        } else if (!isAssignableValue(node.getValue(), actual, expected)) {
            errors.add(SymbolError.typeMismatch(expected.getName(), actual.getName(),
                    node.getValue().getLine(), node.getValue().getColumn()));
        }
        return null;
    }

    @Override
    public TypeDefinition visitBreakStmt(BreakStmt node, Void ctx) {
        if (loopDepth == 0) {
            errors.add(SymbolError.invalidOperation("'break' outside of a loop", node.getLocation()));
        }
        return null;
    }

    @Override
    public TypeDefinition visitContinueStmt(ContinueStmt node, Void ctx) {
        if (loopDepth == 0) {
            errors.add(SymbolError.invalidOperation("'continue' outside of a loop", node.getLocation()));
        }
        return null;
    }

    private void checkCondition(Expression condition) {
        TypeDefinition type = typeOf(condition);
        if (!type.isError() && type != PrimitiveTypes.BOOL) {
            errors.add(SymbolError.typeMismatch(PrimitiveTypes.BOOL.getName(), type.getName(),
                    condition.getLine(), condition.getColumn()));
        }
    }

    // ============ 表达式 ============

    /**
     * 推断表达式类型并写回节点
     */
    private TypeDefinition typeOf(Expression expr) {
        TypeDefinition type = expr.accept(this, null);
        if (type == null) {
            type = PrimitiveTypes.ERROR;
        }
        expr.setResolvedType(type);
        return type;
    }

    @Override
    public TypeDefinition visitLiteral(Literal node, Void ctx) {
        LiteralValue value = node.getValue();
        switch (value.getKind()) {
            case INTEGER:
                // 超出 32 位范围的整数字面量按 Int64 处理
                return TypeCompatibility.fitsInteger(value.asInteger(), PrimitiveTypes.INT)
                        ? PrimitiveTypes.INT : PrimitiveTypes.INT64;
            case FLOAT:
                return PrimitiveTypes.DOUBLE;
            case STRING:
                return PrimitiveTypes.STRING;
            case CHARACTER:
                return PrimitiveTypes.CHAR;
            case BOOLEAN:
                return PrimitiveTypes.BOOL;
            default:
                return PrimitiveTypes.NULL;
        }
    }

    @Override
    public TypeDefinition visitVariableExpr(VariableExpr node, Void ctx) {
        Symbol symbol = symbolTable.getReferencedSymbol(node);
        if (symbol == null) {
            return PrimitiveTypes.ERROR;
        }
        switch (symbol.getKind()) {
            case TYPE:
                return symbol.getType();
            case FUNCTION:
                errors.add(SymbolError.invalidOperation("Function '" + node.getName()
                        + "' must be called", node.getLocation()));
                return PrimitiveTypes.ERROR;
            default:
                if (!symbol.hasType() && symbol.getDeclaration() instanceof VarDecl) {
                    inferOnDemand((VarDecl) symbol.getDeclaration(), node);
                }
                return symbol.hasType() ? symbol.getType() : PrimitiveTypes.ERROR;
        }
    }

    @Override
    public TypeDefinition visitThisExpr(ThisExpr node, Void ctx) {
        if (currentOwner == null) {
            errors.add(SymbolError.invalidOperation("'this' used outside of a type", node.getLocation()));
            return PrimitiveTypes.ERROR;
        }
        return currentOwner;
    }

    @Override
    public TypeDefinition visitSuperExpr(SuperExpr node, Void ctx) {
        Member member = superMember(node);
        if (member == null) {
            return PrimitiveTypes.ERROR;
        }
        return memberValueType(member, node);
    }

    private Member superMember(SuperExpr node) {
        TypeDefinition sup = currentOwner != null ? currentOwner.getSuperclass() : null;
        if (sup == null) {
            errors.add(SymbolError.invalidOperation("'super' used without a superclass", node.getLocation()));
            return null;
        }
        Member member = sup.findMember(node.getMember());
        if (member == null) {
            errors.add(noSuchMember(sup, node.getMember(), node));
        }
        return member;
    }

    @Override
    public TypeDefinition visitGroupingExpr(GroupingExpr node, Void ctx) {
        return typeOf(node.getExpression());
    }

    @Override
    public TypeDefinition visitUnaryExpr(UnaryExpr node, Void ctx) {
        TypeDefinition operand = typeOf(node.getOperand());
        if (operand.isError()) {
            return operand;
        }
        switch (node.getOperator()) {
            case NOT:
                if (operand != PrimitiveTypes.BOOL) {
                    errors.add(SymbolError.typeMismatch(PrimitiveTypes.BOOL.getName(), operand.getName(),
                            node.getOperand().getLine(), node.getOperand().getColumn()));
                }
                return PrimitiveTypes.BOOL;
            case BIT_NOT:
                if (!operand.isIntegral()) {
                    return invalidOperand(node, operand);
                }
                return operand;
            default:
                if (!operand.isNumeric()) {
                    return invalidOperand(node, operand);
                }
                return operand;
        }
    }

    private TypeDefinition invalidOperand(UnaryExpr node, TypeDefinition operand) {
        errors.add(SymbolError.invalidOperation("Operator '" + node.getOperator().toSourceString()
                + "' cannot be applied to '" + operand.getName() + "'", node.getLocation()));
        return PrimitiveTypes.ERROR;
    }

    @Override
    public TypeDefinition visitBinaryExpr(BinaryExpr node, Void ctx) {
        TypeDefinition left = typeOf(node.getLeft());
        TypeDefinition right = typeOf(node.getRight());
        return binaryType(node.getOperator(), node.getLeft(), left, node.getRight(), right, node);
    }

    private TypeDefinition binaryType(BinaryExpr.BinaryOp op, Expression leftExpr, TypeDefinition left,
                                      Expression rightExpr, TypeDefinition right, Expression node) {
        switch (op) {
            case AND:
            case OR:
                requireBool(leftExpr, left);
                requireBool(rightExpr, right);
                return PrimitiveTypes.BOOL;
            case EQ:
            case NE:
                if (!left.isError() && !right.isError()
                        && !isAssignableValue(rightExpr, right, left) && !isAssignableValue(leftExpr, left, right)) {
                    errors.add(SymbolError.typeMismatch(left.getName(), right.getName(),
                            rightExpr.getLine(), rightExpr.getColumn()));
                }
                return PrimitiveTypes.BOOL;
            case NULL_COALESCE:
                return coalesceType(left, rightExpr, right);
            default:
                break;
        }

        if (left.isError() || right.isError()) {
            return PrimitiveTypes.ERROR;
        }

        if (op.isRelational()) {
            boolean comparable = (left.isNumeric() && right.isNumeric())
                    || (left == PrimitiveTypes.STRING && right == PrimitiveTypes.STRING)
                    || (left == PrimitiveTypes.CHAR && right == PrimitiveTypes.CHAR);
            if (!comparable) {
                return invalidOperands(op, left, right, node);
            }
            return op == BinaryExpr.BinaryOp.COMPARE ? PrimitiveTypes.INT : PrimitiveTypes.BOOL;
        }

        if (op == BinaryExpr.BinaryOp.ADD && left == PrimitiveTypes.STRING && right == PrimitiveTypes.STRING) {
            return PrimitiveTypes.STRING;
        }

        if (op.isBitwise()) {
            if (!left.isIntegral() || !right.isIntegral()) {
                return invalidOperands(op, left, right, node);
            }
            boolean shift = op == BinaryExpr.BinaryOp.SHL || op == BinaryExpr.BinaryOp.SHR
                    || op == BinaryExpr.BinaryOp.USHR;
            return shift ? left : numericResult(leftExpr, left, rightExpr, right);
        }

        // 算术
        if (!left.isNumeric() || !right.isNumeric()) {
            return invalidOperands(op, left, right, node);
        }
        return numericResult(leftExpr, left, rightExpr, right);
    }

    /**
     * 两个数值操作数的结果类型；一侧为字面量且能放入另一侧类型时取另一侧类型
     */
    private static TypeDefinition numericResult(Expression leftExpr, TypeDefinition left,
                                                Expression rightExpr, TypeDefinition right) {
        if (isNumericLiteral(rightExpr) && isAssignableValue(rightExpr, right, left)) {
            return left;
        }
        if (isNumericLiteral(leftExpr) && isAssignableValue(leftExpr, left, right)) {
            return right;
        }
        return TypeCompatibility.commonNumericType(left, right);
    }

    private TypeDefinition coalesceType(TypeDefinition left, Expression rightExpr, TypeDefinition right) {
        if (left.isNullType()) {
            return right;
        }
        TypeDefinition common = TypeCompatibility.commonType(left, right);
        if (common == null) {
            errors.add(SymbolError.typeMismatch(left.getName(), right.getName(),
                    rightExpr.getLine(), rightExpr.getColumn()));
            return left;
        }
        return common;
    }

    private void requireBool(Expression expr, TypeDefinition type) {
        if (!type.isError() && type != PrimitiveTypes.BOOL) {
            errors.add(SymbolError.typeMismatch(PrimitiveTypes.BOOL.getName(), type.getName(),
                    expr.getLine(), expr.getColumn()));
        }
    }

    private TypeDefinition invalidOperands(BinaryExpr.BinaryOp op, TypeDefinition left, TypeDefinition right,
                                           Expression node) {
        errors.add(SymbolError.invalidOperation("Operator '" + op.toSourceString() + "' cannot be applied to '"
                + left.getName() + "' and '" + right.getName() + "'", node.getLocation()));
        return PrimitiveTypes.ERROR;
    }

    @Override
    public TypeDefinition visitConditionalExpr(ConditionalExpr node, Void ctx) {
        checkCondition(node.getCondition());
        TypeDefinition thenType = typeOf(node.getThenExpr());
        TypeDefinition elseType = typeOf(node.getElseExpr());
        TypeDefinition common = TypeCompatibility.commonType(thenType, elseType);
        if (common == null) {
            errors.add(SymbolError.typeMismatch(thenType.getName(), elseType.getName(),
                    node.getElseExpr().getLine(), node.getElseExpr().getColumn()));
            return thenType;
        }
        return common;
    }

    @Override
    public TypeDefinition visitArrayLiteralExpr(ArrayLiteralExpr node, Void ctx) {
        if (node.getElements().isEmpty()) {
            return PrimitiveTypes.EMPTY_ARRAY;
        }
        TypeDefinition element = null;
        for (Expression e : node.getElements()) {
            TypeDefinition t = typeOf(e);
            if (element == null) {
                element = t;
                continue;
            }
            TypeDefinition common = TypeCompatibility.commonType(element, t);
            if (common == null) {
                errors.add(SymbolError.typeMismatch(element.getName(), t.getName(), e.getLine(), e.getColumn()));
            } else {
                element = common;
            }
        }
        return element.isError() ? element : TypeDefinition.arrayOf(element);
    }

    @Override
    public TypeDefinition visitIndexExpr(IndexExpr node, Void ctx) {
        TypeDefinition target = typeOf(node.getTarget());
        TypeDefinition index = typeOf(node.getIndex());
        if (!index.isError() && !index.isIntegral()) {
            errors.add(SymbolError.typeMismatch(PrimitiveTypes.INT.getName(), index.getName(),
                    node.getIndex().getLine(), node.getIndex().getColumn()));
        }
        if (target.isError()) {
            return target;
        }
        if (target.isArray()) {
            TypeDefinition element = target.getElementType();
            return element != null ? element : PrimitiveTypes.ERROR;
        }
        if (target == PrimitiveTypes.STRING) {
            return PrimitiveTypes.CHAR;
        }
        errors.add(SymbolError.invalidOperation("Type '" + target.getName() + "' cannot be indexed",
                node.getLocation()));
        return PrimitiveTypes.ERROR;
    }

    // ============ 赋值 ============

    @Override
    public TypeDefinition visitAssignExpr(AssignExpr node, Void ctx) {
        TypeDefinition targetType = assignTargetType(node.getTarget());
        TypeDefinition valueType = typeOf(node.getValue());
        checkAssignment(node.getOperator(), node.getTarget(), targetType, node.getValue(), valueType, node);
        return targetType;
    }

    private TypeDefinition assignTargetType(Expression target) {
        if (target instanceof VariableExpr) {
            Symbol symbol = symbolTable.getReferencedSymbol(target);
            if (symbol == null) {
                target.setResolvedType(PrimitiveTypes.ERROR);
                return PrimitiveTypes.ERROR;
            }
            if (symbol.getKind() != SymbolKind.VARIABLE) {
                String what = symbol.isConstant() ? "constant" : symbol.getKind().name().toLowerCase();
                errors.add(SymbolError.invalidOperation("Cannot assign to " + what + " '" + symbol.getName() + "'",
                        target.getLocation()));
                target.setResolvedType(PrimitiveTypes.ERROR);
                return PrimitiveTypes.ERROR;
            }
            TypeDefinition type = symbol.hasType() ? symbol.getType() : PrimitiveTypes.ERROR;
            target.setResolvedType(type);
            return type;
        }

        TypeDefinition type = typeOf(target);
        if (target instanceof IndexExpr
                && ((IndexExpr) target).getTarget().getResolvedType() == PrimitiveTypes.STRING) {
            errors.add(SymbolError.invalidOperation("Cannot assign to a character of a String",
                    target.getLocation()));
            return PrimitiveTypes.ERROR;
        }
        return type;
    }

    private void checkAssignment(AssignExpr.AssignOp op, Expression target, TypeDefinition targetType,
                                 Expression value, TypeDefinition valueType, Expression node) {
        if (targetType.isError() || valueType.isError()) {
            return;
        }
        if (op.isCompound()) {
            TypeDefinition result = binaryType(op.getBinaryOp(), target, targetType, value, valueType, node);
            if (!TypeCompatibility.isAssignable(result, targetType)) {
                errors.add(SymbolError.typeMismatch(targetType.getName(), result.getName(),
                        node.getLine(), node.getColumn()));
            }
        } else if (!isAssignableValue(value, valueType, targetType)) {
            errors.add(SymbolError.typeMismatch(targetType.getName(), valueType.getName(),
                    value.getLine(), value.getColumn()));
        }
    }

    @Override
    public TypeDefinition visitSetExpr(SetExpr node, Void ctx) {
        TypeDefinition objectType = typeOf(node.getObject());
        TypeDefinition valueType = typeOf(node.getValue());
        if (objectType.isError()) {
            return objectType;
        }
        Member member = findMember(objectType, node.getName(), node, node.getObject());
        if (member == null) {
            return PrimitiveTypes.ERROR;
        }
        if (!member.isProperty()) {
            errors.add(SymbolError.invalidOperation("Cannot assign to '" + node.getName() + "'", node.getLocation()));
            return PrimitiveTypes.ERROR;
        }
        if (member.isConstant()) {
            errors.add(SymbolError.invalidOperation("Cannot assign to constant '" + node.getName() + "'",
                    node.getLocation()));
            return PrimitiveTypes.ERROR;
        }
        TypeDefinition memberType = member.getType() != null ? member.getType() : PrimitiveTypes.ERROR;
        checkAssignment(node.getOperator(), node, memberType, node.getValue(), valueType, node);
        return memberType;
    }

    // ============ 成员访问与调用 ============

    @Override
    public TypeDefinition visitGetExpr(GetExpr node, Void ctx) {
        TypeDefinition objectType = typeOf(node.getObject());
        if (objectType.isError()) {
            return objectType;
        }
        if ("length".equals(node.getName()) && (objectType.isArray() || objectType == PrimitiveTypes.STRING)) {
            return PrimitiveTypes.INT;
        }
        Member member = findMember(objectType, node.getName(), node, node.getObject());
        return member != null ? memberValueType(member, node) : PrimitiveTypes.ERROR;
    }

    /**
     * 查找成员，找不到时报告 UNDEFINED_SYMBOL；通过类型名访问实例成员报告 INVALID_OPERATION
     */
    private Member findMember(TypeDefinition objectType, String name, Expression node, Expression object) {
        if (objectType.isTypeParameter() || objectType == PrimitiveTypes.ANY) {
            // 无约束的泛型参数 / Any：成员在编译期未知
            return null;
        }
        Member member = objectType.findMember(name);
        if (member == null) {
            errors.add(noSuchMember(objectType, name, node));
            return null;
        }
        if (isTypeReference(object) && !member.isStatic()) {
            errors.add(SymbolError.invalidOperation("Instance member '" + name
                    + "' cannot be accessed through type '" + objectType.getName() + "'", node.getLocation()));
            return null;
        }
        return member;
    }

    private boolean isTypeReference(Expression expr) {
        Symbol symbol = expr instanceof VariableExpr ? symbolTable.getReferencedSymbol(expr) : null;
        return symbol != null && symbol.getKind() == SymbolKind.TYPE;
    }

    private static SymbolError noSuchMember(TypeDefinition type, String name, Expression node) {
        return new SymbolError(SymbolError.Kind.UNDEFINED_SYMBOL,
                "Type '" + type.getName() + "' has no member '" + name + "'", node.getLine(), node.getColumn());
    }

    private TypeDefinition memberValueType(Member member, Expression node) {
        switch (member.getKind()) {
            case PROPERTY:
                if (member.getType() == null && propertyDecls.containsKey(member)) {
                    inferOnDemand(propertyDecls.get(member), node);
                }
                return member.getType() != null ? member.getType() : PrimitiveTypes.ERROR;
            case ENUM_CASE:
                return member.getOwner();
            default:
                errors.add(SymbolError.invalidOperation("Method '" + member.getName() + "' must be called",
                        node.getLocation()));
                return PrimitiveTypes.ERROR;
        }
    }

    @Override
    public TypeDefinition visitCallExpr(CallExpr node, Void ctx) {
        List<TypeDefinition> argTypes = new ArrayList<TypeDefinition>();
        for (Expression arg : node.getArguments()) {
            argTypes.add(typeOf(arg));
        }

        Expression callee = node.getCallee();
        if (callee instanceof VariableExpr) {
            Symbol symbol = symbolTable.getReferencedSymbol(callee);
            if (symbol == null) {
                callee.setResolvedType(PrimitiveTypes.ERROR);
                return PrimitiveTypes.ERROR;
            }
            callee.setResolvedType(symbol.getType());
            if (symbol.getKind() == SymbolKind.TYPE) {
                return construct(symbol.getType(), node, argTypes);
            }
            if (symbol.getKind() == SymbolKind.FUNCTION && symbol.getSignature() != null) {
                return checkCall(symbol.getName(), symbol.getSignature(), node, argTypes);
            }
            return notCallable(symbol.hasType() ? symbol.getType() : PrimitiveTypes.ERROR, node);
        }

        Member member = null;
        if (callee instanceof GetExpr) {
            GetExpr get = (GetExpr) callee;
            TypeDefinition objectType = typeOf(get.getObject());
            if (objectType.isError()) {
                return objectType;
            }
            member = findMember(objectType, get.getName(), get, get.getObject());
            if (member == null) {
                return PrimitiveTypes.ERROR;
            }
        } else if (callee instanceof SuperExpr) {
            member = superMember((SuperExpr) callee);
            if (member == null) {
                return PrimitiveTypes.ERROR;
            }
        } else {
            return notCallable(typeOf(callee), node);
        }

        if (member.isMethod()) {
            return checkCall(member.getName(), member.getSignature(), node, argTypes);
        }
        return notCallable(memberValueType(member, callee), node);
    }

    private TypeDefinition notCallable(TypeDefinition type, CallExpr node) {
        if (!type.isError()) {
            errors.add(SymbolError.invalidOperation("Value of type '" + type.getName() + "' is not callable",
                    node.getLocation()));
        }
        return PrimitiveTypes.ERROR;
    }

    /**
     * 检查实参个数与类型；泛型参数按实参推断，返回替换后的返回类型
     */
    private TypeDefinition checkCall(String name, FunctionSignature sig, CallExpr node,
                                     List<TypeDefinition> argTypes) {
        List<Expression> args = node.getArguments();
        if (!sig.accepts(args.size())) {
            int required = sig.getRequiredCount();
            int max = sig.getParams().size();
            String expected = required == max ? String.valueOf(max) : required + " to " + max;
            errors.add(SymbolError.invalidOperation("'" + name + "' expects " + expected
                    + " argument(s) but got " + args.size(), node.getLocation()));
        }

        Map<String, TypeDefinition> bindings = new HashMap<String, TypeDefinition>();
        int count = Math.min(args.size(), sig.getParams().size());
        for (int i = 0; i < count; i++) {
            inferBindings(sig.getParams().get(i).getType(), argTypes.get(i), bindings);
        }
        for (int i = 0; i < count; i++) {
            TypeDefinition expected = sig.getParams().get(i).getType().substitute(bindings);
            if (!isAssignableValue(args.get(i), argTypes.get(i), expected)) {
                errors.add(SymbolError.typeMismatch(expected.getName(), argTypes.get(i).getName(),
                        args.get(i).getLine(), args.get(i).getColumn()));
            }
        }
        return sig.getReturnType().substitute(bindings);
    }

    private static void inferBindings(TypeDefinition param, TypeDefinition arg, Map<String, TypeDefinition> bindings) {
        if (arg.isError() || arg.isNullType()) {
            return;
        }
        if (param.isTypeParameter()) {
            if (!bindings.containsKey(param.getName())) {
                bindings.put(param.getName(), arg);
            }
            return;
        }
        List<TypeDefinition> paramArgs = param.getTypeArguments();
        if (param.getGenericBase() != null && arg.getGenericBase() == param.getGenericBase()
                && arg.getTypeArguments().size() == paramArgs.size()) {
            for (int i = 0; i < paramArgs.size(); i++) {
                inferBindings(paramArgs.get(i), arg.getTypeArguments().get(i), bindings);
            }
        }
    }

    /**
     * 调用类型名即构造实例
     */
    private TypeDefinition construct(TypeDefinition type, CallExpr node, List<TypeDefinition> argTypes) {
        if (type.isInterface() || type.isAbstract()) {
            errors.add(SymbolError.abstractInstantiation(type.getName(), node.getLocation()));
            return type;
        }
        if (!type.isClass() && !type.isStruct()) {
            errors.add(SymbolError.invalidOperation("Type '" + type.getName() + "' cannot be instantiated",
                    node.getLocation()));
            return type.isEnum() ? type : PrimitiveTypes.ERROR;
        }

        Member init = type.getDeclaredMember(FunctionDecl.CONSTRUCTOR_NAME);
        if (init != null && init.getKind() == Member.Kind.CONSTRUCTOR) {
            checkCall(type.getName(), init.getSignature(), node, argTypes);
            return type;
        }
        if (node.getArguments().isEmpty()) {
            return type;
        }
        if (type.isStruct()) {
            // 逐成员构造：按声明顺序对应非静态属性
            List<FunctionSignature.Param> params = new ArrayList<FunctionSignature.Param>();
            for (Member m : type.getMembers().values()) {
                if (m.isProperty() && !m.isStatic()) {
                    TypeDefinition t = m.getType() != null ? m.getType() : PrimitiveTypes.ERROR;
                    params.add(new FunctionSignature.Param(m.getName(), t, false));
                }
            }
            checkCall(type.getName(), new FunctionSignature(params, type), node, argTypes);
            return type;
        }
        errors.add(SymbolError.invalidOperation("Class '" + type.getName()
                + "' has no initializer taking " + node.getArguments().size() + " argument(s)", node.getLocation()));
        return type;
    }

    // ============ 兼容性 ============

    /**
     * 可赋值判断，额外允许落在目标范围内的整数字面量与赋给浮点类型的浮点字面量
     */
    private static boolean isAssignableValue(Expression expr, TypeDefinition actual, TypeDefinition target) {
        if (TypeCompatibility.isAssignable(actual, target)) {
            return true;
        }
        Literal literal = numericLiteral(expr);
        if (literal == null) {
            return false;
        }
        Expression outer = unwrap(expr);
        boolean negated = outer instanceof UnaryExpr && ((UnaryExpr) outer).getOperator() == UnaryExpr.UnaryOp.NEG;
        if (literal.getKind() == LiteralValue.Kind.INTEGER) {
            long value = literal.getValue().asInteger();
            return TypeCompatibility.fitsInteger(negated ? -value : value, target);
        }
        return target.isFloating();
    }

    private static boolean isNumericLiteral(Expression expr) {
        return numericLiteral(expr) != null;
    }

    /** 数值字面量，可带一个前缀正负号，可被括号包裹 */
    private static Literal numericLiteral(Expression expr) {
        Expression e = unwrap(expr);
        if (e instanceof UnaryExpr && (((UnaryExpr) e).getOperator() == UnaryExpr.UnaryOp.NEG
                || ((UnaryExpr) e).getOperator() == UnaryExpr.UnaryOp.POS)) {
            e = unwrap(((UnaryExpr) e).getOperand());
        }
        if (e instanceof Literal) {
            LiteralValue.Kind kind = ((Literal) e).getKind();
            if (kind == LiteralValue.Kind.INTEGER || kind == LiteralValue.Kind.FLOAT) {
                return (Literal) e;
            }
        }
        return null;
    }

    private static Expression unwrap(Expression expr) {
        Expression e = expr;
        while (e instanceof GroupingExpr) {
            e = ((GroupingExpr) e).getExpression();
        }
        return e;
    }
}
