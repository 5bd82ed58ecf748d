package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.FunctionSignature;
import com.ourolang.compiler.analysis.types.Member;
import com.ourolang.compiler.analysis.types.PrimitiveTypes;
import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.analysis.types.TypeResolver;
import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.ast.expr.*;
import com.ourolang.compiler.ast.stmt.*;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 语义分析器：遍历 AST 构建符号表并收集声明级错误。
 *
 * <p>分四遍进行：</p>
 * <ol>
 *   <li>登记所有顶层类型、函数和全局变量，使同一文件内的前向引用可以解析；</li>
 *   <li>解析类型头（泛型参数、父类、接口）与成员签名；</li>
 *   <li>校验继承与一致性规则，委托给 {@link DeclarationValidator}；</li>
 *   <li>进入每个函数体 / 块建立作用域，定义参数与局部变量，并把每个标识符引用绑定到符号。</li>
 * </ol>
 *
 * <p>错误只累积不抛出。实例不是线程安全的，每次 {@link #analyze(List)} 使用全新的符号表。</p>
 */
public final class SemanticAnalyzer implements AstVisitor<Void, Void> {

    private SymbolTable symbolTable;
    private TypeResolver typeResolver;
    private List<SymbolError> errors;
    private Map<Member, Symbol> memberSymbols;

    /** 分析入口 */
    public AnalysisResult analyze(List<Declaration> declarations) {
        symbolTable = new SymbolTable();
        typeResolver = new TypeResolver(symbolTable);
        errors = new ArrayList<SymbolError>();
        memberSymbols = new IdentityHashMap<Member, Symbol>();

        registerDeclarations(declarations);
        resolveHeaders(declarations);
        new DeclarationValidator(symbolTable, errors).validate(declarations);
        for (Declaration decl : declarations) {
            decl.accept(this, null);
        }

        return new AnalysisResult(declarations, symbolTable, errors);
    }

    // ============ 第一遍：登记顶层声明 ============

    private void registerDeclarations(List<Declaration> declarations) {
        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                TypeDefinition def = createTypeDefinition((TypeDecl) decl);
                symbolTable.recordTypeDefinition((TypeDecl) decl, def);
                define(new Symbol(decl.getName(), SymbolKind.TYPE, def, decl.getNameLocation(), decl));
            } else if (decl instanceof FunctionDecl) {
                define(new Symbol(decl.getName(), SymbolKind.FUNCTION, null, decl.getNameLocation(), decl));
            } else if (decl instanceof VarDecl) {
                VarDecl var = (VarDecl) decl;
                SymbolKind kind = var.isConstant() ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
                define(new Symbol(var.getName(), kind, null, var.getNameLocation(), var));
            }
        }
    }

    private static TypeDefinition createTypeDefinition(TypeDecl decl) {
        TypeDefinition def;
        if (decl instanceof ClassDecl) {
            ClassDecl cd = (ClassDecl) decl;
            def = TypeDefinition.declared(cd.getName(), TypeDefinition.Category.CLASS);
            def.getPermittedSubclasses().addAll(cd.getPermittedSubclasses());
        } else if (decl instanceof StructDecl) {
            def = TypeDefinition.declared(decl.getName(), TypeDefinition.Category.STRUCT);
        } else if (decl instanceof EnumDecl) {
            def = TypeDefinition.declared(decl.getName(), TypeDefinition.Category.ENUM);
        } else {
            def = TypeDefinition.declared(decl.getName(), TypeDefinition.Category.INTERFACE);
        }
        def.setAbstract(decl.hasModifier(Modifier.ABSTRACT));
        def.setSealed(decl.hasModifier(Modifier.SEALED));
        def.setFinal(decl.hasModifier(Modifier.FINAL));
        return def;
    }

    /**
     * 在当前作用域定义符号，重复定义时记录错误并返回 false
     */
    private boolean define(Symbol symbol) {
        try {
            symbolTable.define(symbol);
            return true;
        } catch (SymbolException e) {
            errors.add(e.getError());
            return false;
        }
    }

    // ============ 第二遍：类型头与签名 ============

    private void resolveHeaders(List<Declaration> declarations) {
        // 先登记所有泛型参数，父类型引用 Base<Int> 才能校验实参个数
        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                TypeDecl td = (TypeDecl) decl;
                TypeDefinition def = symbolTable.getTypeDefinition(td);
                symbolTable.enterTypeScope(td, def);
                for (TypeParameter tp : td.getTypeParams()) {
                    TypeDefinition param = TypeDefinition.typeParameter(tp.getName());
                    def.addTypeParameter(param);
                    define(new Symbol(tp.getName(), SymbolKind.TYPE, param, tp.getLocation(), tp));
                }
                symbolTable.exitScope();
            }
        }

        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                resolveSupertypes((TypeDecl) decl);
            }
        }

        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                resolveMembers((TypeDecl) decl);
            } else if (decl instanceof FunctionDecl) {
                FunctionDecl fd = (FunctionDecl) decl;
                FunctionSignature sig = resolveSignature(fd);
                Symbol symbol = symbolTable.getDeclarationSymbol(fd);
                if (symbol != null) {
                    symbol.attachSignature(sig);
                }
            } else if (decl instanceof VarDecl) {
                VarDecl var = (VarDecl) decl;
                Symbol symbol = symbolTable.getDeclarationSymbol(var);
                if (var.getTypeAnnotation() != null) {
                    TypeDefinition type = typeResolver.resolve(var.getTypeAnnotation(), errors);
                    if (symbol != null) {
                        symbol.attachType(type);
                    }
                }
            }
        }
    }

    private void resolveSupertypes(TypeDecl td) {
        TypeDefinition def = symbolTable.getTypeDefinition(td);
        symbolTable.enterTypeScope(td, def);
        try {
            if (td instanceof ClassDecl && ((ClassDecl) td).hasSuperclass()) {
                TypeRef superRef = ((ClassDecl) td).getSuperclass();
                TypeDefinition sup = typeResolver.resolve(superRef, errors);
                if (sup.isInterface()) {
                    // 类头第一个名字解析为接口：报告后仍按接口处理
                    errors.add(SymbolError.invalidInheritance("First name '" + sup.getName()
                            + "' in the header of class '" + td.getName()
                            + "' is an interface, not a superclass", superRef.getLocation()));
                    def.addInterface(sup);
                } else if (sup.isClass()) {
                    def.setSuperclass(sup);
                } else if (!sup.isError()) {
                    errors.add(SymbolError.invalidInheritance("Class '" + td.getName()
                            + "' cannot inherit from non-class type '" + sup.getName() + "'", superRef.getLocation()));
                }
            }

            for (TypeRef ref : td.getInterfaces()) {
                TypeDefinition iface = typeResolver.resolve(ref, errors);
                if (iface.isInterface()) {
                    def.addInterface(iface);
                } else if (!iface.isError()) {
                    errors.add(SymbolError.invalidInheritance("'" + iface.getName()
                            + "' is not an interface and cannot be inherited by '" + td.getName() + "'",
                            ref.getLocation()));
                }
            }

            if (td instanceof EnumDecl && ((EnumDecl) td).getRawType() != null) {
                TypeRef rawRef = ((EnumDecl) td).getRawType();
                TypeDefinition raw = typeResolver.resolve(rawRef, errors);
                if (raw.isInterface()) {
                    def.addInterface(raw);
                } else {
                    def.setRawType(raw);
                }
            }
        } finally {
            symbolTable.exitScope();
        }
    }

    private void resolveMembers(TypeDecl td) {
        TypeDefinition def = symbolTable.getTypeDefinition(td);
        symbolTable.enterTypeScope(td, def);
        try {
            if (td instanceof EnumDecl) {
                for (EnumCase ec : ((EnumDecl) td).getCases()) {
                    Member member = Member.enumCase(ec.getName(), def);
                    if (addMember(def, member, ec.getName(), ec)) {
                        registerMemberSymbol(member,
                                new Symbol(ec.getName(), SymbolKind.CONSTANT, def, ec.getLocation(), ec));
                    }
                }
            }

            for (VarDecl property : td.getProperties()) {
                TypeDefinition type = property.getTypeAnnotation() != null
                        ? typeResolver.resolve(property.getTypeAnnotation(), errors) : null;
                Member member = Member.property(property.getName(), def, type,
                        property.isConstant(), property.hasModifier(Modifier.STATIC));
                if (addMember(def, member, property.getName(), property)) {
                    SymbolKind kind = property.isConstant() ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
                    registerMemberSymbol(member,
                            new Symbol(property.getName(), kind, type, property.getNameLocation(), property));
                }
            }

            for (FunctionDecl method : td.getMethods()) {
                FunctionSignature sig = resolveSignature(method);
                if (method.isConstructor()) {
                    addMember(def, Member.constructor(def, sig), method.getName(), method);
                    continue;
                }
                Member member = Member.method(method.getName(), def, sig, method.hasBody(),
                        method.hasModifier(Modifier.STATIC), method.hasModifier(Modifier.OVERRIDE));
                if (addMember(def, member, method.getName(), method)) {
                    Symbol symbol = new Symbol(method.getName(), SymbolKind.FUNCTION, null,
                            method.getNameLocation(), method);
                    symbol.attachSignature(sig);
                    registerMemberSymbol(member, symbol);
                }
            }
        } finally {
            symbolTable.exitScope();
        }
    }

    private boolean addMember(TypeDefinition def, Member member, String name, AstNode node) {
        if (def.addMember(member)) {
            return true;
        }
        SourceLocation loc = node instanceof Declaration
                ? ((Declaration) node).getNameLocation() : node.getLocation();
        errors.add(SymbolError.duplicateDefinition(name, loc));
        return false;
    }

    private void registerMemberSymbol(Member member, Symbol symbol) {
        if (define(symbol)) {
            memberSymbols.put(member, symbol);
        }
    }

    /**
     * 解析函数签名；函数作用域在此创建并登记泛型参数，第四遍再进入同一作用域
     */
    private FunctionSignature resolveSignature(FunctionDecl fd) {
        symbolTable.enterScope(Scope.ScopeType.FUNCTION, fd);
        try {
            for (TypeParameter tp : fd.getTypeParams()) {
                define(new Symbol(tp.getName(), SymbolKind.TYPE, TypeDefinition.typeParameter(tp.getName()),
                        tp.getLocation(), tp));
            }
            List<FunctionSignature.Param> params = new ArrayList<FunctionSignature.Param>();
            for (Parameter p : fd.getParams()) {
                TypeDefinition type = typeResolver.resolve(p.getType(), errors);
                params.add(new FunctionSignature.Param(p.getName(), type, p.getDefaultValue() != null));
            }
            TypeDefinition returnType = fd.getReturnType() != null
                    ? typeResolver.resolve(fd.getReturnType(), errors) : PrimitiveTypes.VOID;
            FunctionSignature sig = new FunctionSignature(params, returnType);
            symbolTable.recordSignature(fd, sig);
            return sig;
        } finally {
            symbolTable.exitScope();
        }
    }

    // ============ 第四遍：函数体与引用绑定 ============

    @Override
    public Void visitClassDecl(ClassDecl node, Void ctx) {
        visitTypeBody(node);
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, Void ctx) {
        visitTypeBody(node);
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, Void ctx) {
        visitTypeBody(node);
        return null;
    }

    @Override
    public Void visitInterfaceDecl(InterfaceDecl node, Void ctx) {
        visitTypeBody(node);
        return null;
    }

    private void visitTypeBody(TypeDecl td) {
        symbolTable.enterTypeScope(td, symbolTable.getTypeDefinition(td));
        try {
            if (td instanceof EnumDecl) {
                for (EnumCase ec : ((EnumDecl) td).getCases()) {
                    resolve(ec.getRawValue());
                }
            }
            for (VarDecl property : td.getProperties()) {
                resolve(property.getInitializer());
            }
            for (FunctionDecl method : td.getMethods()) {
                method.accept(this, null);
            }
        } finally {
            symbolTable.exitScope();
        }
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, Void ctx) {
        FunctionSignature sig = symbolTable.getSignature(node);
        symbolTable.enterScope(Scope.ScopeType.FUNCTION, node);
        try {
            for (int i = 0; i < node.getParams().size(); i++) {
                Parameter p = node.getParams().get(i);
                resolve(p.getDefaultValue());
                TypeDefinition type = sig != null ? sig.getParams().get(i).getType() : PrimitiveTypes.ERROR;
                define(new Symbol(p.getName(), SymbolKind.VARIABLE, type, p.getLocation(), p));
            }
            // 函数体语句直接位于函数作用域，参数与顶层局部变量同名视为重复定义
            if (node.hasBody()) {
                for (Statement stmt : node.getBody().getStatements()) {
                    stmt.accept(this, null);
                }
            }
        } finally {
            symbolTable.exitScope();
        }
        return null;
    }

    @Override
    public Void visitVarDecl(VarDecl node, Void ctx) {
        // 全局变量：符号已在第一遍登记
        resolve(node.getInitializer());
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, Void ctx) {
        symbolTable.enterScope(Scope.ScopeType.BLOCK, node);
        try {
            for (Statement stmt : node.getStatements()) {
                stmt.accept(this, null);
            }
        } finally {
            symbolTable.exitScope();
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        resolve(node.getExpression());
        return null;
    }

    @Override
    public Void visitDeclarationStmt(DeclarationStmt node, Void ctx) {
        VarDecl var = node.getDeclaration();
        DeclarationValidator.checkVariable(var, errors);
        // 初始化表达式先于变量本身解析：var x = x 引用外层 x
        resolve(var.getInitializer());
        TypeDefinition type = var.getTypeAnnotation() != null
                ? typeResolver.resolve(var.getTypeAnnotation(), errors) : null;
        SymbolKind kind = var.isConstant() ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
        define(new Symbol(var.getName(), kind, type, var.getNameLocation(), var));
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        resolve(node.getCondition());
        node.getThenBranch().accept(this, null);
        if (node.getElseBranch() != null) {
            node.getElseBranch().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        resolve(node.getCondition());
        node.getBody().accept(this, null);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, Void ctx) {
        symbolTable.enterScope(Scope.ScopeType.BLOCK, node);
        try {
            if (node.getInitializer() != null) {
                node.getInitializer().accept(this, null);
            }
            resolve(node.getCondition());
            resolve(node.getIncrement());
            node.getBody().accept(this, null);
        } finally {
            symbolTable.exitScope();
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        resolve(node.getValue());
        return null;
    }

    // ============ 表达式 ============

    private void resolve(Expression expr) {
        if (expr != null) {
            expr.accept(this, null);
        }
    }

    @Override
    public Void visitVariableExpr(VariableExpr node, Void ctx) {
        Symbol symbol = symbolTable.lookup(node.getName());
        if (symbol == null) {
            // 父类 / 接口继承来的成员
            TypeDefinition owner = symbolTable.getCurrentScope().findOwnerType();
            Member member = owner != null ? owner.findMember(node.getName()) : null;
            symbol = member != null ? memberSymbols.get(member) : null;
        }
        if (symbol == null) {
            errors.add(SymbolError.undefinedSymbol(node.getName(), node.getLocation()));
        } else {
            symbolTable.bindReference(node, symbol);
        }
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        resolve(node.getLeft());
        resolve(node.getRight());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        resolve(node.getOperand());
        return null;
    }

    @Override
    public Void visitGroupingExpr(GroupingExpr node, Void ctx) {
        resolve(node.getExpression());
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, Void ctx) {
        resolve(node.getTarget());
        resolve(node.getValue());
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        resolve(node.getCallee());
        for (Expression arg : node.getArguments()) {
            resolve(arg);
        }
        return null;
    }

    @Override
    public Void visitGetExpr(GetExpr node, Void ctx) {
        resolve(node.getObject());
        return null;
    }

    @Override
    public Void visitSetExpr(SetExpr node, Void ctx) {
        resolve(node.getObject());
        resolve(node.getValue());
        return null;
    }

    @Override
    public Void visitArrayLiteralExpr(ArrayLiteralExpr node, Void ctx) {
        for (Expression element : node.getElements()) {
            resolve(element);
        }
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, Void ctx) {
        resolve(node.getTarget());
        resolve(node.getIndex());
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, Void ctx) {
        resolve(node.getCondition());
        resolve(node.getThenExpr());
        resolve(node.getElseExpr());
        return null;
    }
}
