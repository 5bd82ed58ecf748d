package com.ourolang.compiler.parser;

import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.ast.expr.*;
import com.ourolang.compiler.ast.stmt.*;
import com.ourolang.compiler.ast.type.ArrayType;
import com.ourolang.compiler.ast.type.GenericType;
import com.ourolang.compiler.ast.type.SimpleType;
import com.ourolang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private List<Declaration> parse(String source) {
        return new Parser(new Lexer(source, "<test>").scanTokens(), "<test>").parse();
    }

    private Declaration parseSingle(String source) {
        List<Declaration> decls = parse(source);
        assertEquals(1, decls.size());
        return decls.get(0);
    }

    /** 解析一个全局变量的初始化表达式 */
    private Expression parseExpr(String expr) {
        VarDecl decl = (VarDecl) parseSingle("var __e = " + expr + ";");
        return decl.getInitializer();
    }

    /** 解析函数体中的第一条语句 */
    private Statement parseStmt(String stmt) {
        FunctionDecl fn = (FunctionDecl) parseSingle("func __f() { " + stmt + " }");
        return fn.getBody().getStatements().get(0);
    }

    private ParseException assertParseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    // ================================================================
    // 声明
    // ================================================================

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("函数体中的 while 语句")
        void testFunctionWithWhile() {
            FunctionDecl fn = (FunctionDecl) parseSingle("func foo() { while (x < 10) x = x + 1; }");
            assertEquals("foo", fn.getName());
            assertTrue(fn.getBody().getStatements().get(0) instanceof WhileStmt);
        }

        @Test
        @DisplayName("类头：第一个名字是父类，其余是接口")
        void testClassHeader() {
            ClassDecl cls = (ClassDecl) parseSingle("class A: B, C { var x: Int; func f() {} }");
            assertEquals("A", cls.getName());
            assertTrue(cls.hasSuperclass());
            assertEquals("B", ((SimpleType) cls.getSuperclass()).getName());
            assertEquals(1, cls.getInterfaces().size());
            assertEquals("C", ((SimpleType) cls.getInterfaces().get(0)).getName());
            assertEquals(1, cls.getProperties().size());
            assertEquals(1, cls.getMethods().size());
        }

        @Test
        @DisplayName("无继承的类")
        void testClassWithoutHeader() {
            ClassDecl cls = (ClassDecl) parseSingle("class Empty {}");
            assertFalse(cls.hasSuperclass());
            assertTrue(cls.getInterfaces().isEmpty());
            assertTrue(cls.getProperties().isEmpty());
        }

        @Test
        @DisplayName("sealed 类与 permits 列表")
        void testSealedPermits() {
            ClassDecl cls = (ClassDecl) parseSingle("sealed class Shape permits Circle, Square {}");
            assertTrue(cls.isSealed());
            assertEquals(List.of("Circle", "Square"), cls.getPermittedSubclasses());
        }

        @Test
        @DisplayName("泛型函数、默认参数与返回类型")
        void testGenericFunction() {
            FunctionDecl fn = (FunctionDecl) parseSingle("func id<T>(a: T, n: Int = 1) -> T { return a; }");
            assertEquals(1, fn.getTypeParams().size());
            assertEquals("T", fn.getTypeParams().get(0).getName());
            assertEquals(2, fn.getParams().size());
            assertFalse(fn.getParams().get(0).hasDefaultValue());
            assertTrue(fn.getParams().get(1).hasDefaultValue());
            assertEquals("T", ((SimpleType) fn.getReturnType()).getName());
        }

        @Test
        @DisplayName("无返回类型的函数")
        void testVoidFunction() {
            FunctionDecl fn = (FunctionDecl) parseSingle("func run() {}");
            assertNull(fn.getReturnType());
            assertTrue(fn.hasBody());
        }

        @Test
        @DisplayName("接口方法签名没有函数体")
        void testInterface() {
            InterfaceDecl iface = (InterfaceDecl) parseSingle(
                    "interface Shape { func area() -> Double; func name() -> String { return \"shape\"; } }");
            assertEquals(2, iface.getMethods().size());
            assertFalse(iface.getMethods().get(0).hasBody());
            assertTrue(iface.getMethods().get(1).hasBody());
        }

        @Test
        @DisplayName("结构体与构造器")
        void testStruct() {
            StructDecl st = (StructDecl) parseSingle(
                    "struct Point { var x: Int; var y: Int; init(x: Int, y: Int) { this.x = x; this.y = y; } }");
            assertEquals(2, st.getProperties().size());
            assertTrue(st.getMethods().get(0).isConstructor());
            assertEquals(FunctionDecl.CONSTRUCTOR_NAME, st.getMethods().get(0).getName());
        }

        @Test
        @DisplayName("枚举：原始类型、case 与方法")
        void testEnum() {
            EnumDecl en = (EnumDecl) parseSingle(
                    "enum Color: Int { case red = 1; case green = 2; blue, func describe() -> String { return \"c\"; } }");
            assertEquals("Int", ((SimpleType) en.getRawType()).getName());
            assertEquals(3, en.getCases().size());
            assertTrue(en.getCases().get(0).hasRawValue());
            assertFalse(en.getCases().get(2).hasRawValue());
            assertEquals(1, en.getMethods().size());
        }

        @Test
        @DisplayName("var 与 const 声明")
        void testVarAndConst() {
            List<Declaration> decls = parse("var a: Int; const b = 2; var c: [String] = [];");
            VarDecl a = (VarDecl) decls.get(0);
            assertFalse(a.isConstant());
            assertFalse(a.hasInitializer());
            VarDecl b = (VarDecl) decls.get(1);
            assertTrue(b.isConstant());
            assertNull(b.getTypeAnnotation());
            VarDecl c = (VarDecl) decls.get(2);
            assertTrue(c.getTypeAnnotation() instanceof ArrayType);
        }

        @Test
        @DisplayName("泛型类型引用")
        void testGenericTypeRef() {
            VarDecl v = (VarDecl) parseSingle("var m: Map<String, [Int]>;");
            GenericType g = (GenericType) v.getTypeAnnotation();
            assertEquals("Map", g.getName());
            assertEquals(2, g.getTypeArgs().size());
            assertTrue(g.getTypeArgs().get(1) instanceof ArrayType);
        }

        @Test
        @DisplayName("修饰符")
        void testModifiers() {
            ClassDecl cls = (ClassDecl) parseSingle("public abstract class Base { abstract func f(); }");
            assertTrue(cls.hasModifier(Modifier.PUBLIC));
            assertTrue(cls.isAbstract());
            assertTrue(cls.getMethods().get(0).hasModifier(Modifier.ABSTRACT));
            assertFalse(cls.getMethods().get(0).hasBody());
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("if/else 链")
        void testIfElse() {
            IfStmt stmt = (IfStmt) parseStmt("if (a) { b(); } else if (c) d(); else e();");
            assertTrue(stmt.hasElse());
            assertTrue(stmt.getElseBranch() instanceof IfStmt);
            assertTrue(((IfStmt) stmt.getElseBranch()).hasElse());
        }

        @Test
        @DisplayName("三段式 for")
        void testFor() {
            ForStmt stmt = (ForStmt) parseStmt("for (var i = 0; i < 10; i += 1) { continue; }");
            assertTrue(stmt.getInitializer() instanceof DeclarationStmt);
            assertTrue(stmt.getCondition() instanceof BinaryExpr);
            assertTrue(stmt.getIncrement() instanceof AssignExpr);
        }

        @Test
        @DisplayName("for 的三个子句都可省略")
        void testEmptyFor() {
            ForStmt stmt = (ForStmt) parseStmt("for (;;) break;");
            assertNull(stmt.getInitializer());
            assertNull(stmt.getCondition());
            assertNull(stmt.getIncrement());
            assertTrue(stmt.getBody() instanceof BreakStmt);
        }

        @Test
        @DisplayName("return 可带或不带值")
        void testReturn() {
            assertFalse(((ReturnStmt) parseStmt("return;")).hasValue());
            assertTrue(((ReturnStmt) parseStmt("return 1;")).hasValue());
        }

        @Test
        @DisplayName("局部变量声明")
        void testLocalVar() {
            DeclarationStmt stmt = (DeclarationStmt) parseStmt("var y: Int = 3;");
            assertEquals("y", stmt.getDeclaration().getName());
        }

        @Test
        @DisplayName("嵌套块")
        void testNestedBlock() {
            Block block = (Block) parseStmt("{ { } x; }");
            assertEquals(2, block.getStatements().size());
            assertTrue(block.getStatements().get(0) instanceof Block);
        }
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式优先级")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testMultiplicative() {
            BinaryExpr e = (BinaryExpr) parseExpr("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, e.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) e.getRight()).getOperator());
        }

        @Test
        @DisplayName("加法左结合")
        void testLeftAssociative() {
            BinaryExpr e = (BinaryExpr) parseExpr("1 - 2 - 3");
            assertTrue(e.getLeft() instanceof BinaryExpr);
            assertTrue(e.getRight() instanceof Literal);
        }

        @Test
        @DisplayName("幂运算右结合")
        void testPowerRightAssociative() {
            BinaryExpr e = (BinaryExpr) parseExpr("2 ** 3 ** 2");
            assertEquals(BinaryExpr.BinaryOp.POW, e.getOperator());
            assertTrue(e.getLeft() instanceof Literal);
            assertEquals(BinaryExpr.BinaryOp.POW, ((BinaryExpr) e.getRight()).getOperator());
        }

        @Test
        @DisplayName("赋值右结合")
        void testAssignRightAssociative() {
            ExpressionStmt stmt = (ExpressionStmt) parseStmt("a = b = 1;");
            AssignExpr outer = (AssignExpr) stmt.getExpression();
            assertTrue(outer.getValue() instanceof AssignExpr);
        }

        @Test
        @DisplayName("逻辑与优先于逻辑或，?? 低于逻辑或")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) parseExpr("a || b && c");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            assertEquals(BinaryExpr.BinaryOp.AND, ((BinaryExpr) or.getRight()).getOperator());

            BinaryExpr coalesce = (BinaryExpr) parseExpr("a ?? b || c");
            assertEquals(BinaryExpr.BinaryOp.NULL_COALESCE, coalesce.getOperator());
        }

        @Test
        @DisplayName("比较优先于相等，位与低于相等")
        void testComparisonPrecedence() {
            BinaryExpr e = (BinaryExpr) parseExpr("a & b == c < d");
            assertEquals(BinaryExpr.BinaryOp.BIT_AND, e.getOperator());
            BinaryExpr eq = (BinaryExpr) e.getRight();
            assertEquals(BinaryExpr.BinaryOp.EQ, eq.getOperator());
            assertEquals(BinaryExpr.BinaryOp.LT, ((BinaryExpr) eq.getRight()).getOperator());
        }

        @Test
        @DisplayName("条件表达式右结合")
        void testConditional() {
            ConditionalExpr e = (ConditionalExpr) parseExpr("a ? 1 : b ? 2 : 3");
            assertTrue(e.getElseExpr() instanceof ConditionalExpr);
        }

        @Test
        @DisplayName("一元与后缀")
        void testUnaryAndPostfix() {
            UnaryExpr neg = (UnaryExpr) parseExpr("-a.b(1)[0]");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            IndexExpr index = (IndexExpr) neg.getOperand();
            CallExpr call = (CallExpr) index.getTarget();
            assertEquals(1, call.getArguments().size());
            assertEquals("b", ((GetExpr) call.getCallee()).getName());
        }

        @Test
        @DisplayName("字段赋值生成 SetExpr")
        void testSetExpr() {
            ExpressionStmt stmt = (ExpressionStmt) parseStmt("p.x = 1;");
            assertTrue(stmt.getExpression() instanceof SetExpr);
        }

        @Test
        @DisplayName("数组字面量与括号")
        void testArrayAndGrouping() {
            ArrayLiteralExpr arr = (ArrayLiteralExpr) parseExpr("[1, (2 + 3)]");
            assertEquals(2, arr.getElements().size());
            assertTrue(arr.getElements().get(1) instanceof GroupingExpr);
        }
    }

    // ================================================================
    // 错误
    // ================================================================

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少分号")
        void testMissingSemicolon() {
            ParseException ex = assertParseError("var x = 1");
            assertTrue(ex.getMessage().contains("line 1"));
        }

        @Test
        @DisplayName("顶层语句不是声明")
        void testTopLevelStatement() {
            ParseException ex = assertParseError("x = 1;");
            assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, ex.getKind());
            assertEquals(1, ex.getColumn());
        }

        @Test
        @DisplayName("未闭合的函数体")
        void testUnclosedBody() {
            assertParseError("func f() { return 1;");
        }

        @Test
        @DisplayName("重复或冲突的修饰符")
        void testInvalidModifiers() {
            assertEquals(ParseException.Kind.INVALID_MODIFIER, assertParseError("public public class A {}").getKind());
            assertEquals(ParseException.Kind.INVALID_MODIFIER, assertParseError("abstract final class A {}").getKind());
        }

        @Test
        @DisplayName("嵌套层数超出上限")
        void testNestingTooDeep() {
            StringBuilder sb = new StringBuilder("var x = ");
            for (int i = 0; i < 50; i++) sb.append('(');
            sb.append('1');
            for (int i = 0; i < 50; i++) sb.append(')');
            sb.append(';');
            Parser parser = new Parser(new Lexer(sb.toString()).scanTokens(), "<test>", 20);
            ParseException ex = assertThrows(ParseException.class, parser::parse);
            assertEquals(ParseException.Kind.NESTING_TOO_DEEP, ex.getKind());

            // 默认上限足以容纳
            assertEquals(1, parse(sb.toString()).size());
        }

        @Test
        @DisplayName("超长的左结合运算链按嵌套深度报错而不是栈溢出")
        void testLongOperatorChain() {
            StringBuilder sb = new StringBuilder("var x = 1");
            for (int i = 0; i < 50000; i++) sb.append(" + 1");
            sb.append(';');
            ParseException ex = assertParseError(sb.toString());
            assertEquals(ParseException.Kind.NESTING_TOO_DEEP, ex.getKind());

            StringBuilder logic = new StringBuilder("var y = true");
            for (int i = 0; i < 50000; i++) logic.append(" && true");
            logic.append(';');
            assertEquals(ParseException.Kind.NESTING_TOO_DEEP, assertParseError(logic.toString()).getKind());

            StringBuilder access = new StringBuilder("var z = a");
            for (int i = 0; i < 50000; i++) access.append(".b");
            access.append(';');
            assertEquals(ParseException.Kind.NESTING_TOO_DEEP, assertParseError(access.toString()).getKind());
        }

        @Test
        @DisplayName("上限以内的运算链正常解析为左结合")
        void testChainWithinLimit() {
            StringBuilder sb = new StringBuilder("1");
            for (int i = 0; i < 100; i++) sb.append(" - 1");
            Expression expr = parseExpr(sb.toString());
            int depth = 0;
            while (expr instanceof BinaryExpr) {
                assertEquals(BinaryExpr.BinaryOp.SUB, ((BinaryExpr) expr).getOperator());
                expr = ((BinaryExpr) expr).getLeft();
                depth++;
            }
            assertEquals(100, depth);
        }

        @Test
        @DisplayName("运算链超出自定义上限后解析器仍可容错继续")
        void testChainRecovery() {
            StringBuilder sb = new StringBuilder("var x = 1");
            for (int i = 0; i < 40; i++) sb.append(" * 2");
            sb.append(";\nvar ok = 1 + 2 + 3;");
            ParseResult result = new Parser(new Lexer(sb.toString()).scanTokens(), "<test>", 20).parseTolerant();
            assertEquals(1, result.getErrors().size());
            assertEquals(1, result.getDeclarations().size());
            assertEquals("ok", ((VarDecl) result.getDeclarations().get(0)).getName());
        }
    }

    // ================================================================
    // 容错解析
    // ================================================================

    @Nested
    @DisplayName("容错解析")
    class TolerantTests {

        @Test
        @DisplayName("跳过错误声明继续解析")
        void testRecovery() {
            String source = "func bad( { }\nvar ok = 1;\nclass A { var x = ; }\nfunc good() {}";
            ParseResult result = new Parser(new Lexer(source).scanTokens()).parseTolerant();
            assertEquals(2, result.getErrors().size());
            assertTrue(result.hasErrors());
            List<Declaration> decls = result.getDeclarations();
            assertEquals(2, decls.size());
            assertEquals("ok", ((VarDecl) decls.get(0)).getName());
            assertEquals("good", ((FunctionDecl) decls.get(1)).getName());
        }

        @Test
        @DisplayName("在顶层分号与闭合花括号处重新同步")
        void testResyncAtSemicolonAndBrace() {
            ParseResult result = new Parser(new Lexer("x = 1;\ny = 2;\nvar ok = 3;").scanTokens()).parseTolerant();
            assertEquals(2, result.getErrors().size());
            assertEquals(1, result.getDeclarations().size());
            assertEquals("ok", result.getDeclarations().get(0).getName());

            result = new Parser(new Lexer("func f() { return 1 +; } var after = 1; }\nfunc g() {}").scanTokens())
                    .parseTolerant();
            assertEquals(2, result.getErrors().size());
            List<Declaration> decls = result.getDeclarations();
            assertEquals(2, decls.size());
            assertEquals("after", decls.get(0).getName());
            assertEquals("g", decls.get(1).getName());
        }

        @Test
        @DisplayName("无错误时与严格解析一致")
        void testNoErrors() {
            ParseResult result = new Parser(new Lexer("var a = 1; func f() {}").scanTokens()).parseTolerant();
            assertFalse(result.hasErrors());
            assertEquals(2, result.getDeclarations().size());
        }
    }
}
