package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.PrimitiveTypes;
import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.decl.VarDecl;
import com.ourolang.compiler.lexer.Lexer;
import com.ourolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeChecker 单元测试
 */
class TypeCheckerTest {

    private List<Declaration> parse(String source) {
        return new Parser(new Lexer(source, "<test>").scanTokens(), "<test>").parse();
    }

    private List<SymbolError> check(String source) {
        return new TypeChecker().check(parse(source));
    }

    private void assertClean(String source) {
        List<SymbolError> errors = check(source);
        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
    }

    private SymbolError single(String source) {
        List<SymbolError> errors = check(source);
        assertEquals(1, errors.size(), () -> "errors: " + errors);
        return errors.get(0);
    }

    private void assertMismatch(String source, String expected, String actual) {
        SymbolError err = single(source);
        assertEquals(SymbolError.Kind.TYPE_MISMATCH, err.getKind());
        assertEquals(expected, err.getExpected());
        assertEquals(actual, err.getActual());
    }

    private void assertInvalid(String source, String message) {
        SymbolError err = single(source);
        assertEquals(SymbolError.Kind.INVALID_OPERATION, err.getKind());
        assertEquals(message, err.getMessage());
    }

    // ================================================================
    // 变量声明
    // ================================================================

    @Nested
    @DisplayName("变量声明")
    class VarDeclTests {

        @Test
        @DisplayName("整数赋给 String 报告类型不匹配")
        void testStringFromInt() {
            SymbolError err = single("var x: String = 42;");
            assertEquals(SymbolError.Kind.TYPE_MISMATCH, err.getKind());
            assertEquals("String", err.getExpected());
            assertEquals("Int", err.getActual());
            assertEquals("Type mismatch: expected 'String', got 'Int'", err.getMessage());
            assertEquals(1, err.getLine());
            assertEquals(17, err.getColumn());
        }

        @Test
        @DisplayName("数值拓宽")
        void testWidening() {
            assertClean("var a: Int = 1; var b: Double = a; var c: Int64 = a;");
            assertMismatch("var a: Double = 1.0; var b: Int = a;", "Int", "Double");
        }

        @Test
        @DisplayName("整数字面量可赋给能容纳它的整数类型")
        void testLiteralFits() {
            assertClean("var a: Int8 = 100; var b: Int8 = -128; var c: UInt8 = 255; var d: Float = 1.5;");
            assertMismatch("var a: Int8 = 300;", "Int8", "Int");
        }

        @Test
        @DisplayName("带正号的字面量与带负号的一样宽松")
        void testUnaryPlusLiteral() {
            assertClean("var a: Int8 = +100; var b: UInt8 = (+255); var c: Float = +1.5;");
            assertMismatch("var a: Int8 = +200;", "Int8", "Int");
        }

        @Test
        @DisplayName("超出 32 位的整数字面量推断为 Int64")
        void testBigLiteral() {
            List<Declaration> decls = parse("var big = 3000000000;");
            assertTrue(new TypeChecker().check(decls).isEmpty());
            VarDecl big = (VarDecl) decls.get(0);
            assertSame(PrimitiveTypes.INT64, big.getInitializer().getResolvedType());
        }

        @Test
        @DisplayName("未标注的变量使用推断类型")
        void testInference() {
            assertMismatch("var x = 1 + 2.0; var y: Int = x;", "Int", "Double");
            assertClean("var s = \"a\" + \"b\"; var t: String = s;");
        }

        @Test
        @DisplayName("不能从 null 推断类型")
        void testInferNull() {
            SymbolError err = single("var n = null;");
            assertEquals(SymbolError.Kind.INVALID_OPERATION, err.getKind());
        }

        @Test
        @DisplayName("多个独立错误全部报告")
        void testAccumulate() {
            List<SymbolError> errors = check("var a: String = 1; var b: Bool = \"x\"; var c: Int = true;");
            assertEquals(3, errors.size());
            for (SymbolError e : errors) {
                assertEquals(SymbolError.Kind.TYPE_MISMATCH, e.getKind());
            }
        }

        @Test
        @DisplayName("未定义符号不产生级联错误")
        void testNoCascade() {
            SymbolError err = single("var x: Int = missing + 1;");
            assertEquals(SymbolError.Kind.UNDEFINED_SYMBOL, err.getKind());
        }

        @Test
        @DisplayName("数组元素类型")
        void testArrays() {
            assertClean("var a: [Int] = [1, 2, 3]; var e: [String] = []; var n: Int = a[0] + a.length;");
            assertMismatch("var a = [1, \"two\"];", "Int", "String");
        }
    }

    @Nested
    @DisplayName("声明前引用")
    class ForwardReferenceTests {

        @Test
        @DisplayName("引用后声明的未标注全局变量")
        void testForwardGlobal() {
            assertMismatch("var a = b; var b = 1; var c: String = a;", "String", "Int");
        }

        @Test
        @DisplayName("引用后声明类型中的未标注属性")
        void testForwardProperty() {
            assertMismatch("class A { var x: String = B().y; } class B { var y = 1; }", "String", "Int");
        }

        @Test
        @DisplayName("属性初始化引用后声明的全局变量")
        void testPropertyUsesLaterGlobal() {
            assertMismatch("class A { var x: Bool = g; } var g = \"s\";", "Bool", "String");
        }

        @Test
        @DisplayName("被提前推断的声明只报告一次错误")
        void testCheckedOnce() {
            SymbolError err = single("var a = b; var b = \"x\" * 2;");
            assertEquals(SymbolError.Kind.INVALID_OPERATION, err.getKind());
        }

        @Test
        @DisplayName("初始化表达式循环依赖")
        void testCycle() {
            SymbolError err = single("var a = b; var b = a;");
            assertEquals(SymbolError.Kind.INVALID_OPERATION, err.getKind());
            assertEquals("Cannot infer the type of 'a': its initializer depends on itself", err.getMessage());
            assertEquals(20, err.getColumn());
        }
    }

    // ================================================================
    // 函数与返回
    // ================================================================

    @Nested
    @DisplayName("函数与返回")
    class FunctionTests {

        @Test
        @DisplayName("类型正确的函数没有诊断")
        void testAdd() {
            assertClean("func add(a: Int, b: Int) -> Int { return a + b; }");
        }

        @Test
        @DisplayName("返回类型不匹配")
        void testReturnMismatch() {
            assertMismatch("func f() -> Int { return \"s\"; }", "Int", "String");
        }

        @Test
        @DisplayName("无返回类型的函数不能返回值")
        void testVoidReturnsValue() {
            assertMismatch("func f() { return 1; }", "Void", "Int");
        }

        @Test
        @DisplayName("缺少返回值")
        void testMissingReturnValue() {
            assertInvalid("func f() -> Int { return; }", "Missing return value in function returning 'Int'");
        }

        @Test
        @DisplayName("参数个数")
        void testArity() {
            assertInvalid("func g(a: Int) -> Int { return a; } var r = g(1, 2);",
                    "'g' expects 1 argument(s) but got 2");
        }

        @Test
        @DisplayName("默认参数可省略")
        void testDefaultParam() {
            assertClean("func g(a: Int, b: Int = 2) -> Int { return a + b; } var r: Int = g(1);");
            assertInvalid("func g(a: Int, b: Int = 2) -> Int { return a; } var r = g();",
                    "'g' expects 1 to 2 argument(s) but got 0");
        }

        @Test
        @DisplayName("实参类型")
        void testArgumentType() {
            assertMismatch("func g(s: String) {} func h() { g(1); }", "String", "Int");
        }

        @Test
        @DisplayName("泛型函数按实参推断")
        void testGenericInference() {
            assertClean("func id<T>(v: T) -> T { return v; } var s: String = id(\"x\");");
            assertMismatch("func id<T>(v: T) -> T { return v; } var n: Int = id(\"x\");", "Int", "String");
        }

        @Test
        @DisplayName("函数名不能当作值使用")
        void testFunctionValue() {
            assertInvalid("func f() {} var g = f;", "Function 'f' must be called");
        }
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("字符串拼接只接受字符串")
        void testNoStringCoercion() {
            assertInvalid("var u = \"a\" + 1;", "Operator '+' cannot be applied to 'String' and 'Int'");
        }

        @Test
        @DisplayName("逻辑运算要求 Bool")
        void testLogical() {
            assertMismatch("var b = true && 1;", "Bool", "Int");
            assertMismatch("var b = !1;", "Bool", "Int");
        }

        @Test
        @DisplayName("相等比较两侧类型不兼容")
        void testEquality() {
            assertMismatch("var e = 1 == \"a\";", "Int", "String");
            assertClean("var e = 1 == 2.0;");
        }

        @Test
        @DisplayName("比较运算")
        void testRelational() {
            assertClean("var a = 1 < 2; var b = \"a\" < \"b\"; var c: Int = 1 <=> 2;");
            assertInvalid("var a = true < false;", "Operator '<' cannot be applied to 'Bool' and 'Bool'");
        }

        @Test
        @DisplayName("位运算要求整数")
        void testBitwise() {
            assertClean("var a: Int = 6 & 3 | 1 << 2;");
            assertInvalid("var a = 1.5 & 1;", "Operator '&' cannot be applied to 'Double' and 'Int'");
        }

        @Test
        @DisplayName("条件表达式分支类型不兼容")
        void testConditional() {
            assertMismatch("var x = true ? 1 : \"s\";", "Int", "String");
            assertClean("var x: Double = false ? 1 : 2.5;");
        }

        @Test
        @DisplayName("条件必须是 Bool")
        void testCondition() {
            assertMismatch("func f() { if (1) {} }", "Bool", "Int");
            assertMismatch("func f() { while (\"s\") {} }", "Bool", "String");
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("循环外的 break/continue")
        void testLoopControl() {
            assertInvalid("func f() { break; }", "'break' outside of a loop");
            assertInvalid("func f() { continue; }", "'continue' outside of a loop");
            assertClean("func f() { while (true) { if (false) break; continue; } for (;;) break; }");
        }

        @Test
        @DisplayName("给常量赋值")
        void testAssignConstant() {
            assertInvalid("const c = 1; func f() { c = 2; }", "Cannot assign to constant 'c'");
        }

        @Test
        @DisplayName("复合赋值")
        void testCompoundAssign() {
            assertClean("func f() { var i = 0; i += 2; var s = \"a\"; s += \"b\"; }");
            assertMismatch("func f() { var i = 0; i = \"x\"; }", "Int", "String");
        }
    }

    // ================================================================
    // 类型与成员
    // ================================================================

    @Nested
    @DisplayName("类型与成员")
    class MemberTests {

        @Test
        @DisplayName("成员访问")
        void testMemberAccess() {
            assertClean("class P { var x: Int = 0; func get() -> Int { return this.x; } } "
                    + "func f(p: P) -> Int { return p.x + p.get(); }");
            SymbolError err = single("class P { var x: Int = 0; } func f(p: P) -> Int { return p.y; }");
            assertEquals(SymbolError.Kind.UNDEFINED_SYMBOL, err.getKind());
            assertEquals("Type 'P' has no member 'y'", err.getMessage());
        }

        @Test
        @DisplayName("继承的成员")
        void testInheritedMember() {
            assertClean("class A { func name() -> String { return \"a\"; } } class B: A {} "
                    + "func f(b: B) -> String { return b.name(); }");
        }

        @Test
        @DisplayName("子类可赋给父类")
        void testSubtypeAssign() {
            assertClean("class A {} class B: A {} var a: A = B();");
            assertMismatch("class A {} class B: A {} var b: B = A();", "B", "A");
        }

        @Test
        @DisplayName("结构体逐成员构造")
        void testStructMemberwise() {
            assertClean("struct Pt { var x: Int; var y: Int; } var p = Pt(1, 2); var q = Pt();");
            assertInvalid("struct Pt { var x: Int; var y: Int; } var p = Pt(1);",
                    "'Pt' expects 2 argument(s) but got 1");
        }

        @Test
        @DisplayName("构造器参数")
        void testInit() {
            assertClean("class C { var n: Int; init(n: Int) { this.n = n; } } var c = C(1);");
            assertMismatch("class C { var n: Int; init(n: Int) { this.n = n; } } var c = C(\"x\");", "Int", "String");
        }

        @Test
        @DisplayName("不能实例化抽象类型与接口")
        void testAbstractInstantiation() {
            SymbolError err = single("abstract class Shape {} var s = Shape();");
            assertEquals(SymbolError.Kind.ABSTRACT_INSTANTIATION, err.getKind());
            assertEquals("Cannot instantiate abstract type 'Shape'", err.getMessage());
            assertEquals(SymbolError.Kind.ABSTRACT_INSTANTIATION, single("interface I {} var i = I();").getKind());
        }

        @Test
        @DisplayName("枚举 case 与原始值")
        void testEnum() {
            assertClean("enum Color: Int { case red = 1; case green = 2; } var c: Color = Color.red;");
            assertMismatch("enum E: Int { case a = \"x\"; }", "Int", "String");
            assertEquals(SymbolError.Kind.INVALID_OPERATION, single("enum E { case a = 1; }").getKind());
        }

        @Test
        @DisplayName("通过类型名访问实例成员")
        void testInstanceThroughType() {
            SymbolError err = single("class P { var x: Int = 0; } var v = P.x;");
            assertEquals(SymbolError.Kind.INVALID_OPERATION, err.getKind());
        }

        @Test
        @DisplayName("静态成员可通过类型名访问")
        void testStaticThroughType() {
            assertClean("class K { static const max: Int = 10; } var v: Int = K.max;");
        }
    }

    @Test
    @DisplayName("check(AnalysisResult) 包含语义分析错误")
    void testCheckAnalysisResult() {
        AnalysisResult analysis = new SemanticAnalyzer().analyze(parse("var x = 1; var x = 2; var y: String = 3;"));
        List<SymbolError> errors = new TypeChecker().check(analysis);
        assertEquals(2, errors.size());
        assertEquals(SymbolError.Kind.DUPLICATE_DEFINITION, errors.get(0).getKind());
        assertEquals(SymbolError.Kind.TYPE_MISMATCH, errors.get(1).getKind());
    }
}
