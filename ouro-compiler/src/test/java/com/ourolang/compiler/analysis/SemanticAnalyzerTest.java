package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.ast.decl.ClassDecl;
import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.decl.FunctionDecl;
import com.ourolang.compiler.ast.stmt.ReturnStmt;
import com.ourolang.compiler.lexer.Lexer;
import com.ourolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SemanticAnalyzer 单元测试
 */
class SemanticAnalyzerTest {

    private AnalysisResult analyze(String source) {
        List<Declaration> decls = new Parser(new Lexer(source, "<test>").scanTokens(), "<test>").parse();
        return new SemanticAnalyzer().analyze(decls);
    }

    private List<SymbolError> errors(String source) {
        return analyze(source).getErrors();
    }

    private List<SymbolError.Kind> kinds(String source) {
        return errors(source).stream().map(SymbolError::getKind).collect(Collectors.toList());
    }

    private SymbolError single(String source, SymbolError.Kind kind) {
        List<SymbolError> errs = errors(source);
        assertEquals(1, errs.size(), () -> "errors: " + errs);
        assertEquals(kind, errs.get(0).getKind());
        return errs.get(0);
    }

    // ================================================================
    // 作用域
    // ================================================================

    @Nested
    @DisplayName("作用域与重复定义")
    class ScopeTests {

        @Test
        @DisplayName("同一作用域重复定义")
        void testDuplicateGlobal() {
            SymbolError err = single("var x = 1; var x = 2;", SymbolError.Kind.DUPLICATE_DEFINITION);
            assertEquals("Duplicate definition of 'x'", err.getMessage());
            assertEquals(16, err.getColumn());
        }

        @Test
        @DisplayName("嵌套作用域遮蔽不是错误")
        void testShadowing() {
            assertTrue(errors("var x = 1; func f() { var x = \"s\"; { var x = true; } }").isEmpty());
        }

        @Test
        @DisplayName("参数与函数体顶层局部变量同名")
        void testParamDuplicate() {
            single("func f(a: Int) { var a = 1; }", SymbolError.Kind.DUPLICATE_DEFINITION);
        }

        @Test
        @DisplayName("参数可被内层块遮蔽")
        void testParamShadowedInBlock() {
            assertTrue(errors("func f(a: Int) { if (true) { var a = \"x\"; } }").isEmpty());
        }

        @Test
        @DisplayName("重复的成员")
        void testDuplicateMember() {
            single("class A { var n: Int = 0; func n() {} }", SymbolError.Kind.DUPLICATE_DEFINITION);
        }

        @Test
        @DisplayName("for 初始化变量只在循环内可见")
        void testForScope() {
            SymbolError err = single("func f() { for (var i = 0; i < 3; i += 1) {} i = 1; }",
                    SymbolError.Kind.UNDEFINED_SYMBOL);
            assertEquals("Undefined symbol 'i'", err.getMessage());
        }
    }

    // ================================================================
    // 名字解析
    // ================================================================

    @Nested
    @DisplayName("名字解析")
    class ResolutionTests {

        @Test
        @DisplayName("未定义的类型")
        void testUndefinedType() {
            SymbolError err = single("var x: Foo;", SymbolError.Kind.UNDEFINED_TYPE);
            assertEquals("Undefined type 'Foo'", err.getMessage());
        }

        @Test
        @DisplayName("未定义的符号")
        void testUndefinedSymbol() {
            single("func f() { y = 1; }", SymbolError.Kind.UNDEFINED_SYMBOL);
        }

        @Test
        @DisplayName("同一文件内的前向引用")
        void testForwardReference() {
            assertTrue(errors("func make() -> Later { return Later(); } class Later { func peer() -> Other { return Other(); } } class Other {}")
                    .isEmpty());
        }

        @Test
        @DisplayName("标识符绑定到声明的符号")
        void testReferenceBinding() {
            AnalysisResult result = analyze("var g = 1; func f() -> Int { return g; }");
            FunctionDecl fn = (FunctionDecl) result.getDeclarations().get(1);
            ReturnStmt ret = (ReturnStmt) fn.getBody().getStatements().get(0);
            Symbol symbol = result.getSymbolTable().getReferencedSymbol(ret.getValue());
            assertNotNull(symbol);
            assertEquals("g", symbol.getName());
            assertEquals(SymbolKind.VARIABLE, symbol.getKind());
        }

        @Test
        @DisplayName("方法中可直接使用继承来的属性")
        void testInheritedMember() {
            assertTrue(errors("class Base { var n: Int = 0; } class D: Base { func get() -> Int { return n; } }")
                    .isEmpty());
        }

        @Test
        @DisplayName("泛型参数在函数内可用")
        void testGenericParam() {
            assertTrue(errors("func id<T>(v: T) -> T { var copy: T = v; return copy; }").isEmpty());
        }
    }

    // ================================================================
    // 继承
    // ================================================================

    @Nested
    @DisplayName("继承")
    class InheritanceTests {

        @Test
        @DisplayName("父类与接口写入类型定义")
        void testHeader() {
            AnalysisResult result = analyze("class B {} interface C {} class A: B, C {}");
            assertFalse(result.hasErrors());
            ClassDecl a = (ClassDecl) result.getDeclarations().get(2);
            TypeDefinition def = result.getSymbolTable().getTypeDefinition(a);
            assertEquals("B", def.getSuperclass().getName());
            assertEquals(List.of("C"), def.getInterfaceNames());
        }

        @Test
        @DisplayName("类头第一个名字是接口时报告诊断")
        void testFirstNameIsInterface() {
            AnalysisResult result = analyze("interface I {} class A: I {}");
            assertEquals(1, result.getErrors().size());
            assertEquals(SymbolError.Kind.INVALID_INHERITANCE, result.getErrors().get(0).getKind());
            TypeDefinition def = result.getSymbolTable().getTypeDefinition((ClassDecl) result.getDeclarations().get(1));
            assertNull(def.getSuperclass());
            assertEquals(List.of("I"), def.getInterfaceNames());
        }

        @Test
        @DisplayName("继承 final 类")
        void testFinal() {
            SymbolError err = single("final class F {} class G: F {}", SymbolError.Kind.INVALID_INHERITANCE);
            assertEquals("Cannot inherit from final class 'F'", err.getMessage());
        }

        @Test
        @DisplayName("sealed 类只允许 permits 中的子类")
        void testSealed() {
            SymbolError err = single("sealed class S permits A {} class A: S {} class B: S {}",
                    SymbolError.Kind.INVALID_INHERITANCE);
            assertTrue(err.getMessage().contains("'B'"));
        }

        @Test
        @DisplayName("后续名字不是接口")
        void testNonInterfaceInList() {
            single("class B {} class C {} class A: B, C {}", SymbolError.Kind.INVALID_INHERITANCE);
        }

        @Test
        @DisplayName("循环继承只报告一次并被断开")
        void testCircular() {
            SymbolError err = single("class A: B {} class B: A {}", SymbolError.Kind.CIRCULAR_INHERITANCE);
            assertEquals("Circular inheritance involving 'A'", err.getMessage());
        }

        @Test
        @DisplayName("override 没有覆盖任何方法")
        void testOverrideNothing() {
            SymbolError err = single("class A { override func f() {} }", SymbolError.Kind.INVALID_OVERRIDE);
            assertEquals("Method 'f' overrides nothing", err.getMessage());
        }

        @Test
        @DisplayName("override 覆盖父类方法")
        void testValidOverride() {
            assertTrue(errors("class A { func f() {} } class B: A { override func f() {} }").isEmpty());
        }
    }

    // ================================================================
    // 接口一致性
    // ================================================================

    @Nested
    @DisplayName("接口一致性")
    class ConformanceTests {

        @Test
        @DisplayName("未实现接口方法")
        void testGap() {
            SymbolError err = single("interface Shape { func area() -> Double; } class Base {} class Sq: Base, Shape {}",
                    SymbolError.Kind.CONFORMANCE_GAP);
            assertEquals("Type 'Sq' does not implement 'area' required by 'Shape'", err.getMessage());
        }

        @Test
        @DisplayName("实现了全部方法")
        void testImplemented() {
            assertTrue(errors("interface Shape { func area() -> Double; } class Base {} "
                    + "class Sq: Base, Shape { func area() -> Double { return 1.0; } }").isEmpty());
        }

        @Test
        @DisplayName("接口默认实现不需要再实现")
        void testDefaultMethod() {
            assertTrue(errors("interface Named { func name() -> String { return \"n\"; } } class Base {} "
                    + "class P: Base, Named {}").isEmpty());
        }

        @Test
        @DisplayName("父类已实现的方法满足子类的接口要求")
        void testInheritedImplementation() {
            assertTrue(errors("interface Shape { func area() -> Double; } "
                    + "class Base { func area() -> Double { return 0.0; } } class Sq: Base, Shape {}").isEmpty());
        }

        @Test
        @DisplayName("抽象类不要求实现，但具体子类要求")
        void testAbstractChain() {
            List<SymbolError.Kind> ks = kinds("abstract class Shape { abstract func area() -> Double; } "
                    + "class Circle: Shape {}");
            assertEquals(List.of(SymbolError.Kind.CONFORMANCE_GAP), ks);
        }

        @Test
        @DisplayName("结构体实现接口")
        void testStructConformance() {
            single("interface Show { func show() -> String; } struct P: Show {}", SymbolError.Kind.CONFORMANCE_GAP);
        }
    }

    // ================================================================
    // 声明规则
    // ================================================================

    @Nested
    @DisplayName("声明规则")
    class DeclarationRuleTests {

        @Test
        @DisplayName("非抽象类型的方法必须有函数体")
        void testMissingBody() {
            SymbolError err = single("class A { func f(); }", SymbolError.Kind.INVALID_OPERATION);
            assertEquals("Method 'f' must have a body in non-abstract type 'A'", err.getMessage());
        }

        @Test
        @DisplayName("常量必须初始化")
        void testConstWithoutInit() {
            SymbolError err = single("const c: Int;", SymbolError.Kind.INVALID_OPERATION);
            assertEquals("Constant 'c' must be initialized", err.getMessage());
        }

        @Test
        @DisplayName("局部变量需要类型或初始化")
        void testLocalNeedsType() {
            SymbolError err = single("func f() { var v; }", SymbolError.Kind.INVALID_OPERATION);
            assertEquals("Variable 'v' needs a type annotation or an initializer", err.getMessage());
        }

        @Test
        @DisplayName("顶层函数必须有函数体")
        void testTopLevelFunctionBody() {
            single("func f();", SymbolError.Kind.INVALID_OPERATION);
        }
    }

    @Test
    @DisplayName("分析器实例可重复使用")
    void testReuse() {
        SemanticAnalyzer analyzer = new SemanticAnalyzer();
        List<Declaration> first = new Parser(new Lexer("var x = 1;").scanTokens()).parse();
        List<Declaration> second = new Parser(new Lexer("var x = 2;").scanTokens()).parse();
        assertFalse(analyzer.analyze(first).hasErrors());
        assertFalse(analyzer.analyze(second).hasErrors());
    }
}
