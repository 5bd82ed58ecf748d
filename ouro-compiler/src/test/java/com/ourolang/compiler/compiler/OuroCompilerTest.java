package com.ourolang.compiler.compiler;

import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.decl.VarDecl;
import com.ourolang.compiler.ast.expr.BinaryExpr;
import com.ourolang.compiler.ast.expr.Literal;
import com.ourolang.compiler.optimizer.PassPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OuroCompiler 单元测试
 */
class OuroCompilerTest {

    private final OuroCompiler compiler = new OuroCompiler();

    private CompilationResult compile(String source) {
        return compiler.compile(source, new CompilerOptions().setFileName("main.ouro"));
    }

    @Nested
    @DisplayName("成功编译")
    class SuccessTests {

        @Test
        @DisplayName("无诊断，返回声明与符号表")
        void testClean() {
            CompilationResult result = compile("func add(a: Int, b: Int) -> Int { return a + b; } var total = add(1, 2);");
            assertFalse(result.hasErrors());
            assertTrue(result.getDiagnostics().isEmpty());
            assertEquals("main.ouro", result.getFileName());
            assertEquals(2, result.getDeclarations().size());
            assertNotNull(result.getSymbolTable());
            assertNotNull(result.getSymbolTable().lookup("add"));
        }

        @Test
        @DisplayName("默认启用优化")
        void testOptimize() {
            CompilationResult result = compile("var v = 1 + 2;");
            assertTrue(((VarDecl) result.getDeclarations().get(0)).getInitializer() instanceof Literal);
        }

        @Test
        @DisplayName("关闭优化时保留原始表达式")
        void testOptimizeDisabled() {
            CompilationResult result = compiler.compile("var v = 1 + 2;", new CompilerOptions().setOptimize(false));
            assertTrue(((VarDecl) result.getDeclarations().get(0)).getInitializer() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("使用自定义优化器")
        void testCustomOptimizer() {
            OuroCompiler noop = new OuroCompiler(new PassPipeline());
            CompilationResult result = noop.compile("var v = 1 + 2;", new CompilerOptions());
            assertTrue(((VarDecl) result.getDeclarations().get(0)).getInitializer() instanceof BinaryExpr);
        }
    }

    @Nested
    @DisplayName("诊断")
    class DiagnosticTests {

        @Test
        @DisplayName("词法错误")
        void testLexerError() {
            CompilationResult result = compile("var s = \"abc");
            assertTrue(result.hasErrors());
            Diagnostic d = result.getDiagnostics().get(0);
            assertEquals(Diagnostic.Stage.LEXER, d.getStage());
            assertEquals(1, d.getLine());
            assertEquals(9, d.getColumn());
            assertTrue(result.getDeclarations().isEmpty());
            assertNull(result.getSymbolTable());
        }

        @Test
        @DisplayName("语法错误在严格模式下停在第一个")
        void testParseError() {
            CompilationResult result = compile("var = 1;\nfunc f( {}");
            assertEquals(1, result.getDiagnostics().size());
            Diagnostic d = result.getDiagnostics().get(0);
            assertEquals(Diagnostic.Stage.PARSER, d.getStage());
            assertEquals(Diagnostic.Severity.ERROR, d.getSeverity());
            assertEquals(1, d.getLine());
            assertTrue(result.getDeclarations().isEmpty());
        }

        @Test
        @DisplayName("容错模式收集全部语法错误并继续分析")
        void testTolerant() {
            String source = "func bad( { }\nvar ok = 1;\nclass A { var x = ; }\nfunc good() {}";
            CompilationResult result = compiler.compile(source, new CompilerOptions().setTolerantParsing(true));
            long parserErrors = result.getDiagnostics().stream()
                    .filter(d -> d.getStage() == Diagnostic.Stage.PARSER).count();
            assertEquals(2, parserErrors);
            assertEquals(2, result.getDeclarations().size());
            assertNotNull(result.getSymbolTable());
        }

        @Test
        @DisplayName("语义错误保留声明，不执行优化")
        void testSemanticError() {
            CompilationResult result = compile("var x: String = 42; var y = 1 + 2;");
            List<Diagnostic> diagnostics = result.getDiagnostics();
            assertEquals(1, diagnostics.size());
            assertEquals(Diagnostic.Stage.SEMANTIC, diagnostics.get(0).getStage());
            assertEquals(17, diagnostics.get(0).getColumn());
            assertNotNull(result.getSymbolTable());

            Declaration y = result.getDeclarations().get(1);
            assertTrue(((VarDecl) y).getInitializer() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("嵌套深度来自选项")
        void testNestingDepth() {
            CompilationResult result = compiler.compile("var v = ((((((1))))));",
                    new CompilerOptions().setMaxNestingDepth(3));
            assertEquals(Diagnostic.Stage.PARSER, result.getDiagnostics().get(0).getStage());
        }
    }

    @Nested
    @DisplayName("取消")
    class CancellationTests {

        @Test
        @DisplayName("已取消的标记在第一个阶段前抛出")
        void testCancelled() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            assertTrue(token.isCancelled());
            CancellationException e = assertThrows(CancellationException.class,
                    () -> compiler.compile("var v = 1;", new CompilerOptions(), token));
            assertTrue(e.getMessage().contains("lexing"));
        }

        @Test
        @DisplayName("NONE 不能被取消")
        void testNoneToken() {
            assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
            assertFalse(CancellationToken.NONE.isCancelled());
        }
    }

    @Nested
    @DisplayName("选项")
    class OptionsTests {

        @Test
        @DisplayName("默认值与复制")
        void testDefaults() {
            CompilerOptions options = new CompilerOptions();
            assertEquals("<input>", options.getFileName());
            assertTrue(options.isOptimize());
            assertFalse(options.isTolerantParsing());

            CompilerOptions copy = options.copy().setFileName("a.ouro");
            assertEquals("<input>", options.getFileName());
            assertEquals("a.ouro", copy.getFileName());
        }

        @Test
        @DisplayName("非法数值被拒绝")
        void testInvalid() {
            CompilerOptions options = new CompilerOptions();
            assertThrows(IllegalArgumentException.class, () -> options.setMaxNestingDepth(0));
            assertThrows(IllegalArgumentException.class, () -> options.setParallelism(0));
            assertThrows(IllegalArgumentException.class, () -> options.setCacheMaximumSize(-1));
        }
    }
}
