package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.decl.FunctionDecl;
import com.ourolang.compiler.ast.stmt.ExpressionStmt;
import com.ourolang.compiler.ast.stmt.Statement;
import com.ourolang.compiler.formatter.OuroFormatter;
import com.ourolang.compiler.lexer.Lexer;
import com.ourolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PassPipeline 单元测试
 */
class PassPipelineTest {

    private List<Declaration> parse(String source) {
        return new Parser(new Lexer(source, "<test>").scanTokens(), "<test>").parse();
    }

    @Test
    @DisplayName("默认管线：常量折叠后再消除死代码")
    void testDefaultPipeline() {
        PassPipeline pipeline = PassPipeline.createDefault();
        assertEquals(2, pipeline.getPasses().size());
        assertEquals("ConstantFolding", pipeline.getPasses().get(0).getName());
        assertEquals("DeadCodeElimination", pipeline.getPasses().get(1).getName());

        List<Declaration> result = pipeline.optimize(parse("func f() { if (1 > 2) { a(); } else { b(); } while (1 == 2) c(); }"));
        List<Statement> stmts = ((FunctionDecl) result.get(0)).getBody().getStatements();
        assertEquals(1, stmts.size());
    }

    @Test
    @DisplayName("优化是幂等的")
    void testIdempotent() {
        String source = "const k = 2 * 3 + 1; "
                + "func f(x: Int) -> Int { if (k > 5 && true) { return x + (4 - 1); } return 0; g(); } "
                + "class C { var s: String = \"a\" + \"b\"; func m() { while (false) {} for (;;) { break; h(); } } }";
        PassPipeline pipeline = PassPipeline.createDefault();
        OuroFormatter formatter = new OuroFormatter();
        List<Declaration> once = pipeline.optimize(parse(source));
        List<Declaration> twice = pipeline.optimize(once);
        assertEquals(formatter.format(once), formatter.format(twice));
    }

    @Test
    @DisplayName("按登记顺序运行自定义 pass")
    void testCustomPass() {
        List<String> order = new ArrayList<>();
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(recording("first", order));
        pipeline.addPass(recording("second", order));
        List<Declaration> decls = parse("var x = 1;");
        assertSame(decls, pipeline.optimize(decls));
        assertEquals(List.of("first", "second"), order);
    }

    @Test
    @DisplayName("空管线原样返回")
    void testEmptyPipeline() {
        List<Declaration> decls = parse("func f() { return; g(); }");
        List<Declaration> result = new PassPipeline().optimize(decls);
        assertSame(decls, result);
        assertTrue(((FunctionDecl) result.get(0)).getBody().getStatements().get(1) instanceof ExpressionStmt);
    }

    private static OptimizationPass recording(String name, List<String> order) {
        return new OptimizationPass() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<Declaration> run(List<Declaration> declarations) {
                order.add(name);
                return declarations;
            }
        };
    }
}
