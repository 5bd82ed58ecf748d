package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.decl.FunctionDecl;
import com.ourolang.compiler.ast.stmt.*;
import com.ourolang.compiler.lexer.Lexer;
import com.ourolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeadCodeElimination 单元测试
 */
class DeadCodeEliminationTest {

    /** 对单个函数运行 DCE，返回函数体语句 */
    private List<Statement> body(String source) {
        List<Declaration> decls = new Parser(new Lexer(source, "<test>").scanTokens(), "<test>").parse();
        List<Declaration> result = new DeadCodeElimination().run(decls);
        return ((FunctionDecl) result.get(0)).getBody().getStatements();
    }

    @Test
    @DisplayName("return 之后的语句被删除")
    void testAfterReturn() {
        List<Statement> stmts = body("func f() -> Int { g(); return 1; h(); var x = 2; }");
        assertEquals(2, stmts.size());
        assertTrue(stmts.get(1) instanceof ReturnStmt);
    }

    @Test
    @DisplayName("循环体中 break/continue 之后的语句被删除")
    void testAfterBreak() {
        List<Statement> stmts = body("func f() { while (c) { break; g(); } }");
        WhileStmt loop = (WhileStmt) stmts.get(0);
        assertEquals(1, ((Block) loop.getBody()).getStatements().size());
    }

    @Test
    @DisplayName("条件为 true 的 if 替换为 then 分支")
    void testIfTrue() {
        List<Statement> stmts = body("func f() { if (true) g(); else h(); }");
        assertEquals(1, stmts.size());
        assertTrue(stmts.get(0) instanceof ExpressionStmt);
    }

    @Test
    @DisplayName("条件为 false 且无 else 的 if 被删除")
    void testIfFalseWithoutElse() {
        assertTrue(body("func f() { if (false) { g(); } }").isEmpty());
    }

    @Test
    @DisplayName("被选中的声明分支包在块中以保持作用域")
    void testDeclarationBranch() {
        List<Statement> stmts = body("func f() { if (false) g(); else var x = 1; }");
        assertTrue(stmts.get(0) instanceof Block);
        assertTrue(((Block) stmts.get(0)).getStatements().get(0) instanceof DeclarationStmt);
    }

    @Test
    @DisplayName("while(false) 被删除")
    void testWhileFalse() {
        assertTrue(body("func f() { while (false) { g(); } }").isEmpty());
    }

    @Test
    @DisplayName("非字面量条件保持不变")
    void testDynamicCondition() {
        List<Statement> stmts = body("func f() { if (c) g(); while (c) h(); }");
        assertTrue(stmts.get(0) instanceof IfStmt);
        assertTrue(stmts.get(1) instanceof WhileStmt);
    }
}
