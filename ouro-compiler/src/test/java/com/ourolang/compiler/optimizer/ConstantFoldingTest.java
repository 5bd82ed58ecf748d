package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.analysis.TypeChecker;
import com.ourolang.compiler.analysis.types.PrimitiveTypes;
import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.ast.decl.FunctionDecl;
import com.ourolang.compiler.ast.decl.VarDecl;
import com.ourolang.compiler.ast.expr.BinaryExpr;
import com.ourolang.compiler.ast.expr.Expression;
import com.ourolang.compiler.ast.expr.Literal;
import com.ourolang.compiler.ast.stmt.ReturnStmt;
import com.ourolang.compiler.lexer.Lexer;
import com.ourolang.compiler.lexer.LiteralValue;
import com.ourolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConstantFolding 单元测试
 */
class ConstantFoldingTest {

    private List<Declaration> parse(String source) {
        return new Parser(new Lexer(source, "<test>").scanTokens(), "<test>").parse();
    }

    /** 折叠单个全局变量的初始化表达式 */
    private Expression fold(String expr) {
        List<Declaration> result = new ConstantFolding().run(parse("var v = " + expr + ";"));
        return ((VarDecl) result.get(0)).getInitializer();
    }

    private Literal foldToLiteral(String expr) {
        Expression e = fold(expr);
        assertTrue(e instanceof Literal, () -> expr + " should fold to a literal");
        return (Literal) e;
    }

    @Nested
    @DisplayName("整数")
    class IntegerTests {

        @Test
        @DisplayName("按优先级折叠")
        void testArithmetic() {
            assertEquals(7, foldToLiteral("1 + 2 * 3").getValue().asInteger());
            assertEquals(9, foldToLiteral("(1 + 2) * 3").getValue().asInteger());
            assertEquals(1024, foldToLiteral("2 ** 10").getValue().asInteger());
            assertEquals(-3, foldToLiteral("-(1 + 2)").getValue().asInteger());
        }

        @Test
        @DisplayName("Int 溢出按 32 位回绕")
        void testIntWrap() {
            assertEquals(Integer.MIN_VALUE, foldToLiteral("2147483647 + 1").getValue().asInteger());
        }

        @Test
        @DisplayName("超出 32 位的操作数按 64 位计算")
        void testLong() {
            assertEquals(3000000001L, foldToLiteral("3000000000 + 1").getValue().asInteger());
        }

        @Test
        @DisplayName("位运算")
        void testBitwise() {
            assertEquals(0b110 | 0b001, foldToLiteral("6 | 1").getValue().asInteger());
            assertEquals(16, foldToLiteral("1 << 4").getValue().asInteger());
            assertEquals(~5, foldToLiteral("~5").getValue().asInteger());
        }

        @Test
        @DisplayName("除以零不折叠")
        void testDivideByZero() {
            assertTrue(fold("1 / 0") instanceof BinaryExpr);
            assertTrue(fold("1 % 0") instanceof BinaryExpr);
        }
    }

    @Nested
    @DisplayName("其他字面量")
    class OtherLiteralTests {

        @Test
        @DisplayName("整数与浮点混合按 Double")
        void testMixed() {
            Literal lit = foldToLiteral("1 + 2.5");
            assertEquals(LiteralValue.Kind.FLOAT, lit.getKind());
            assertEquals(3.5, lit.getValue().asFloat());
        }

        @Test
        @DisplayName("非有限结果不折叠")
        void testNonFinite() {
            assertTrue(fold("1.0 / 0.0") instanceof BinaryExpr);
        }

        @Test
        @DisplayName("字符串拼接与比较")
        void testStrings() {
            assertEquals("ab", foldToLiteral("\"a\" + \"b\"").getValue().asString());
            assertTrue(foldToLiteral("\"a\" < \"b\"").getValue().asBoolean());
        }

        @Test
        @DisplayName("布尔逻辑与比较")
        void testBooleans() {
            assertTrue(foldToLiteral("1 < 2 && true").getValue().asBoolean());
            assertFalse(foldToLiteral("!true").getValue().asBoolean());
            assertTrue(foldToLiteral("1 == 1.0").getValue().asBoolean());
        }

        @Test
        @DisplayName("含变量的表达式不折叠")
        void testNonConstant() {
            Expression e = fold("a + 1");
            assertTrue(e instanceof BinaryExpr);
            BinaryExpr partial = (BinaryExpr) fold("a + (2 * 3)");
            assertEquals(6, ((Literal) partial.getRight()).getValue().asInteger());
        }
    }

    @Nested
    @DisplayName("结构")
    class StructureTests {

        @Test
        @DisplayName("折叠结果沿用原表达式位置")
        void testLocation() {
            List<Declaration> decls = parse("var v = 40 + 2;");
            Expression original = ((VarDecl) decls.get(0)).getInitializer();
            Expression folded = ((VarDecl) new ConstantFolding().run(decls).get(0)).getInitializer();
            assertEquals(original.getLine(), folded.getLine());
            assertEquals(original.getColumn(), folded.getColumn());
        }

        @Test
        @DisplayName("折叠结果保留推断类型")
        void testResolvedType() {
            List<Declaration> decls = parse("var v = 40 + 2;");
            assertTrue(new TypeChecker().check(decls).isEmpty());
            Expression folded = ((VarDecl) new ConstantFolding().run(decls).get(0)).getInitializer();
            assertTrue(PrimitiveTypes.INT.sameAs(folded.getResolvedType()));
        }

        @Test
        @DisplayName("函数体内折叠，不修改输入树")
        void testFunctionBody() {
            List<Declaration> decls = parse("func f() -> Int { return 2 * 21; }");
            List<Declaration> result = new ConstantFolding().run(decls);
            ReturnStmt ret = (ReturnStmt) ((FunctionDecl) result.get(0)).getBody().getStatements().get(0);
            assertEquals(42, ((Literal) ret.getValue()).getValue().asInteger());

            ReturnStmt originalRet = (ReturnStmt) ((FunctionDecl) decls.get(0)).getBody().getStatements().get(0);
            assertTrue(originalRet.getValue() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("无可折叠内容时返回原列表")
        void testUnchanged() {
            List<Declaration> decls = parse("var v = a; func f() { g(); }");
            assertSame(decls, new ConstantFolding().run(decls));
        }
    }
}
