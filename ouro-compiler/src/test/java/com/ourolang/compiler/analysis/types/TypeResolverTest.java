package com.ourolang.compiler.analysis.types;

import com.ourolang.compiler.analysis.SymbolError;
import com.ourolang.compiler.analysis.SymbolKind;
import com.ourolang.compiler.analysis.Symbol;
import com.ourolang.compiler.analysis.SymbolTable;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.type.ArrayType;
import com.ourolang.compiler.ast.type.GenericType;
import com.ourolang.compiler.ast.type.SimpleType;
import com.ourolang.compiler.ast.type.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeResolver 与 TypeCompatibility 单元测试
 */
class TypeResolverTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private SymbolTable table;
    private TypeResolver resolver;
    private List<SymbolError> errors;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
        resolver = new TypeResolver(table);
        errors = new ArrayList<>();
    }

    private static TypeRef simple(String name) {
        return new SimpleType(LOC, name);
    }

    @Nested
    @DisplayName("名字解析")
    class ResolveTests {

        @Test
        @DisplayName("Int 解析为 i32")
        void testInt() {
            TypeDefinition t = resolver.resolve("Int");
            assertNotNull(t);
            assertEquals("i32", t.getMlirType());
        }

        @Test
        @DisplayName("别名解析到规范类型")
        void testAliases() {
            assertSame(PrimitiveTypes.BOOL, resolver.resolve("bool"));
            assertSame(PrimitiveTypes.INT64, resolver.resolve("long"));
            assertSame(PrimitiveTypes.DOUBLE, resolver.resolve("double"));
        }

        @Test
        @DisplayName("未知名字返回 null")
        void testUnknown() {
            assertNull(resolver.resolve("Nope"));
        }

        @Test
        @DisplayName("用户声明的类型")
        void testDeclared() {
            TypeDefinition point = TypeDefinition.declared("Point", TypeDefinition.Category.STRUCT);
            table.define(new Symbol("Point", SymbolKind.TYPE, point, LOC, null));
            assertSame(point, resolver.resolve(simple("Point"), errors));
            assertTrue(errors.isEmpty());
        }
    }

    @Nested
    @DisplayName("类型引用解析")
    class TypeRefTests {

        @Test
        @DisplayName("未定义类型报告错误并返回 <error>")
        void testUndefined() {
            TypeDefinition t = resolver.resolve(simple("Missing"), errors);
            assertTrue(t.isError());
            assertEquals(1, errors.size());
            assertEquals(SymbolError.Kind.UNDEFINED_TYPE, errors.get(0).getKind());
            assertEquals("Undefined type 'Missing'", errors.get(0).getMessage());
        }

        @Test
        @DisplayName("数组类型")
        void testArray() {
            TypeDefinition t = resolver.resolve(new ArrayType(LOC, simple("Int")), errors);
            assertTrue(t.isArray());
            assertSame(PrimitiveTypes.INT, t.getElementType());
            assertTrue(t.sameAs(TypeDefinition.arrayOf(PrimitiveTypes.INT)));
        }

        @Test
        @DisplayName("非泛型类型带类型实参")
        void testWrongTypeArgCount() {
            TypeDefinition t = resolver.resolve(new GenericType(LOC, "Int", Arrays.asList(simple("String"))), errors);
            assertTrue(t.isError());
            assertEquals(SymbolError.Kind.INVALID_OPERATION, errors.get(0).getKind());
        }

        @Test
        @DisplayName("不带类型实参的 Array 报告实参个数错误")
        void testBareArray() {
            TypeDefinition t = resolver.resolve(simple("Array"), errors);
            assertTrue(t.isError());
            assertEquals(1, errors.size());
            assertEquals(SymbolError.Kind.INVALID_OPERATION, errors.get(0).getKind());
            assertEquals("Type 'Array' expects 1 type argument(s) but got 0", errors.get(0).getMessage());

            errors.clear();
            TypeDefinition ok = resolver.resolve(new GenericType(LOC, "Array", Arrays.asList(simple("Int"))), errors);
            assertTrue(errors.isEmpty());
            assertTrue(ok.isArray());
        }

        @Test
        @DisplayName("resolveOrNull 不报告错误")
        void testResolveOrNull() {
            assertNull(resolver.resolveOrNull(simple("Missing")));
            assertSame(PrimitiveTypes.STRING, resolver.resolveOrNull(simple("String")));
        }
    }

    @Nested
    @DisplayName("兼容性")
    class CompatibilityTests {

        @Test
        @DisplayName("数值拓宽")
        void testWidening() {
            assertTrue(TypeCompatibility.isAssignable(PrimitiveTypes.INT, PrimitiveTypes.INT64));
            assertTrue(TypeCompatibility.isAssignable(PrimitiveTypes.INT, PrimitiveTypes.DOUBLE));
            assertTrue(TypeCompatibility.isAssignable(PrimitiveTypes.UINT8, PrimitiveTypes.INT16));
            assertFalse(TypeCompatibility.isAssignable(PrimitiveTypes.INT64, PrimitiveTypes.INT));
            assertFalse(TypeCompatibility.isAssignable(PrimitiveTypes.DOUBLE, PrimitiveTypes.INT));
            assertFalse(TypeCompatibility.isAssignable(PrimitiveTypes.INT, PrimitiveTypes.UINT));
        }

        @Test
        @DisplayName("数值不自动转换为字符串")
        void testNoStringCoercion() {
            assertFalse(TypeCompatibility.isAssignable(PrimitiveTypes.INT, PrimitiveTypes.STRING));
            assertFalse(TypeCompatibility.isAssignable(PrimitiveTypes.STRING, PrimitiveTypes.INT));
        }

        @Test
        @DisplayName("null 只能赋给引用类型")
        void testNull() {
            TypeDefinition cls = TypeDefinition.declared("Box", TypeDefinition.Category.CLASS);
            assertTrue(TypeCompatibility.isAssignable(PrimitiveTypes.NULL, cls));
            assertFalse(TypeCompatibility.isAssignable(PrimitiveTypes.NULL, PrimitiveTypes.INT));
        }

        @Test
        @DisplayName("子类可以赋给父类与接口")
        void testSubtype() {
            TypeDefinition base = TypeDefinition.declared("Base", TypeDefinition.Category.CLASS);
            TypeDefinition iface = TypeDefinition.declared("Named", TypeDefinition.Category.INTERFACE);
            TypeDefinition derived = TypeDefinition.declared("Derived", TypeDefinition.Category.CLASS);
            derived.setSuperclass(base);
            base.addInterface(iface);
            assertTrue(TypeCompatibility.isAssignable(derived, base));
            assertTrue(TypeCompatibility.isAssignable(derived, iface));
            assertFalse(TypeCompatibility.isAssignable(base, derived));
        }

        @Test
        @DisplayName("错误类型与任何类型兼容")
        void testErrorType() {
            assertTrue(TypeCompatibility.isAssignable(PrimitiveTypes.ERROR, PrimitiveTypes.STRING));
            assertTrue(TypeCompatibility.isAssignable(PrimitiveTypes.BOOL, PrimitiveTypes.ERROR));
        }

        @Test
        @DisplayName("数组实参不变，空数组可赋给任何数组")
        void testArrays() {
            TypeDefinition ints = TypeDefinition.arrayOf(PrimitiveTypes.INT);
            TypeDefinition longs = TypeDefinition.arrayOf(PrimitiveTypes.INT64);
            assertFalse(TypeCompatibility.isAssignable(ints, longs));
            assertTrue(TypeCompatibility.isAssignable(PrimitiveTypes.EMPTY_ARRAY, longs));
        }

        @Test
        @DisplayName("整数范围")
        void testFitsInteger() {
            assertTrue(TypeCompatibility.fitsInteger(127, PrimitiveTypes.INT8));
            assertFalse(TypeCompatibility.fitsInteger(128, PrimitiveTypes.INT8));
            assertFalse(TypeCompatibility.fitsInteger(-1, PrimitiveTypes.UINT8));
            assertTrue(TypeCompatibility.fitsInteger(Long.MIN_VALUE, PrimitiveTypes.INT64));
        }

        @Test
        @DisplayName("公共数值类型")
        void testCommonNumeric() {
            assertSame(PrimitiveTypes.INT64, TypeCompatibility.commonNumericType(PrimitiveTypes.INT, PrimitiveTypes.INT64));
            assertSame(PrimitiveTypes.DOUBLE, TypeCompatibility.commonNumericType(PrimitiveTypes.INT, PrimitiveTypes.DOUBLE));
            assertSame(PrimitiveTypes.INT64, TypeCompatibility.commonNumericType(PrimitiveTypes.INT, PrimitiveTypes.UINT));
        }
    }
}
