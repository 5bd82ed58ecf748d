package com.ourolang.compiler.analysis.types;

import com.ourolang.compiler.analysis.types.TypeDefinition.Category;
import com.ourolang.compiler.analysis.types.TypeDefinition.NumericKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 预定义类型常量。
 *
 * <p>所有实例在类加载时创建一次，之后不再修改。</p>
 */
public final class PrimitiveTypes {

    private PrimitiveTypes() {}

    // 有符号整数
    public static final TypeDefinition INT = primitive("Int", "i32", NumericKind.SIGNED, 32);
    public static final TypeDefinition INT8 = primitive("Int8", "i8", NumericKind.SIGNED, 8);
    public static final TypeDefinition INT16 = primitive("Int16", "i16", NumericKind.SIGNED, 16);
    public static final TypeDefinition INT32 = primitive("Int32", "i32", NumericKind.SIGNED, 32);
    public static final TypeDefinition INT64 = primitive("Int64", "i64", NumericKind.SIGNED, 64);

    // 无符号整数
    public static final TypeDefinition UINT = primitive("UInt", "ui32", NumericKind.UNSIGNED, 32);
    public static final TypeDefinition UINT8 = primitive("UInt8", "ui8", NumericKind.UNSIGNED, 8);
    public static final TypeDefinition UINT16 = primitive("UInt16", "ui16", NumericKind.UNSIGNED, 16);
    public static final TypeDefinition UINT32 = primitive("UInt32", "ui32", NumericKind.UNSIGNED, 32);
    public static final TypeDefinition UINT64 = primitive("UInt64", "ui64", NumericKind.UNSIGNED, 64);

    // 浮点
    public static final TypeDefinition FLOAT = primitive("Float", "f32", NumericKind.FLOATING, 32);
    public static final TypeDefinition DOUBLE = primitive("Double", "f64", NumericKind.FLOATING, 64);
    public static final TypeDefinition FLOAT16 = primitive("Float16", "f16", NumericKind.FLOATING, 16);
    public static final TypeDefinition FLOAT32 = primitive("Float32", "f32", NumericKind.FLOATING, 32);
    public static final TypeDefinition FLOAT64 = primitive("Float64", "f64", NumericKind.FLOATING, 64);
    public static final TypeDefinition DECIMAL = primitive("Decimal", "f128", NumericKind.DECIMAL, 128);

    // 其他内置类型
    public static final TypeDefinition BOOL = primitive("Bool", "i1", NumericKind.NONE, 1);
    public static final TypeDefinition CHAR = primitive("Char", "i32", NumericKind.NONE, 32);
    public static final TypeDefinition STRING = primitive("String", "!llvm.ptr<i8>", NumericKind.NONE, 0);
    public static final TypeDefinition VOID = primitive("Void", "none", NumericKind.NONE, 0);
    public static final TypeDefinition ANY = primitive("Any", "!ouro.any", NumericKind.NONE, 0);
    public static final TypeDefinition NEVER = primitive("Never", "!ouro.never", NumericKind.NONE, 0);

    /** 内置泛型数组 Array&lt;T&gt;，用户写作 [T] 或 Array&lt;T&gt; */
    public static final TypeDefinition ARRAY =
            new TypeDefinition("Array", Category.ARRAY, "memref<?xT>", NumericKind.NONE, 0);

    // 内部类型：null 字面量的类型 / 错误恢复
    public static final TypeDefinition NULL = new TypeDefinition("Null", Category.NULL, "none", NumericKind.NONE, 0);
    public static final TypeDefinition ERROR = new TypeDefinition("<error>", Category.ERROR, "none", NumericKind.NONE, 0);

    /** 数组的空字面量类型 [] */
    public static final TypeDefinition EMPTY_ARRAY;

    private static final Map<String, TypeDefinition> BY_NAME = new LinkedHashMap<String, TypeDefinition>();
    private static final Map<String, TypeDefinition> ALIASES = new LinkedHashMap<String, TypeDefinition>();

    static {
        ARRAY.addTypeParameter(TypeDefinition.typeParameter("T"));
        EMPTY_ARRAY = ARRAY.instantiate(Collections.singletonList(NEVER));

        for (TypeDefinition t : new TypeDefinition[]{
                INT, INT8, INT16, INT32, INT64,
                UINT, UINT8, UINT16, UINT32, UINT64,
                FLOAT, DOUBLE, FLOAT16, FLOAT32, FLOAT64, DECIMAL,
                BOOL, CHAR, STRING, VOID, ANY, NEVER}) {
            BY_NAME.put(t.getName(), t);
        }

        ALIASES.put("byte", INT8);
        ALIASES.put("short", INT16);
        ALIASES.put("long", INT64);
        ALIASES.put("ubyte", UINT8);
        ALIASES.put("ushort", UINT16);
        ALIASES.put("ulong", UINT64);
        ALIASES.put("float", FLOAT);
        ALIASES.put("double", DOUBLE);
        ALIASES.put("boolean", BOOL);
        ALIASES.put("bool", BOOL);
        ALIASES.put("char", CHAR);
        ALIASES.put("Character", CHAR);
        ALIASES.put("void", VOID);
    }

    private static TypeDefinition primitive(String name, String mlir, NumericKind kind, int bits) {
        return new TypeDefinition(name, Category.PRIMITIVE, mlir, kind, bits);
    }

    /** 所有规范名的原始类型（按声明顺序） */
    public static Map<String, TypeDefinition> all() {
        return Collections.unmodifiableMap(BY_NAME);
    }

    /** 别名表，如 bool → Bool */
    public static Map<String, TypeDefinition> aliases() {
        return Collections.unmodifiableMap(ALIASES);
    }

    /**
     * 按规范名或别名查找原始类型，找不到返回 null
     */
    public static TypeDefinition fromName(String name) {
        TypeDefinition t = BY_NAME.get(name);
        return t != null ? t : ALIASES.get(name);
    }
}
