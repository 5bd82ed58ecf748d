package com.ourolang.compiler.analysis.types;

/**
 * 类型兼容性判断：判断 source 是否可以赋值给 target。
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /**
     * 判断 from 类型的值是否可以赋给 to 类型。
     */
    public static boolean isAssignable(TypeDefinition from, TypeDefinition to) {
        if (from == null || to == null) return true;

        // 错误类型与任何类型兼容，避免级联报错
        if (from.isError() || to.isError()) return true;

        if (from.sameAs(to)) return true;
        if (to == PrimitiveTypes.ANY) return true;

        // Never 是所有类型的子类型
        if (from == PrimitiveTypes.NEVER) return true;

        // null 只能赋给引用类型
        if (from.isNullType()) return !to.isValueType() && to != PrimitiveTypes.VOID;

        // 数值拓宽
        if (from.isNumeric() && to.isNumeric()) {
            return isNumericWidening(from, to);
        }

        // 泛型实例：不变；空数组字面量 [] 可赋给任何数组；原始泛型类型可赋给其实例
        if (from.getGenericBase() != null || to.getGenericBase() != null) {
            return isGenericAssignable(from, to);
        }

        // 子类 / 实现的接口（传递）
        return from.isSubtypeOf(to);
    }

    private static boolean isGenericAssignable(TypeDefinition from, TypeDefinition to) {
        if (from.sameAs(PrimitiveTypes.EMPTY_ARRAY) && to.isArray()) return true;
        TypeDefinition fromBase = from.getGenericBase() != null ? from.getGenericBase() : from;
        TypeDefinition toBase = to.getGenericBase() != null ? to.getGenericBase() : to;
        if (fromBase == toBase) {
            // 同一泛型：一方未带实参时按原始类型处理，否则要求实参完全一致
            return from.getGenericBase() == null || to.getGenericBase() == null || from.sameAs(to);
        }
        return to.getGenericBase() == null && fromBase.isSubtypeOf(to);
    }

    /**
     * 数值拓宽规则：
     * <ul>
     *   <li>整数 → 同符号且不更窄的整数</li>
     *   <li>无符号 → 严格更宽的有符号整数</li>
     *   <li>任意整数 → 浮点</li>
     *   <li>浮点 → 不更窄的浮点</li>
     *   <li>任意数值 → Decimal</li>
     * </ul>
     */
    public static boolean isNumericWidening(TypeDefinition from, TypeDefinition to) {
        TypeDefinition.NumericKind f = from.getNumericKind();
        TypeDefinition.NumericKind t = to.getNumericKind();
        if (t == TypeDefinition.NumericKind.DECIMAL) {
            return f != TypeDefinition.NumericKind.NONE;
        }
        if (f == TypeDefinition.NumericKind.DECIMAL) {
            return false;
        }
        if (from.isIntegral() && to.isFloating()) {
            return true;
        }
        if (f == t) {
            return to.getBitWidth() >= from.getBitWidth();
        }
        if (f == TypeDefinition.NumericKind.UNSIGNED && t == TypeDefinition.NumericKind.SIGNED) {
            return to.getBitWidth() > from.getBitWidth();
        }
        return false;
    }

    /**
     * 两个数值类型的公共类型：能拓宽的一方取另一方，否则依次尝试 Int64、Double、Decimal
     */
    public static TypeDefinition commonNumericType(TypeDefinition a, TypeDefinition b) {
        if (isNumericWidening(a, b)) return b;
        if (isNumericWidening(b, a)) return a;
        TypeDefinition[] candidates = {PrimitiveTypes.INT64, PrimitiveTypes.DOUBLE, PrimitiveTypes.DECIMAL};
        for (TypeDefinition c : candidates) {
            if (isNumericWidening(a, c) && isNumericWidening(b, c)) return c;
        }
        return PrimitiveTypes.DECIMAL;
    }

    /**
     * 两个类型的公共类型（用于 ?: 和 ??），不存在时返回 null
     */
    public static TypeDefinition commonType(TypeDefinition a, TypeDefinition b) {
        if (a.isError() || b.isError()) return PrimitiveTypes.ERROR;
        if (a.isNullType()) return isAssignable(a, b) ? b : null;
        if (b.isNullType()) return isAssignable(b, a) ? a : null;
        if (a.isNumeric() && b.isNumeric()) return commonNumericType(a, b);
        if (isAssignable(b, a)) return a;
        if (isAssignable(a, b)) return b;
        return null;
    }

    /**
     * 整数字面量是否落在目标整数类型的取值范围内
     */
    public static boolean fitsInteger(long value, TypeDefinition target) {
        if (!target.isIntegral()) return false;
        int bits = target.getBitWidth();
        if (target.getNumericKind() == TypeDefinition.NumericKind.UNSIGNED) {
            return value >= 0 && (bits >= 64 || value < (1L << bits));
        }
        if (bits >= 64) return true;
        long max = (1L << (bits - 1)) - 1;
        return value >= -max - 1 && value <= max;
    }
}
