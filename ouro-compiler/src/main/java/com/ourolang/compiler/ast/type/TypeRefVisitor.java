package com.ourolang.compiler.ast.type;

/**
 * TypeRef 轻量访问者接口，用于替代 instanceof 分派。
 */
public interface TypeRefVisitor<R> {
    R visitSimple(SimpleType type);
    R visitArray(ArrayType type);
    R visitGeneric(GenericType type);
}
