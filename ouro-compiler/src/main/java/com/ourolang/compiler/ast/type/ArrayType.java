package com.ourolang.compiler.ast.type;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 数组类型 [T]
 */
public final class ArrayType extends TypeRef {
    private final TypeRef elementType;

    public ArrayType(SourceLocation location, TypeRef elementType) {
        super(location);
        this.elementType = elementType;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    @Override
    public String getDisplayName() {
        return "[" + elementType.getDisplayName() + "]";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
