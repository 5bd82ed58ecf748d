package com.ourolang.compiler.ast.type;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 泛型类型实例（如 Box<Int>, Array<String>）
 */
public final class GenericType extends TypeRef {
    private final String name;
    private final List<TypeRef> typeArgs;

    public GenericType(SourceLocation location, String name, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = typeArgs;
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public String getDisplayName() {
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).getDisplayName());
        }
        return sb.append('>').toString();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGenericType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }
}
