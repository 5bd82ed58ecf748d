package com.ourolang.compiler.ast.type;

import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 类型参数声明（如 class Box<T> 中的 T）
 */
public final class TypeParameter extends AstNode {
    private final String name;

    public TypeParameter(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeParameter(this, context);
    }
}
