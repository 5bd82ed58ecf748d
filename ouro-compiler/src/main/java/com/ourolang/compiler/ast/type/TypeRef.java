package com.ourolang.compiler.ast.type;

import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 类型引用基类（按名字引用，语义分析时解析）
 */
public abstract class TypeRef extends AstNode {

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    /** 源码形式的类型名，如 {@code [Int]}、{@code Box<String>} */
    public abstract String getDisplayName();

    /** 接受轻量 TypeRefVisitor 进行类型引用分派 */
    public abstract <R> R accept(TypeRefVisitor<R> visitor);

    @Override
    public String toString() {
        return getDisplayName();
    }
}
