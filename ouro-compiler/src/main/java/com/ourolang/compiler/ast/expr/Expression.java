package com.ourolang.compiler.ast.expr;

import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
    // 类型信息（类型检查后填充）
    protected TypeDefinition resolvedType;

    protected Expression(SourceLocation location) {
        super(location);
    }

    public TypeDefinition getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(TypeDefinition type) {
        this.resolvedType = type;
    }
}
