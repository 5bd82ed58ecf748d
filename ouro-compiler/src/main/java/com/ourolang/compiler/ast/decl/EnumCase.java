package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.expr.Expression;

/**
 * 枚举成员（{@code Case2 = 5}）
 */
public class EnumCase extends AstNode {
    private final String name;
    private final Expression rawValue;  // 可选

    public EnumCase(SourceLocation location, String name, Expression rawValue) {
        super(location);
        this.name = name;
        this.rawValue = rawValue;
    }

    public String getName() {
        return name;
    }

    public Expression getRawValue() {
        return rawValue;
    }

    public boolean hasRawValue() {
        return rawValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumCase(this, context);
    }
}
