package com.ourolang.compiler.ast.stmt;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.VarDecl;

/**
 * 声明语句（局部 var / const）
 */
public class DeclarationStmt extends Statement {
    private final VarDecl declaration;

    public DeclarationStmt(SourceLocation location, VarDecl declaration) {
        super(location);
        this.declaration = declaration;
    }

    public VarDecl getDeclaration() {
        return declaration;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclarationStmt(this, context);
    }
}
