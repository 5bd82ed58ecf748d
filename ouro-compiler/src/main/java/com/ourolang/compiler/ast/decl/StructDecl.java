package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 结构体声明（值类型，只能实现接口）
 */
public class StructDecl extends TypeDecl {

    public StructDecl(SourceLocation location, List<Modifier> modifiers, String name,
                      List<TypeParameter> typeParams, List<TypeRef> interfaces,
                      List<VarDecl> properties, List<FunctionDecl> methods) {
        super(location, modifiers, name, typeParams, interfaces, properties, methods);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
