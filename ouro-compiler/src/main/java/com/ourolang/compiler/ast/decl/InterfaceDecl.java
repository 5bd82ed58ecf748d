package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 接口声明
 *
 * <p>方法可以没有方法体（要求实现），也可以带默认实现。</p>
 */
public class InterfaceDecl extends TypeDecl {

    public InterfaceDecl(SourceLocation location, List<Modifier> modifiers, String name,
                         List<TypeParameter> typeParams, List<TypeRef> extendedInterfaces,
                         List<FunctionDecl> methods) {
        super(location, modifiers, name, typeParams, extendedInterfaces, null, methods);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInterfaceDecl(this, context);
    }
}
