package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 类声明
 *
 * <p>类头 {@code class A: B, C} 中第一个名字记为父类，其余记为接口；
 * 第一个名字是否真的是类由语义分析判断。</p>
 */
public class ClassDecl extends TypeDecl {
    private final TypeRef superclass;                // 可选
    private final List<String> permittedSubclasses;  // sealed ... permits X, Y

    public ClassDecl(SourceLocation location, List<Modifier> modifiers, String name,
                     List<TypeParameter> typeParams, TypeRef superclass, List<TypeRef> interfaces,
                     List<String> permittedSubclasses, List<VarDecl> properties, List<FunctionDecl> methods) {
        super(location, modifiers, name, typeParams, interfaces, properties, methods);
        this.superclass = superclass;
        this.permittedSubclasses = permittedSubclasses != null
                ? permittedSubclasses : Collections.<String>emptyList();
    }

    public TypeRef getSuperclass() {
        return superclass;
    }

    public boolean hasSuperclass() {
        return superclass != null;
    }

    public List<String> getPermittedSubclasses() {
        return permittedSubclasses;
    }

    public boolean isAbstract() {
        return hasModifier(Modifier.ABSTRACT);
    }

    public boolean isFinal() {
        return hasModifier(Modifier.FINAL);
    }

    public boolean isSealed() {
        return hasModifier(Modifier.SEALED);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}
