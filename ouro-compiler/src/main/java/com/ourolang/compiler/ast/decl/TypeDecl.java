package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 类型声明基类（class / struct / enum / interface）
 */
public abstract class TypeDecl extends Declaration {
    protected final List<TypeParameter> typeParams;
    protected final List<TypeRef> interfaces;
    protected final List<VarDecl> properties;
    protected final List<FunctionDecl> methods;

    protected TypeDecl(SourceLocation location, List<Modifier> modifiers, String name,
                       List<TypeParameter> typeParams, List<TypeRef> interfaces,
                       List<VarDecl> properties, List<FunctionDecl> methods) {
        super(location, modifiers, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.interfaces = interfaces != null ? interfaces : Collections.<TypeRef>emptyList();
        this.properties = properties != null ? properties : Collections.<VarDecl>emptyList();
        this.methods = methods != null ? methods : Collections.<FunctionDecl>emptyList();
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    /** 实现（或继承）的接口列表 */
    public List<TypeRef> getInterfaces() {
        return interfaces;
    }

    public List<VarDecl> getProperties() {
        return properties;
    }

    public List<FunctionDecl> getMethods() {
        return methods;
    }
}
