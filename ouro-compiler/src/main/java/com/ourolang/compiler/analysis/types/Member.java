package com.ourolang.compiler.analysis.types;

import java.util.Map;

/**
 * 类型成员：属性、方法、构造器或枚举 case
 */
public final class Member {

    public enum Kind {
        PROPERTY,
        METHOD,
        CONSTRUCTOR,
        ENUM_CASE
    }

    private final String name;
    private final Kind kind;
    private final TypeDefinition owner;
    private TypeDefinition type;                // 属性类型 / 方法返回类型 / 枚举类型
    private final FunctionSignature signature;  // 仅方法与构造器
    private final boolean constant;
    private final boolean hasBody;
    private final boolean isStatic;
    private final boolean isOverride;

    private Member(String name, Kind kind, TypeDefinition owner, TypeDefinition type,
                   FunctionSignature signature, boolean constant, boolean hasBody,
                   boolean isStatic, boolean isOverride) {
        this.name = name;
        this.kind = kind;
        this.owner = owner;
        this.type = type;
        this.signature = signature;
        this.constant = constant;
        this.hasBody = hasBody;
        this.isStatic = isStatic;
        this.isOverride = isOverride;
    }

    /** 属性，类型未标注时为 null，由类型检查根据初始化表达式补上 */
    public static Member property(String name, TypeDefinition owner, TypeDefinition type,
                                  boolean constant, boolean isStatic) {
        return new Member(name, Kind.PROPERTY, owner, type, null, constant, true, isStatic, false);
    }

    public static Member method(String name, TypeDefinition owner, FunctionSignature signature,
                                boolean hasBody, boolean isStatic, boolean isOverride) {
        return new Member(name, Kind.METHOD, owner, signature.getReturnType(), signature,
                false, hasBody, isStatic, isOverride);
    }

    public static Member constructor(TypeDefinition owner, FunctionSignature signature) {
        return new Member("init", Kind.CONSTRUCTOR, owner, owner, signature, false, true, false, false);
    }

    public static Member enumCase(String name, TypeDefinition owner) {
        return new Member(name, Kind.ENUM_CASE, owner, owner, null, true, true, true, false);
    }

    public String getName() { return name; }
    public Kind getKind() { return kind; }
    public TypeDefinition getOwner() { return owner; }
    public TypeDefinition getType() { return type; }
    public FunctionSignature getSignature() { return signature; }
    public boolean isConstant() { return constant; }
    public boolean hasBody() { return hasBody; }
    public boolean isStatic() { return isStatic; }
    public boolean isOverride() { return isOverride; }

    public boolean isMethod() { return kind == Kind.METHOD; }
    public boolean isProperty() { return kind == Kind.PROPERTY; }

    /** 没有函数体的方法（接口要求或抽象方法） */
    public boolean isAbstract() {
        return kind == Kind.METHOD && !hasBody;
    }

    /**
     * 为未标注类型的属性补上推断类型，只允许一次
     */
    public void attachType(TypeDefinition inferred) {
        if (type != null && !type.sameAs(inferred)) {
            throw new IllegalStateException("Type of member '" + name + "' is already " + type.getName());
        }
        this.type = inferred;
    }

    Member substitute(Map<String, TypeDefinition> bindings) {
        if (bindings.isEmpty() || kind == Kind.ENUM_CASE) {
            return this;
        }
        return new Member(name, kind, owner, type != null ? type.substitute(bindings) : null,
                signature != null ? signature.substitute(bindings) : null,
                constant, hasBody, isStatic, isOverride);
    }

    @Override
    public String toString() {
        return kind == Kind.PROPERTY || kind == Kind.ENUM_CASE
                ? name + ": " + (type != null ? type.getName() : "?")
                : name + (signature != null ? signature.toString() : "");
    }
}
