package com.ourolang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型定义
 *
 * <p>原始类型是 {@link PrimitiveTypes} 中的单例；用户类型在语义分析时每个声明只创建一次，
 * 之后所有引用都指向同一实例。泛型实例化（{@code Box<Int>}、{@code [Int]}）通过
 * {@link #instantiate(List)} 创建，成员查找时替换类型参数。</p>
 */
public final class TypeDefinition {

    public enum Category {
        PRIMITIVE,
        CLASS,
        STRUCT,
        ENUM,
        INTERFACE,
        ARRAY,
        TYPE_PARAMETER,
        NULL,
        ERROR
    }

    /** 数值类别，非数值类型为 NONE */
    public enum NumericKind {
        NONE,
        SIGNED,
        UNSIGNED,
        FLOATING,
        DECIMAL
    }

    private final String name;
    private final Category category;
    private final String mlirType;
    private final NumericKind numericKind;
    private final int bitWidth;

    // 修饰符
    private boolean isAbstract;
    private boolean isSealed;
    private boolean isFinal;

    // 继承关系（用户类型，语义分析第二遍填充）
    private TypeDefinition superclass;
    private final List<TypeDefinition> interfaces = new ArrayList<TypeDefinition>();
    private final List<String> permittedSubclasses = new ArrayList<String>();
    private final Map<String, Member> members = new LinkedHashMap<String, Member>();

    // 泛型
    private final List<TypeDefinition> typeParameters = new ArrayList<TypeDefinition>();
    private final TypeDefinition genericBase;
    private final List<TypeDefinition> typeArguments;

    // 枚举原始值类型
    private TypeDefinition rawType;

    TypeDefinition(String name, Category category, String mlirType, NumericKind numericKind, int bitWidth) {
        this(name, category, mlirType, numericKind, bitWidth, null, Collections.<TypeDefinition>emptyList());
    }

    private TypeDefinition(String name, Category category, String mlirType, NumericKind numericKind,
                           int bitWidth, TypeDefinition genericBase, List<TypeDefinition> typeArguments) {
        this.name = name;
        this.category = category;
        this.mlirType = mlirType;
        this.numericKind = numericKind;
        this.bitWidth = bitWidth;
        this.genericBase = genericBase;
        this.typeArguments = typeArguments;
    }

    // ============ 工厂 ============

    /**
     * 创建用户声明的类型（class / struct / enum / interface）
     */
    public static TypeDefinition declared(String name, Category category) {
        switch (category) {
            case CLASS:
            case STRUCT:
            case ENUM:
            case INTERFACE:
                return new TypeDefinition(name, category, "!ouro." + name, NumericKind.NONE, 0);
            default:
                throw new IllegalArgumentException("Not a declarable category: " + category);
        }
    }

    /**
     * 创建泛型类型参数 T
     */
    public static TypeDefinition typeParameter(String name) {
        return new TypeDefinition(name, Category.TYPE_PARAMETER, "!ouro.param." + name, NumericKind.NONE, 0);
    }

    /**
     * 创建数组类型 [element]
     */
    public static TypeDefinition arrayOf(TypeDefinition element) {
        return PrimitiveTypes.ARRAY.instantiate(Collections.singletonList(element));
    }

    /**
     * 用具体类型实参实例化泛型类型；实参个数由调用方校验
     */
    public TypeDefinition instantiate(List<TypeDefinition> arguments) {
        TypeDefinition base = genericBase != null ? genericBase : this;
        StringBuilder sb = new StringBuilder(base.name).append('<');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i).getName());
        }
        sb.append('>');
        String mlir = base.category == Category.ARRAY
                ? "memref<?x" + arguments.get(0).getMlirType() + ">"
                : base.mlirType;
        return new TypeDefinition(sb.toString(), base.category, mlir, NumericKind.NONE, 0,
                base, Collections.unmodifiableList(new ArrayList<TypeDefinition>(arguments)));
    }

    // ============ 基本属性 ============

    public String getName() { return name; }
    public Category getCategory() { return category; }
    public String getMlirType() { return mlirType; }
    public NumericKind getNumericKind() { return numericKind; }
    public int getBitWidth() { return bitWidth; }

    public boolean isPrimitive() { return category == Category.PRIMITIVE; }
    public boolean isInterface() { return category == Category.INTERFACE; }
    public boolean isClass() { return category == Category.CLASS; }
    public boolean isStruct() { return category == Category.STRUCT; }
    public boolean isEnum() { return category == Category.ENUM; }
    public boolean isArray() { return category == Category.ARRAY; }
    public boolean isTypeParameter() { return category == Category.TYPE_PARAMETER; }
    public boolean isNullType() { return category == Category.NULL; }
    public boolean isError() { return category == Category.ERROR; }

    /** 值类型（原始类型、结构体、枚举）不接受 null */
    public boolean isValueType() {
        return (isPrimitive() && this != PrimitiveTypes.ANY && this != PrimitiveTypes.STRING)
                || isStruct() || isEnum();
    }

    public boolean isNumeric() { return numericKind != NumericKind.NONE; }

    public boolean isIntegral() {
        return numericKind == NumericKind.SIGNED || numericKind == NumericKind.UNSIGNED;
    }

    public boolean isFloating() { return numericKind == NumericKind.FLOATING; }

    public boolean isAbstract() { return genericBase != null ? genericBase.isAbstract : isAbstract; }
    public void setAbstract(boolean value) { this.isAbstract = value; }

    public boolean isSealed() { return genericBase != null ? genericBase.isSealed : isSealed; }
    public void setSealed(boolean value) { this.isSealed = value; }

    public boolean isFinal() { return genericBase != null ? genericBase.isFinal : isFinal; }
    public void setFinal(boolean value) { this.isFinal = value; }

    // ============ 继承 ============

    public TypeDefinition getSuperclass() { return genericBase != null ? genericBase.superclass : superclass; }
    public void setSuperclass(TypeDefinition superclass) { this.superclass = superclass; }

    public List<TypeDefinition> getInterfaces() { return genericBase != null ? genericBase.interfaces : interfaces; }

    public void addInterface(TypeDefinition iface) {
        if (!interfaces.contains(iface)) {
            interfaces.add(iface);
        }
    }

    public void removeInterface(TypeDefinition iface) {
        interfaces.remove(iface);
    }

    /** 直接实现 / 扩展的接口名 */
    public List<String> getInterfaceNames() {
        List<String> names = new ArrayList<String>(interfaces.size());
        for (TypeDefinition iface : getInterfaces()) {
            names.add(iface.getName());
        }
        return names;
    }

    public List<String> getPermittedSubclasses() {
        return genericBase != null ? genericBase.permittedSubclasses : permittedSubclasses;
    }

    /** sealed 类型是否允许 name 继承；未写 permits 的 sealed 类型不能被继承 */
    public boolean permits(String subclassName) {
        return getPermittedSubclasses().contains(subclassName);
    }

    /**
     * 是否为 other 的子类型（自身、父类链、接口，均传递）
     */
    public boolean isSubtypeOf(TypeDefinition other) {
        return isSubtypeOf(other, Collections.newSetFromMap(new IdentityHashMap<TypeDefinition, Boolean>()));
    }

    private boolean isSubtypeOf(TypeDefinition other, java.util.Set<TypeDefinition> visited) {
        if (sameAs(other)) return true;
        if (!visited.add(this)) return false;
        TypeDefinition self = genericBase != null ? genericBase : this;
        if (self != this && self.isSubtypeOf(other, visited)) return true;
        if (superclass != null && superclass.isSubtypeOf(other, visited)) return true;
        for (TypeDefinition iface : interfaces) {
            if (iface.isSubtypeOf(other, visited)) return true;
        }
        return false;
    }

    /**
     * 结构相等：同一实例，或同一泛型基类型且实参逐一相同
     */
    public boolean sameAs(TypeDefinition other) {
        if (this == other) return true;
        if (other == null || genericBase == null || other.genericBase == null) return false;
        if (genericBase != other.genericBase || typeArguments.size() != other.typeArguments.size()) return false;
        for (int i = 0; i < typeArguments.size(); i++) {
            if (!typeArguments.get(i).sameAs(other.typeArguments.get(i))) return false;
        }
        return true;
    }

    // ============ 成员 ============

    public Map<String, Member> getMembers() {
        return genericBase != null ? genericBase.members : members;
    }

    /**
     * 登记成员；同名成员已存在时返回 false
     */
    public boolean addMember(Member member) {
        if (members.containsKey(member.getName())) {
            return false;
        }
        members.put(member.getName(), member);
        return true;
    }

    /** 仅在本类型中声明的成员 */
    public Member getDeclaredMember(String memberName) {
        return getMembers().get(memberName);
    }

    /**
     * 查找成员：自身 → 父类链 → 接口（用于默认方法），泛型实例会替换类型参数
     */
    public Member findMember(String memberName) {
        Member found = findMember(memberName,
                Collections.newSetFromMap(new IdentityHashMap<TypeDefinition, Boolean>()));
        if (found == null || genericBase == null || typeArguments.isEmpty()) {
            return found;
        }
        return found.substitute(getTypeArgumentBindings());
    }

    private Member findMember(String memberName, java.util.Set<TypeDefinition> visited) {
        TypeDefinition self = genericBase != null ? genericBase : this;
        if (!visited.add(self)) return null;
        Member member = self.members.get(memberName);
        if (member != null) return member;
        if (self.superclass != null) {
            member = self.superclass.findMember(memberName, visited);
            if (member != null) return member;
        }
        for (TypeDefinition iface : self.interfaces) {
            member = iface.findMember(memberName, visited);
            if (member != null) return member;
        }
        return null;
    }

    // ============ 泛型 ============

    public List<TypeDefinition> getTypeParameters() {
        return genericBase != null ? genericBase.typeParameters : typeParameters;
    }

    public void addTypeParameter(TypeDefinition param) {
        typeParameters.add(param);
    }

    public boolean isGeneric() {
        return !getTypeParameters().isEmpty() || category == Category.ARRAY;
    }

    public TypeDefinition getGenericBase() { return genericBase; }
    public List<TypeDefinition> getTypeArguments() { return typeArguments; }

    /** 数组元素类型；非数组返回 null */
    public TypeDefinition getElementType() {
        return isArray() && !typeArguments.isEmpty() ? typeArguments.get(0) : null;
    }

    /** 类型参数名 → 实参 */
    public Map<String, TypeDefinition> getTypeArgumentBindings() {
        Map<String, TypeDefinition> bindings = new HashMap<String, TypeDefinition>();
        List<TypeDefinition> params = getTypeParameters();
        for (int i = 0; i < params.size() && i < typeArguments.size(); i++) {
            bindings.put(params.get(i).getName(), typeArguments.get(i));
        }
        return bindings;
    }

    /**
     * 按绑定替换类型参数，可递归进入数组与泛型实参
     */
    public TypeDefinition substitute(Map<String, TypeDefinition> bindings) {
        if (bindings.isEmpty()) return this;
        if (isTypeParameter()) {
            TypeDefinition bound = bindings.get(name);
            return bound != null ? bound : this;
        }
        if (genericBase == null || typeArguments.isEmpty()) return this;
        List<TypeDefinition> args = new ArrayList<TypeDefinition>(typeArguments.size());
        boolean changed = false;
        for (TypeDefinition arg : typeArguments) {
            TypeDefinition replaced = arg.substitute(bindings);
            changed |= replaced != arg;
            args.add(replaced);
        }
        return changed ? genericBase.instantiate(args) : this;
    }

    // ============ 枚举 ============

    public TypeDefinition getRawType() { return genericBase != null ? genericBase.rawType : rawType; }
    public void setRawType(TypeDefinition rawType) { this.rawType = rawType; }

    @Override
    public String toString() {
        return name;
    }
}
