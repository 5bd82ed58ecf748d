package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.Member;
import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.decl.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 声明级校验：继承关系、一致性、方法体与变量声明规则。
 *
 * <p>在类型头与成员签名解析完成后运行，只报告错误，唯一的修改是断开循环继承的边，
 * 使后续成员查找不会陷入循环。</p>
 */
final class DeclarationValidator {

    private final SymbolTable symbolTable;
    private final List<SymbolError> errors;

    DeclarationValidator(SymbolTable symbolTable, List<SymbolError> errors) {
        this.symbolTable = symbolTable;
        this.errors = errors;
    }

    void validate(List<Declaration> declarations) {
        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                breakCycles((TypeDecl) decl);
            }
        }
        for (Declaration decl : declarations) {
            if (decl instanceof TypeDecl) {
                TypeDecl td = (TypeDecl) decl;
                TypeDefinition def = symbolTable.getTypeDefinition(td);
                checkRestrictedSupertypes(td, def);
                checkMethods(td, def);
                checkConformance(td, def);
                for (VarDecl property : td.getProperties()) {
                    checkVariable(property, errors);
                }
            } else if (decl instanceof FunctionDecl) {
                FunctionDecl fd = (FunctionDecl) decl;
                if (!fd.hasBody()) {
                    errors.add(SymbolError.invalidOperation("Function '" + fd.getName() + "' must have a body",
                            fd.getNameLocation()));
                }
            } else if (decl instanceof VarDecl) {
                checkVariable((VarDecl) decl, errors);
            }
        }
    }

    /**
     * 变量必须有类型标注或初始化表达式，常量必须有初始化表达式
     */
    static void checkVariable(VarDecl var, List<SymbolError> errors) {
        if (var.isConstant() && !var.hasInitializer()) {
            errors.add(SymbolError.invalidOperation("Constant '" + var.getName() + "' must be initialized",
                    var.getNameLocation()));
        } else if (var.getTypeAnnotation() == null && !var.hasInitializer()) {
            errors.add(SymbolError.invalidOperation("Variable '" + var.getName()
                    + "' needs a type annotation or an initializer", var.getNameLocation()));
        }
    }

    // ============ 继承 ============

    private void breakCycles(TypeDecl td) {
        TypeDefinition def = symbolTable.getTypeDefinition(td);
        TypeDefinition sup = def.getSuperclass();
        if (sup != null && reaches(sup, def)) {
            errors.add(SymbolError.circularInheritance(td.getName(), td.getNameLocation()));
            def.setSuperclass(null);
        }
        for (TypeDefinition iface : new ArrayList<TypeDefinition>(def.getInterfaces())) {
            if (reaches(iface, def)) {
                errors.add(SymbolError.circularInheritance(td.getName(), td.getNameLocation()));
                def.removeInterface(iface);
            }
        }
    }

    private static boolean reaches(TypeDefinition from, TypeDefinition target) {
        Set<TypeDefinition> visited = Collections.newSetFromMap(new IdentityHashMap<TypeDefinition, Boolean>());
        List<TypeDefinition> work = new ArrayList<TypeDefinition>();
        work.add(from);
        while (!work.isEmpty()) {
            TypeDefinition t = work.remove(work.size() - 1);
            TypeDefinition base = t.getGenericBase() != null ? t.getGenericBase() : t;
            if (base == target) return true;
            if (!visited.add(base)) continue;
            if (base.getSuperclass() != null) work.add(base.getSuperclass());
            work.addAll(base.getInterfaces());
        }
        return false;
    }

    private void checkRestrictedSupertypes(TypeDecl td, TypeDefinition def) {
        TypeDefinition sup = def.getSuperclass();
        if (sup != null) {
            if (sup.isFinal()) {
                errors.add(SymbolError.invalidInheritance("Cannot inherit from final class '"
                        + sup.getName() + "'", td.getNameLocation()));
            } else if (sup.isSealed() && !sup.permits(td.getName())) {
                errors.add(SymbolError.invalidInheritance("Sealed class '" + sup.getName()
                        + "' does not permit '" + td.getName() + "'", td.getNameLocation()));
            }
        }
        for (TypeDefinition iface : def.getInterfaces()) {
            if (iface.isSealed() && !iface.permits(td.getName())) {
                errors.add(SymbolError.invalidInheritance("Sealed interface '" + iface.getName()
                        + "' does not permit '" + td.getName() + "'", td.getNameLocation()));
            }
        }
    }

    // ============ 方法 ============

    private void checkMethods(TypeDecl td, TypeDefinition def) {
        boolean bodyOptional = td instanceof InterfaceDecl || def.isAbstract();
        for (FunctionDecl method : td.getMethods()) {
            if (method.isConstructor()) continue;

            if (!method.hasBody() && !bodyOptional) {
                errors.add(SymbolError.invalidOperation("Method '" + method.getName()
                        + "' must have a body in non-abstract type '" + td.getName() + "'",
                        method.getNameLocation()));
            }
            if (method.hasModifier(Modifier.ABSTRACT)) {
                if (method.hasBody()) {
                    errors.add(SymbolError.invalidOperation("Abstract method '" + method.getName()
                            + "' cannot have a body", method.getNameLocation()));
                } else if (!def.isAbstract()) {
                    errors.add(SymbolError.invalidOperation("Abstract method '" + method.getName()
                            + "' in non-abstract type '" + td.getName() + "'", method.getNameLocation()));
                }
            }
            if (method.hasModifier(Modifier.OVERRIDE) && !overridesSomething(def, method.getName())) {
                errors.add(SymbolError.invalidOverride(method.getName(), method.getNameLocation()));
            }
        }
    }

    private static boolean overridesSomething(TypeDefinition def, String name) {
        if (def.getSuperclass() != null && isMethod(def.getSuperclass().findMember(name))) {
            return true;
        }
        for (TypeDefinition iface : def.getInterfaces()) {
            if (isMethod(iface.findMember(name))) return true;
        }
        return false;
    }

    private static boolean isMethod(Member member) {
        return member != null && member.isMethod();
    }

    // ============ 一致性 ============

    private void checkConformance(TypeDecl td, TypeDefinition def) {
        if (def.isInterface() || def.isAbstract()) {
            return;
        }
        // 方法名 → 提出要求的类型（保持首次出现的顺序）
        Map<String, TypeDefinition> required = new LinkedHashMap<String, TypeDefinition>();
        Set<TypeDefinition> visited = Collections.newSetFromMap(new IdentityHashMap<TypeDefinition, Boolean>());
        for (TypeDefinition t = def.getSuperclass(); t != null; t = t.getSuperclass()) {
            if (!visited.add(t)) break;
            for (Member m : t.getMembers().values()) {
                if (m.isAbstract() && !required.containsKey(m.getName())) {
                    required.put(m.getName(), t);
                }
            }
        }
        for (TypeDefinition iface : reachableInterfaces(def)) {
            for (Member m : iface.getMembers().values()) {
                if (m.isAbstract() && !required.containsKey(m.getName())) {
                    required.put(m.getName(), iface);
                }
            }
        }

        for (Map.Entry<String, TypeDefinition> entry : required.entrySet()) {
            if (!isImplemented(def, entry.getKey())) {
                errors.add(SymbolError.conformanceGap(td.getName(), entry.getKey(),
                        entry.getValue().getName(), td.getNameLocation()));
            }
        }
    }

    /**
     * 类链上有带函数体的同名方法，或任一可达接口提供了默认实现
     */
    private static boolean isImplemented(TypeDefinition def, String name) {
        Set<TypeDefinition> visited = Collections.newSetFromMap(new IdentityHashMap<TypeDefinition, Boolean>());
        for (TypeDefinition t = def; t != null; t = t.getSuperclass()) {
            if (!visited.add(t)) break;
            Member m = t.getDeclaredMember(name);
            if (m != null && m.isMethod() && m.hasBody()) return true;
        }
        for (TypeDefinition iface : reachableInterfaces(def)) {
            Member m = iface.getDeclaredMember(name);
            if (m != null && m.isMethod() && m.hasBody()) return true;
        }
        return false;
    }

    /** 自身与父类链直接或间接实现的全部接口 */
    private static List<TypeDefinition> reachableInterfaces(TypeDefinition def) {
        Set<TypeDefinition> seen = Collections.newSetFromMap(new IdentityHashMap<TypeDefinition, Boolean>());
        List<TypeDefinition> result = new ArrayList<TypeDefinition>();
        List<TypeDefinition> work = new ArrayList<TypeDefinition>();
        for (TypeDefinition t = def; t != null && seen.add(t); t = t.getSuperclass()) {
            work.addAll(t.getInterfaces());
        }
        while (!work.isEmpty()) {
            TypeDefinition iface = work.remove(0);
            if (!seen.add(iface)) continue;
            result.add(iface);
            work.addAll(iface.getInterfaces());
        }
        return result;
    }
}
