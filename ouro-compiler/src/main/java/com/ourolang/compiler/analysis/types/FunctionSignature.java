package com.ourolang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 函数签名：参数列表 + 返回类型
 */
public final class FunctionSignature {

    /**
     * 签名中的单个参数
     */
    public static final class Param {
        private final String name;
        private final TypeDefinition type;
        private final boolean hasDefault;

        public Param(String name, TypeDefinition type, boolean hasDefault) {
            this.name = name;
            this.type = type;
            this.hasDefault = hasDefault;
        }

        public String getName() { return name; }
        public TypeDefinition getType() { return type; }
        public boolean hasDefault() { return hasDefault; }
    }

    private final List<Param> params;
    private final TypeDefinition returnType;

    public FunctionSignature(List<Param> params, TypeDefinition returnType) {
        this.params = Collections.unmodifiableList(new ArrayList<Param>(params));
        this.returnType = returnType != null ? returnType : PrimitiveTypes.VOID;
    }

    public List<Param> getParams() {
        return params;
    }

    public TypeDefinition getReturnType() {
        return returnType;
    }

    /** 调用时必须提供的参数个数（默认值之前的参数） */
    public int getRequiredCount() {
        int count = 0;
        for (Param p : params) {
            if (!p.hasDefault()) count++;
        }
        return count;
    }

    public boolean accepts(int argumentCount) {
        return argumentCount >= getRequiredCount() && argumentCount <= params.size();
    }

    FunctionSignature substitute(Map<String, TypeDefinition> bindings) {
        List<Param> replaced = new ArrayList<Param>(params.size());
        for (Param p : params) {
            replaced.add(new Param(p.name, p.type.substitute(bindings), p.hasDefault));
        }
        return new FunctionSignature(replaced, returnType.substitute(bindings));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i).getName()).append(": ").append(params.get(i).getType().getName());
        }
        return sb.append(") -> ").append(returnType.getName()).toString();
    }
}
