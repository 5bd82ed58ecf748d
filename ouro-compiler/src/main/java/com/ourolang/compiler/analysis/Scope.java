package com.ourolang.compiler.analysis;

import com.ourolang.compiler.analysis.types.TypeDefinition;
import com.ourolang.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 顶层
        TYPE,       // class / struct / enum / interface body
        FUNCTION,   // function body（含参数、泛型参数）
        BLOCK       // 嵌套块、for 循环
    }

    private final int id;
    private final ScopeType type;
    private final Scope parent;
    private final AstNode node;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();
    private final List<Scope> children = new ArrayList<Scope>();

    // 所属类型（TYPE 作用域中为该类型，用于 this / 继承成员查找）
    private TypeDefinition ownerType;

    Scope(int id, ScopeType type, Scope parent, AstNode node) {
        this.id = id;
        this.type = type;
        this.parent = parent;
        this.node = node;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public int getId() { return id; }
    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public AstNode getNode() { return node; }
    public Map<String, Symbol> getSymbols() { return Collections.unmodifiableMap(symbols); }
    public List<Scope> getChildren() { return Collections.unmodifiableList(children); }

    public TypeDefinition getOwnerType() { return ownerType; }
    void setOwnerType(TypeDefinition ownerType) { this.ownerType = ownerType; }

    /**
     * 注册符号到当前作用域，同名符号已存在时抛出 {@link SymbolException}
     */
    public void define(Symbol symbol) {
        if (symbols.containsKey(symbol.getName())) {
            throw new SymbolException(SymbolError.duplicateDefinition(symbol.getName(), symbol.getDeclaredAt()));
        }
        symbol.setScopeId(id);
        symbols.put(symbol.getName(), symbol);
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Symbol found = s.symbols.get(name);
            if (found != null) return found;
        }
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 最近的类型作用域所属类型（用于 this 推断），不在类型内返回 null */
    public TypeDefinition findOwnerType() {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.ownerType != null) return s.ownerType;
        }
        return null;
    }

    /** 获取当前作用域可见的所有符号（含父级，内层覆盖外层） */
    public List<Symbol> getAllVisible() {
        Map<String, Symbol> all = new LinkedHashMap<String, Symbol>();
        collectVisible(all);
        return new ArrayList<Symbol>(all.values());
    }

    private void collectVisible(Map<String, Symbol> result) {
        if (parent != null) parent.collectVisible(result);
        result.putAll(symbols);
    }

    @Override
    public String toString() {
        return type + "#" + id;
    }
}
