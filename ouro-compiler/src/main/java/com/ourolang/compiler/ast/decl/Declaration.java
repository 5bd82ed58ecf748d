package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 声明基类
 */
public abstract class Declaration extends AstNode {
    protected final List<Modifier> modifiers;
    protected final String name;
    /** 名称标识符的精确位置，null 表示未设置 */
    private SourceLocation nameLocation;

    protected Declaration(SourceLocation location, List<Modifier> modifiers, String name) {
        super(location);
        this.modifiers = modifiers;
        this.name = name;
    }

    public SourceLocation getNameLocation() {
        return nameLocation != null ? nameLocation : location;
    }

    public void setNameLocation(SourceLocation loc) {
        this.nameLocation = loc;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public String getName() {
        return name;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }
}
