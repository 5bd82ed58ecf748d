package com.ourolang.compiler.ast;

/**
 * 修饰符枚举
 */
public enum Modifier {
    // 可见性
    PUBLIC,
    PRIVATE,
    PROTECTED,
    INTERNAL,
    FILEPRIVATE,

    // 继承
    ABSTRACT,
    SEALED,
    FINAL,
    OVERRIDE,

    // 其他
    STATIC,
    LAZY,
    ASYNC;

    /** 是否为可见性修饰符 */
    public boolean isVisibility() {
        switch (this) {
            case PUBLIC:
            case PRIVATE:
            case PROTECTED:
            case INTERNAL:
            case FILEPRIVATE:
                return true;
            default:
                return false;
        }
    }

    /** 返回源码中对应的关键字 */
    public String toSourceString() {
        return name().toLowerCase();
    }
}
