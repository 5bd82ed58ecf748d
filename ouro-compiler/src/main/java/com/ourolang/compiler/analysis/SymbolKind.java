package com.ourolang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,   // var 变量、函数参数、可变属性
    CONSTANT,   // const 变量与常量属性
    FUNCTION,   // func 声明与方法
    TYPE        // 原始类型、class / struct / enum / interface、泛型参数
}
