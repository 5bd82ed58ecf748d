package com.ourolang.compiler.analysis;

/**
 * 符号表操作失败（同一作用域重复定义）
 */
public class SymbolException extends RuntimeException {
    private final SymbolError error;

    public SymbolException(SymbolError error) {
        super(error.getMessage());
        this.error = error;
    }

    public SymbolError getError() {
        return error;
    }
}
