package com.ourolang.compiler.analysis;

import com.ourolang.compiler.ast.decl.Declaration;

import java.util.Collections;
import java.util.List;

/**
 * 语义分析结果
 */
public final class AnalysisResult {
    private final List<Declaration> declarations;
    private final SymbolTable symbolTable;
    private final List<SymbolError> errors;

    public AnalysisResult(List<Declaration> declarations, SymbolTable symbolTable, List<SymbolError> errors) {
        this.declarations = declarations;
        this.symbolTable = symbolTable;
        this.errors = Collections.unmodifiableList(errors);
    }

    /** 输入的声明列表本身（未被改写） */
    public List<Declaration> getDeclarations() { return declarations; }
    public SymbolTable getSymbolTable() { return symbolTable; }
    public List<SymbolError> getErrors() { return errors; }

    public boolean hasErrors() { return !errors.isEmpty(); }
}
