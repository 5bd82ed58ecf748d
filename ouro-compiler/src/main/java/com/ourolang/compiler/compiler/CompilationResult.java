package com.ourolang.compiler.compiler;

import com.ourolang.compiler.analysis.SymbolTable;
import com.ourolang.compiler.ast.decl.Declaration;

import java.util.Collections;
import java.util.List;

/**
 * 单个编译单元的结果
 *
 * <p>词法或语法错误时 declarations 为空、symbolTable 为 null（容错解析除外）。</p>
 */
public final class CompilationResult {
    private final String fileName;
    private final List<Declaration> declarations;
    private final List<Diagnostic> diagnostics;
    private final SymbolTable symbolTable;

    public CompilationResult(String fileName, List<Declaration> declarations,
                             List<Diagnostic> diagnostics, SymbolTable symbolTable) {
        this.fileName = fileName;
        this.declarations = Collections.unmodifiableList(declarations);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.symbolTable = symbolTable;
    }

    public String getFileName() { return fileName; }
    public List<Declaration> getDeclarations() { return declarations; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public SymbolTable getSymbolTable() { return symbolTable; }

    public boolean hasErrors() {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return fileName + ": " + declarations.size() + " declaration(s), "
                + diagnostics.size() + " diagnostic(s)";
    }
}
