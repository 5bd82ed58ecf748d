package com.ourolang.compiler.parser;

import com.ourolang.compiler.ast.decl.Declaration;

import java.util.Collections;
import java.util.List;

/**
 * 容错解析结果：成功解析的声明 + 收集到的语法错误
 */
public final class ParseResult {
    private final List<Declaration> declarations;
    private final List<ParseError> errors;

    public ParseResult(List<Declaration> declarations, List<ParseError> errors) {
        this.declarations = Collections.unmodifiableList(declarations);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
