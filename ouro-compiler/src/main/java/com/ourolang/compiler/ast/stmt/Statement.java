package com.ourolang.compiler.ast.stmt;

import com.ourolang.compiler.ast.AstNode;
import com.ourolang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
