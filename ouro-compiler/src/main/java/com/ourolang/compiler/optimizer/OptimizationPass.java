package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.decl.Declaration;

import java.util.List;

/**
 * AST 优化 pass 接口。
 */
public interface OptimizationPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对声明列表执行优化，无变化时返回原列表。
     */
    List<Declaration> run(List<Declaration> declarations);
}
