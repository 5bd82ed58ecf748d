package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.decl.Declaration;

import java.util.List;

/**
 * AST 到 AST 的优化器。
 *
 * <p>实现必须保持结构（只改写可证明等价的部分）、不修改输入树，并且幂等：
 * 对输出再运行一次得到相同的结果。</p>
 */
public interface Optimizer {

    List<Declaration> optimize(List<Declaration> declarations);
}
