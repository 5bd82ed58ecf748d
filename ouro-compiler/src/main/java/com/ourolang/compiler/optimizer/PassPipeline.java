package com.ourolang.compiler.optimizer;

import com.ourolang.compiler.ast.decl.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 优化 Pass 管线：按登记顺序依次运行各 pass。
 */
public class PassPipeline implements Optimizer {

    private final List<OptimizationPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线：常量折叠 → 死代码消除。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new ConstantFolding());
        // 依赖常量折叠先把条件化简为字面量
        pipeline.addPass(new DeadCodeElimination());
        return pipeline;
    }

    public void addPass(OptimizationPass pass) {
        passes.add(pass);
    }

    public List<OptimizationPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    @Override
    public List<Declaration> optimize(List<Declaration> declarations) {
        List<Declaration> result = declarations;
        for (OptimizationPass pass : passes) {
            result = pass.run(result);
        }
        return result;
    }
}
