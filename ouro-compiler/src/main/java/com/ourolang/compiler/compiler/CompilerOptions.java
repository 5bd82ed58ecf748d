package com.ourolang.compiler.compiler;

import com.ourolang.compiler.parser.Parser;

/**
 * 编译选项
 */
public class CompilerOptions {
    private String fileName = "<input>";
    private int maxNestingDepth = Parser.DEFAULT_MAX_NESTING_DEPTH;
    private boolean tolerantParsing = false;
    private boolean optimize = true;
    private long cacheMaximumSize = 256;
    private int parallelism = Runtime.getRuntime().availableProcessors();

    public CompilerOptions() {
    }

    /**
     * 复制一份选项（流水线为每个编译单元单独设置文件名）
     */
    public CompilerOptions copy() {
        CompilerOptions copy = new CompilerOptions();
        copy.fileName = fileName;
        copy.maxNestingDepth = maxNestingDepth;
        copy.tolerantParsing = tolerantParsing;
        copy.optimize = optimize;
        copy.cacheMaximumSize = cacheMaximumSize;
        copy.parallelism = parallelism;
        return copy;
    }

    public String getFileName() {
        return fileName;
    }

    public CompilerOptions setFileName(String fileName) {
        this.fileName = fileName;
        return this;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public CompilerOptions setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
        return this;
    }

    public boolean isTolerantParsing() {
        return tolerantParsing;
    }

    public CompilerOptions setTolerantParsing(boolean tolerantParsing) {
        this.tolerantParsing = tolerantParsing;
        return this;
    }

    public boolean isOptimize() {
        return optimize;
    }

    public CompilerOptions setOptimize(boolean optimize) {
        this.optimize = optimize;
        return this;
    }

    public long getCacheMaximumSize() {
        return cacheMaximumSize;
    }

    public CompilerOptions setCacheMaximumSize(long cacheMaximumSize) {
        if (cacheMaximumSize <= 0) {
            throw new IllegalArgumentException("cacheMaximumSize must be positive: " + cacheMaximumSize);
        }
        this.cacheMaximumSize = cacheMaximumSize;
        return this;
    }

    public int getParallelism() {
        return parallelism;
    }

    public CompilerOptions setParallelism(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
        return this;
    }
}
