package com.ourolang.compiler.compiler;

import java.util.concurrent.CompletableFuture;

/**
 * 已提交的编译单元
 *
 * <p>{@link #cancel()} 之后 future 以 {@link java.util.concurrent.CancellationException}
 * 完成，不会得到部分结果。</p>
 */
public final class CompilationTask {
    private final String fileName;
    private final CompletableFuture<CompilationResult> future;
    private final CancellationToken token;

    CompilationTask(String fileName, CompletableFuture<CompilationResult> future, CancellationToken token) {
        this.fileName = fileName;
        this.future = future;
        this.token = token;
    }

    public String getFileName() {
        return fileName;
    }

    public CompletableFuture<CompilationResult> getFuture() {
        return future;
    }

    /**
     * 取消编译；已完成的任务不受影响
     *
     * @return 本次调用是否使任务进入取消状态
     */
    public boolean cancel() {
        if (future.isDone()) {
            return false;
        }
        if (token != CancellationToken.NONE) {
            token.cancel();
        }
        return future.cancel(false);
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * 等待并返回结果
     */
    public CompilationResult join() {
        return future.join();
    }
}
