package com.ourolang.compiler.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 多编译单元的异步编译流水线
 *
 * <p>每个单元在固定大小的工作线程池上独立编译（各自的 Lexer / Parser /
 * SymbolTable），结果按 (文件名, 源码) 缓存。相同输入再次提交时直接返回缓存结果。</p>
 */
public class CompilationPipeline {
    private static final Logger LOG = Logger.getLogger(CompilationPipeline.class.getName());

    private final OuroCompiler compiler;
    private final CompilerOptions options;
    private final CompilationCache cache;
    private final ExecutorService executor;

    public CompilationPipeline() {
        this(new CompilerOptions());
    }

    public CompilationPipeline(CompilerOptions options) {
        this(options, new OuroCompiler());
    }

    public CompilationPipeline(CompilerOptions options, OuroCompiler compiler) {
        this.options = options.copy();
        this.compiler = compiler;
        this.cache = new CompilationCache(options.getCacheMaximumSize());
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(options.getParallelism(), r -> {
            Thread t = new Thread(r, "ouro-compiler-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 提交一个编译单元
     *
     * @throws RejectedExecutionException 流水线已关闭
     */
    public CompilationTask submit(String fileName, String source) {
        String key = CompilationCache.computeKey(fileName, source);
        CompilationResult cached = cache.get(key);
        if (cached != null) {
            LOG.fine("Cache hit: " + fileName);
            return new CompilationTask(fileName, CompletableFuture.completedFuture(cached), CancellationToken.NONE);
        }

        LOG.fine("Submitting: " + fileName);
        CancellationToken token = new CancellationToken();
        CompletableFuture<CompilationResult> future = new CompletableFuture<>();
        CompilerOptions unitOptions = options.copy().setFileName(fileName);
        executor.execute(() -> {
            if (future.isDone()) {
                return;
            }
            try {
                CompilationResult result = compiler.compile(source, unitOptions, token);
                cache.put(key, result);
                future.complete(result);
            } catch (CancellationException e) {
                future.completeExceptionally(e);
            } catch (RuntimeException | Error e) {
                // 包括 StackOverflowError 等，必须完成 future，否则 join() 永远等待
                LOG.log(Level.WARNING, "Compilation task failed: " + fileName, e);
                future.completeExceptionally(e);
            }
        });
        return new CompilationTask(fileName, future, token);
    }

    /**
     * 编译一组单元并等待全部完成，结果按输入顺序返回
     */
    public Map<String, CompilationResult> compileAll(Map<String, String> sources) {
        List<CompilationTask> tasks = new ArrayList<>(sources.size());
        for (Map.Entry<String, String> entry : sources.entrySet()) {
            tasks.add(submit(entry.getKey(), entry.getValue()));
        }
        Map<String, CompilationResult> results = new LinkedHashMap<>();
        for (CompilationTask task : tasks) {
            results.put(task.getFileName(), task.join());
        }
        return results;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * 停止接受新任务，等待已提交的任务结束
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warning("Compilation workers did not terminate in time");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }
}
