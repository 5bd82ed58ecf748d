package com.ourolang.lsp;

import com.google.gson.JsonArray;

import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 文档管理器
 *
 * <p>管理当前打开的文档内容，对应 LSP 的 textDocument/didOpen、didChange、didClose。</p>
 * <p>同时缓存每个文档最近一次的诊断结果，didChange 使用 debounce 避免频繁重分析。</p>
 */
public class DocumentManager {
    private static final Logger LOG = Logger.getLogger(DocumentManager.class.getName());

    /** 默认 debounce 延迟（毫秒） */
    public static final long DEFAULT_DEBOUNCE_MS = 200;

    private final OuroAnalyzer analyzer;
    private final long debounceMs;

    /** URI -> 文档内容 */
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    /** URI -> 最近一次分析得到的诊断 */
    private final Map<String, JsonArray> diagnosticsCache = new ConcurrentHashMap<>();

    /** URI -> 待执行的 debounce 任务 */
    private final Map<String, ScheduledFuture<?>> pendingAnalysis = new ConcurrentHashMap<>();

    /** 文档版本计数器（全局递增） */
    private final AtomicLong versionCounter = new AtomicLong(0);

    /** URI -> 当前版本号（用于防止关闭/更新后旧回调回写） */
    private final Map<String, Long> documentVersions = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ouro-lsp-analyzer");
        t.setDaemon(true);
        return t;
    });

    /** 分析完成回调（用于触发诊断发布） */
    private volatile AnalysisCallback analysisCallback;

    @FunctionalInterface
    public interface AnalysisCallback {
        void onAnalysisComplete(String uri, JsonArray diagnostics);
    }

    public DocumentManager() {
        this(new OuroAnalyzer(), DEFAULT_DEBOUNCE_MS);
    }

    public DocumentManager(OuroAnalyzer analyzer, long debounceMs) {
        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must be >= 0: " + debounceMs);
        }
        this.analyzer = analyzer;
        this.debounceMs = debounceMs;
    }

    public void setAnalysisCallback(AnalysisCallback callback) {
        this.analysisCallback = callback;
    }

    /**
     * 打开文档（立即分析，无 debounce）
     */
    public void open(String uri, String content) {
        documents.put(uri, content);
        long version = versionCounter.incrementAndGet();
        documentVersions.put(uri, version);
        cancelPending(uri);
        reanalyze(uri, content, version);
    }

    /**
     * 更新文档内容（debounce 延迟分析）
     */
    public void change(String uri, String content) {
        documents.put(uri, content);
        diagnosticsCache.remove(uri); // 旧诊断已过期
        long version = versionCounter.incrementAndGet();
        documentVersions.put(uri, version);
        scheduleReanalyze(uri, content, version);
    }

    /**
     * 关闭文档
     */
    public void close(String uri) {
        documentVersions.remove(uri);
        documents.remove(uri);
        diagnosticsCache.remove(uri);
        cancelPending(uri);
    }

    /**
     * 关闭调度器，释放线程资源
     */
    public void shutdown() {
        scheduler.shutdownNow();
    }

    public String getContent(String uri) {
        return documents.get(uri);
    }

    /**
     * 获取最近一次完成的诊断；文档未打开或分析尚未完成时返回 null
     */
    public JsonArray getDiagnostics(String uri) {
        return diagnosticsCache.get(uri);
    }

    public boolean isOpen(String uri) {
        return documents.containsKey(uri);
    }

    public Iterable<String> getOpenDocuments() {
        return documents.keySet();
    }

    public OuroAnalyzer getAnalyzer() {
        return analyzer;
    }

    /**
     * 带 debounce 的延迟分析
     *
     * @param version 调度时的文档版本，执行时校验是否过期
     */
    private void scheduleReanalyze(String uri, String content, long version) {
        cancelPending(uri);
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            pendingAnalysis.remove(uri);
            reanalyze(uri, content, version);
        }, debounceMs, TimeUnit.MILLISECONDS);
        pendingAnalysis.put(uri, future);
    }

    private void cancelPending(String uri) {
        ScheduledFuture<?> prev = pendingAnalysis.remove(uri);
        if (prev != null) prev.cancel(false);
    }

    /**
     * 分析并缓存诊断；分析期间文档被关闭或更新则丢弃结果
     */
    private void reanalyze(String uri, String content, long version) {
        if (!isCurrent(uri, version)) return;

        JsonArray diagnostics;
        try {
            diagnostics = analyzer.analyze(uri, content);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "分析文档失败: " + uri, e);
            diagnosticsCache.remove(uri);
            return;
        }

        if (!isCurrent(uri, version)) {
            LOG.fine("丢弃过期分析结果: " + uri);
            return;
        }
        diagnosticsCache.put(uri, diagnostics);
        AnalysisCallback cb = analysisCallback;
        if (cb != null) {
            cb.onAnalysisComplete(uri, diagnostics);
        }
    }

    private boolean isCurrent(String uri, long version) {
        Long currentVersion = documentVersions.get(uri);
        return currentVersion != null && currentVersion == version;
    }
}
