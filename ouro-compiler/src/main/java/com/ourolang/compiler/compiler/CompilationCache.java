package com.ourolang.compiler.compiler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 基于 Caffeine 的编译结果缓存
 *
 * <p>键为 (文件名, 源码) 的 SHA-256，相同输入直接复用上次的
 * {@link CompilationResult}。线程安全。</p>
 */
public final class CompilationCache {

    private final Cache<String, CompilationResult> cache;
    private final long maximumSize;

    public CompilationCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public CompilationResult get(String key) {
        return cache.getIfPresent(key);
    }

    public void put(String key, CompilationResult result) {
        cache.put(key, result);
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    public CacheStats getStats() {
        return CacheStats.from(cache.stats(), cache.estimatedSize(), maximumSize);
    }

    /**
     * 计算缓存键：文件名与源码之间以 NUL 分隔，避免拼接歧义
     */
    public static String computeKey(String fileName, String source) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(fileName.getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            byte[] hash = md.digest(source.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
