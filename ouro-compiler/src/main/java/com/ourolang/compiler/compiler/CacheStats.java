package com.ourolang.compiler.compiler;

/**
 * 编译缓存的统计快照
 *
 * <p>命中率由命中/未命中次数计算，尚无请求时为 0。</p>
 */
public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final long estimatedSize;
    private final long maximumSize;

    public CacheStats(long hitCount, long missCount, long evictionCount, long estimatedSize, long maximumSize) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.estimatedSize = estimatedSize;
        this.maximumSize = maximumSize;
    }

    static CacheStats from(com.github.benmanes.caffeine.cache.stats.CacheStats stats,
                           long estimatedSize, long maximumSize) {
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
                estimatedSize, maximumSize);
    }

    public long getHitCount() { return hitCount; }
    public long getMissCount() { return missCount; }
    public long getEvictionCount() { return evictionCount; }
    public long getEstimatedSize() { return estimatedSize; }
    public long getMaximumSize() { return maximumSize; }

    public long getRequestCount() {
        return hitCount + missCount;
    }

    public double getHitRate() {
        long requests = getRequestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    @Override
    public String toString() {
        return "CacheStats{" + hitCount + "/" + getRequestCount() + " hits, "
                + evictionCount + " evicted, " + estimatedSize + " of " + maximumSize + " entries}";
    }
}
