package com.forecast.pipeline.cache;

/**
 * Stage cache metrics.
 *
 * @param hitCount          number of reads served from the cache
 * @param missCount         number of reads that ran a computation
 * @param invalidationCount number of entries removed by invalidation
 * @param size              current number of entries across all attributes
 */
public record CacheStats(long hitCount, long missCount, long invalidationCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
