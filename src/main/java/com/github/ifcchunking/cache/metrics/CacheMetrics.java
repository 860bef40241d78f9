package com.github.ifcchunking.cache.metrics;

/**
 * Counters and gauges a cache exposes for monitoring. Read by {@link MicrometerCacheMetrics};
 * every method must be callable from any thread without blocking cache operations for long.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries, expired-but-unswept ones included.
     */
    long entryCount();

    /**
     * Returns the sum of the sizes of the current entries, in bytes.
     */
    long totalSizeBytes();

    /**
     * Returns the byte budget.
     */
    long maxSizeBytes();

    long hitCount();

    long missCount();

    long evictionCount();

    /**
     * Returns the share of the byte budget in use, from 0.0 upwards. Oversized entries admitted
     * past the budget can push this above 1.0.
     */
    default double utilization() {
        long max = maxSizeBytes();
        return max == 0 ? 0.0 : (double) totalSizeBytes() / max;
    }
}
