package com.github.ifcchunking.cache.model;

import java.util.Objects;

/**
 * A point-in-time snapshot of a {@link com.github.ifcchunking.cache.api.Cache}. Instances are
 * immutable.
 *
 * <p>Counters follow these rules:
 * <ul>
 *   <li>A {@code get} that returns a value increments {@code hitCount}.
 *   <li>A {@code get} for an unknown or expired key increments {@code missCount}.
 *   <li>Each entry removed by the eviction policy increments {@code evictionCount}.
 *   <li>{@code clear} resets all three counters to zero.
 * </ul>
 * {@code has} never touches the counters.
 */
public class CacheStats {
    private final long entryCount;
    private final long totalSize;
    private final long hitCount;
    private final long missCount;
    private final long evictionCount;

    public CacheStats(long entryCount, long totalSize, long hitCount, long missCount, long evictionCount) {
        this.entryCount = entryCount;
        this.totalSize = totalSize;
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
    }

    /**
     * Number of entries currently held, including expired entries not yet swept.
     */
    public long entries() {
        return entryCount;
    }

    /**
     * Sum of the approximate sizes of the entries currently held, in bytes.
     */
    public long size() {
        return totalSize;
    }

    public long hitCount() {
        return hitCount;
    }

    public long missCount() {
        return missCount;
    }

    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Returns {@code hitCount / requestCount}, or {@code 0.0} before the first lookup.
     */
    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    /**
     * Returns {@code missCount / requestCount}, or {@code 0.0} before the first lookup.
     */
    public double missRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) missCount / requests;
    }

    public long evictions() {
        return evictionCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entryCount, totalSize, hitCount, missCount, evictionCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return entryCount == other.entryCount
                && totalSize == other.totalSize
                && hitCount == other.hitCount
                && missCount == other.missCount
                && evictionCount == other.evictionCount;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "entries=" + entryCount
                + ", size=" + totalSize
                + ", hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", evictions=" + evictionCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
