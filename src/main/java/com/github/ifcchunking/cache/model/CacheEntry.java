package com.github.ifcchunking.cache.model;

/**
 * A cached value plus the bookkeeping the eviction policies and TTL checks need.
 *
 * <p>Entries are owned by the cache that created them and are only mutated under that cache's
 * lock: every successful read bumps {@link #getAccessCount()} and refreshes
 * {@link #getLastAccessedAt()}. Timestamps come from the cache's
 * {@link com.github.ifcchunking.cache.time.Ticker}, in nanoseconds.
 *
 * @param <V> the type of the cached value
 */
public class CacheEntry<V> {
    private final String key;
    private final V value;
    private final long insertedAt;
    private final long size;
    private final long insertionOrder;
    private long accessCount;
    private long lastAccessedAt;
    private long lastAccessOrder;

    /**
     * Creates an entry as it is written. The write counts as the first access.
     *
     * @param key the cache key
     * @param value the value, never null
     * @param size the approximate size of the value in bytes
     * @param now the ticker reading at insertion
     * @param sequence a cache-wide counter value, strictly increasing per write or access
     */
    public CacheEntry(String key, V value, long size, long now, long sequence) {
        this.key = key;
        this.value = value;
        this.size = size;
        this.insertedAt = now;
        this.insertionOrder = sequence;
        this.accessCount = 1;
        this.lastAccessedAt = now;
        this.lastAccessOrder = sequence;
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    /**
     * Ticker reading when this entry was written, in nanoseconds.
     */
    public long getInsertedAt() {
        return insertedAt;
    }

    /**
     * Approximate size in bytes, fixed at write time.
     */
    public long getSize() {
        return size;
    }

    public long getAccessCount() {
        return accessCount;
    }

    /**
     * Ticker reading of the most recent write or successful read, in nanoseconds.
     */
    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    /**
     * Position of the write among all writes to the owning cache. Breaks ties between entries
     * written at the same ticker reading.
     */
    public long getInsertionOrder() {
        return insertionOrder;
    }

    /**
     * Position of the most recent access among all accesses to the owning cache.
     */
    public long getLastAccessOrder() {
        return lastAccessOrder;
    }

    /**
     * Records a successful read.
     */
    public void recordAccess(long now, long sequence) {
        accessCount++;
        lastAccessedAt = now;
        lastAccessOrder = sequence;
    }

    /**
     * Returns true once more than {@code ttlNanos} have passed since insertion. An entry read
     * exactly at the TTL boundary is still live.
     */
    public boolean isExpired(long now, long ttlNanos) {
        return now - insertedAt > ttlNanos;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key
                + ", size=" + size
                + ", accessCount=" + accessCount
                + ", insertedAt=" + insertedAt
                + ", lastAccessedAt=" + lastAccessedAt
                + '}';
    }
}
