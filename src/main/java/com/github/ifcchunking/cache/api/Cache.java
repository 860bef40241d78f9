package com.github.ifcchunking.cache.api;

import com.github.ifcchunking.cache.model.CacheConfig;
import com.github.ifcchunking.cache.model.CacheStats;

import java.util.List;
import java.util.Map;

/**
 * A string-keyed, in-process cache with a time-to-live and a byte budget.
 *
 * <p>Entries expire lazily: an entry older than the TTL stays in memory until a {@link #get},
 * {@link #has}, {@link #entries()} or {@link #cleanUp()} notices it. When a {@link #set} would take
 * the cache over budget, the configured eviction policy removes entries first to make room.
 *
 * <p>Operations on one cache instance are strictly ordered; implementations are safe to share
 * between threads.
 *
 * @param <V> the type of cached values
 */
public interface Cache<V> {

    /**
     * Returns the value for {@code key}, or {@code null} if the key is unknown or its entry has
     * expired. An expired entry is removed on this path. Hits and misses are counted.
     *
     * @param key the key to look up
     * @return the cached value, or {@code null}
     */
    V get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous entry. If the write would push
     * the cache past its byte budget, entries are evicted first until it fits.
     *
     * @param key the key
     * @param value the value, never null
     * @return {@code true} if the entry was stored, {@code false} if the value alone is larger than
     *         the budget and the cache rejects such values
     */
    boolean set(String key, V value);

    /**
     * Returns whether a live entry exists for {@code key}. Like {@link #get}, removes an expired
     * entry, but leaves hit/miss counters and access bookkeeping untouched.
     */
    boolean has(String key);

    /**
     * Removes the entry for {@code key}.
     *
     * @return {@code true} if an entry existed
     */
    boolean delete(String key);

    /**
     * Removes every entry and resets the hit, miss and eviction counters to zero.
     */
    void clear();

    /**
     * Returns every key currently held, including expired entries that have not been swept yet.
     */
    List<String> keys();

    /**
     * Returns the live entries as an insertion-ordered, unmodifiable map, removing expired entries
     * as they are encountered.
     */
    Map<String, V> entries();

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    int cleanUp();

    /**
     * Returns the current entry count, total size and cumulative counters.
     */
    CacheStats stats();

    /**
     * Returns the configuration this cache was built with.
     */
    CacheConfig config();
}
