package com.github.ifcchunking.cache.impl;

import com.github.ifcchunking.cache.api.Cache;
import com.github.ifcchunking.cache.api.Sizer;
import com.github.ifcchunking.cache.builder.CacheBuilder;
import com.github.ifcchunking.cache.listener.RemovalListener;
import com.github.ifcchunking.cache.metrics.CacheMetrics;
import com.github.ifcchunking.cache.model.CacheConfig;
import com.github.ifcchunking.cache.model.CacheEntry;
import com.github.ifcchunking.cache.model.CacheStats;
import com.github.ifcchunking.cache.policy.RemovalCause;
import com.github.ifcchunking.cache.time.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The in-process cache engine: TTL expiry, a byte budget enforced by an
 * {@link com.github.ifcchunking.cache.policy.EvictionPolicy}, and hit/miss/eviction statistics.
 *
 * <p>All operations run under a single lock, so operations on the same key are strictly ordered.
 * Expiry is lazy: entries are only checked for age when they are read, listed through
 * {@link #entries()}, or swept by {@link #cleanUp()}.
 *
 * <p>Sizes come from the configured {@link Sizer} ({@link JsonSizer} by default). A value larger
 * than the whole budget is rejected unless the cache was built with
 * {@link CacheBuilder#admitOversizedEntries()}, in which case everything else is evicted and the
 * value is stored over budget.
 *
 * <p>Logging: uses java.util.logging under the name {@code com.github.ifcchunking.cache.Cache}.
 * <ul>
 *   <li>WARNING: rejected oversized entries, failing removal listeners</li>
 *   <li>FINE: evictions and sweeps</li>
 *   <li>FINER: per-entry writes and removals</li>
 * </ul>
 *
 * @param <V> the type of cached values
 */
public class MemoryCache<V> implements Cache<V>, CacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.ifcchunking.cache.Cache");

    private final LinkedHashMap<String, CacheEntry<V>> storage = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final CacheConfig config;
    private final long ttlNanos;
    private final Ticker ticker;
    private final Sizer<? super V> sizer;
    private final RemovalListener<? super V> removalListener;
    private final boolean admitOversized;

    // Guarded by lock
    private long currentSize;
    private long sequence;

    // Statistics, readable without the lock
    private final AtomicLong hitCount = new AtomicLong();
    private final AtomicLong missCount = new AtomicLong();
    private final AtomicLong evictionCount = new AtomicLong();
    private final AtomicLong sizeSnapshot = new AtomicLong();
    private final AtomicLong entrySnapshot = new AtomicLong();

    /**
     * Creates a cache with the given config, the system ticker and default sizing.
     */
    public MemoryCache(CacheConfig config) {
        this(CacheBuilder.<V>newBuilder().config(config));
    }

    /**
     * Creates a cache from a builder. Prefer {@link CacheBuilder#build()}.
     */
    public MemoryCache(CacheBuilder<V> builder) {
        this.config = builder.getConfig();
        this.ttlNanos = config.ttl().toNanos();
        this.ticker = builder.getTicker();
        Sizer<? super V> configured = builder.getSizer();
        this.sizer = configured != null ? configured : JsonSizer.<V>instance();
        this.removalListener = builder.getRemovalListener();
        this.admitOversized = builder.isAdmittingOversizedEntries();
    }

    @Override
    public V get(String key) {
        Objects.requireNonNull(key, "key cannot be null");

        lock.lock();
        try {
            CacheEntry<V> entry = storage.get(key);
            if (entry == null) {
                missCount.incrementAndGet();
                return null;
            }

            long now = ticker.read();
            if (entry.isExpired(now, ttlNanos)) {
                removeEntry(key, RemovalCause.EXPIRED);
                missCount.incrementAndGet();
                return null;
            }

            entry.recordAccess(now, ++sequence);
            hitCount.incrementAndGet();
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean set(String key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");

        long size = sizer.sizeOf(value);
        if (size < 0) {
            throw new IllegalStateException("sizer returned negative size " + size + " for key: " + key);
        }

        lock.lock();
        try {
            if (size > config.maxSize() && !admitOversized) {
                LOGGER.warning("Rejected entry larger than the cache budget: key=" + key
                        + ", size=" + size + ", maxSize=" + config.maxSize());
                return false;
            }

            if (storage.containsKey(key)) {
                removeEntry(key, RemovalCause.REPLACED);
            }

            ensureCapacity(size);

            long now = ticker.read();
            storage.put(key, new CacheEntry<>(key, value, size, now, ++sequence));
            currentSize += size;
            publishSize();

            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Stored entry: key=" + key + ", size=" + size + ", totalSize=" + currentSize);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean has(String key) {
        Objects.requireNonNull(key, "key cannot be null");

        lock.lock();
        try {
            CacheEntry<V> entry = storage.get(key);
            if (entry == null) {
                return false;
            }
            if (entry.isExpired(ticker.read(), ttlNanos)) {
                removeEntry(key, RemovalCause.EXPIRED);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key cannot be null");

        lock.lock();
        try {
            return removeEntry(key, RemovalCause.EXPLICIT) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            for (String key : new ArrayList<>(storage.keySet())) {
                removeEntry(key, RemovalCause.EXPLICIT);
            }
            publishSize();
            hitCount.set(0);
            missCount.set(0);
            evictionCount.set(0);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> keys() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(storage.keySet()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, V> entries() {
        lock.lock();
        try {
            removeExpired(ticker.read());
            Map<String, V> live = new LinkedHashMap<>();
            for (CacheEntry<V> entry : storage.values()) {
                live.put(entry.getKey(), entry.getValue());
            }
            return Collections.unmodifiableMap(live);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanUp() {
        lock.lock();
        try {
            int removed = removeExpired(ticker.read());
            if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Swept " + removed + " expired entries, " + storage.size() + " remain");
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(storage.size(), currentSize, hitCount.get(), missCount.get(), evictionCount.get());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheConfig config() {
        return config;
    }

    /**
     * Returns the time source this cache reads entry timestamps from.
     */
    public Ticker ticker() {
        return ticker;
    }

    // Helper methods

    /**
     * Removes every entry expired at {@code now}. Expired keys are collected before any removal,
     * so a listener may write back to this cache while the sweep runs. Must be called with the
     * lock held.
     */
    private int removeExpired(long now) {
        List<String> expired = new ArrayList<>();
        for (CacheEntry<V> entry : storage.values()) {
            if (entry.isExpired(now, ttlNanos)) {
                expired.add(entry.getKey());
            }
        }
        int removed = 0;
        for (String key : expired) {
            CacheEntry<V> entry = storage.get(key);
            // a listener may already have removed or replaced it
            if (entry != null && entry.isExpired(now, ttlNanos)) {
                removeEntry(key, RemovalCause.EXPIRED);
                removed++;
            }
        }
        publishSize();
        return removed;
    }

    /**
     * Evicts entries, in policy order, until {@code incomingSize} more bytes fit in the budget.
     * Must be called with the lock held.
     */
    private void ensureCapacity(long incomingSize) {
        long required = currentSize + incomingSize - config.maxSize();
        if (required <= 0) {
            return;
        }

        List<CacheEntry<V>> victims = config.policy().selectVictims(storage.values(), required);
        for (CacheEntry<V> victim : victims) {
            if (removeEntry(victim.getKey(), RemovalCause.SIZE) == null) {
                continue;
            }
            evictionCount.incrementAndGet();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry due to size limit: key=" + victim.getKey()
                        + ", policy=" + config.policy() + ", freed=" + victim.getSize()
                        + ", totalSize=" + currentSize);
            }
        }
    }

    /**
     * Must be called with the lock held.
     */
    private CacheEntry<V> removeEntry(String key, RemovalCause cause) {
        CacheEntry<V> removed = storage.remove(key);
        if (removed != null) {
            onRemoved(removed, cause);
            publishSize();
        }
        return removed;
    }

    private void onRemoved(CacheEntry<V> entry, RemovalCause cause) {
        currentSize -= entry.getSize();
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Removed entry: key=" + entry.getKey() + ", cause=" + cause);
        }
        if (removalListener != null) {
            try {
                removalListener.onRemoval(entry.getKey(), entry.getValue(), cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + entry.getKey()
                        + ", cause: " + cause, e);
            }
        }
    }

    private void publishSize() {
        sizeSnapshot.set(currentSize);
        entrySnapshot.set(storage.size());
    }

    // CacheMetrics interface implementation for Micrometer integration

    @Override
    public long entryCount() {
        return entrySnapshot.get();
    }

    @Override
    public long totalSizeBytes() {
        return sizeSnapshot.get();
    }

    @Override
    public long maxSizeBytes() {
        return config.maxSize();
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    @Override
    public String toString() {
        return "MemoryCache{" + config + ", " + stats() + '}';
    }
}
