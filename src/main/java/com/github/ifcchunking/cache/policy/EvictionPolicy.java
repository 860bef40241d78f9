package com.github.ifcchunking.cache.policy;

import com.github.ifcchunking.cache.model.CacheEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Chooses which entries to remove when a write would push a cache past its byte budget.
 *
 * <p>Every policy orders the live entries from "evict first" to "evict last" and the cache removes
 * entries from the front of that order until the freed bytes cover what the write needs.
 * <ul>
 *   <li>{@link #LRU} - least recently used first
 *   <li>{@link #LFU} - least frequently used first
 *   <li>{@link #FIFO} - oldest insertion first
 * </ul>
 */
public enum EvictionPolicy {
    /**
     * Least Recently Used - oldest {@code lastAccessedAt} first. Entries touched at the same ticker
     * reading are ordered by which was touched first.
     */
    LRU(Comparator.<CacheEntry<?>>comparingLong(CacheEntry::getLastAccessedAt)
            .thenComparingLong(CacheEntry::getLastAccessOrder)),

    /**
     * Least Frequently Used - lowest {@code accessCount} first, ties broken by insertion order.
     */
    LFU(Comparator.<CacheEntry<?>>comparingLong(CacheEntry::getAccessCount)
            .thenComparingLong(CacheEntry::getInsertionOrder)),

    /**
     * First In First Out - oldest {@code insertedAt} first, regardless of reads.
     */
    FIFO(Comparator.<CacheEntry<?>>comparingLong(CacheEntry::getInsertedAt)
            .thenComparingLong(CacheEntry::getInsertionOrder));

    private final Comparator<CacheEntry<?>> order;

    EvictionPolicy(Comparator<CacheEntry<?>> order) {
        this.order = order;
    }

    /**
     * Returns the eviction order of this policy, first victim first.
     */
    public Comparator<CacheEntry<?>> order() {
        return order;
    }

    /**
     * Picks victims from {@code candidates} in this policy's order until their combined size
     * reaches {@code requiredSpace}. Returns every candidate if they cannot free that much.
     *
     * @param candidates the entries currently held
     * @param requiredSpace the number of bytes that must be freed
     * @param <V> the value type
     * @return the victims, in eviction order
     */
    public <V> List<CacheEntry<V>> selectVictims(Collection<CacheEntry<V>> candidates, long requiredSpace) {
        List<CacheEntry<V>> sorted = new ArrayList<>(candidates);
        sorted.sort(order);

        List<CacheEntry<V>> victims = new ArrayList<>();
        long freed = 0;
        for (CacheEntry<V> entry : sorted) {
            if (freed >= requiredSpace) {
                break;
            }
            victims.add(entry);
            freed += entry.getSize();
        }
        return victims;
    }
}
