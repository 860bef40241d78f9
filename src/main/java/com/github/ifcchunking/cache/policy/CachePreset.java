package com.github.ifcchunking.cache.policy;

import com.github.ifcchunking.cache.model.CacheConfig;

import java.time.Duration;

/**
 * Named configurations for the kinds of data the dashboard keeps in memory. Presets are plain data;
 * the cache does not know which one it was built from.
 */
public enum CachePreset {
    /**
     * Short-lived UI state: 5 minutes, 1 MB, LRU.
     */
    UI(Duration.ofMinutes(5), 1024L * 1024, EvictionPolicy.LRU),

    /**
     * API responses: 30 minutes, 5 MB, LRU.
     */
    API(Duration.ofMinutes(30), 5L * 1024 * 1024, EvictionPolicy.LRU),

    /**
     * Large file payloads: 24 hours, 20 MB, LFU.
     */
    FILES(Duration.ofHours(24), 20L * 1024 * 1024, EvictionPolicy.LFU),

    /**
     * Long-lived preferences: 7 days, 512 KB, FIFO.
     */
    PREFERENCES(Duration.ofDays(7), 512L * 1024, EvictionPolicy.FIFO);

    private final CacheConfig config;

    CachePreset(Duration ttl, long maxSize, EvictionPolicy policy) {
        this.config = new CacheConfig(ttl, maxSize, policy);
    }

    public CacheConfig config() {
        return config;
    }
}
