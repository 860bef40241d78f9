package com.github.ifcchunking.cache.support;

import com.github.ifcchunking.cache.builder.CacheBuilder;
import com.github.ifcchunking.cache.impl.MemoryCache;
import com.github.ifcchunking.cache.policy.CachePreset;
import com.github.ifcchunking.cache.time.Ticker;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One cache per {@link CachePreset}, created together and handed to the code that needs them.
 *
 * <p>Build one instance at application startup and pass it along; tests build their own so they
 * never share entries.
 */
public class PresetCaches {
    private final Map<CachePreset, MemoryCache<Object>> caches = new EnumMap<>(CachePreset.class);

    public PresetCaches() {
        this(Ticker.systemTicker());
    }

    public PresetCaches(Ticker ticker) {
        Objects.requireNonNull(ticker, "ticker cannot be null");
        for (CachePreset preset : CachePreset.values()) {
            caches.put(preset, CacheBuilder.newBuilder().preset(preset).ticker(ticker).build());
        }
    }

    public MemoryCache<Object> get(CachePreset preset) {
        return caches.get(Objects.requireNonNull(preset, "preset cannot be null"));
    }

    public MemoryCache<Object> ui() {
        return get(CachePreset.UI);
    }

    public MemoryCache<Object> api() {
        return get(CachePreset.API);
    }

    public MemoryCache<Object> files() {
        return get(CachePreset.FILES);
    }

    public MemoryCache<Object> preferences() {
        return get(CachePreset.PREFERENCES);
    }

    /**
     * Sweeps expired entries from every preset cache.
     *
     * @return the total number of entries removed
     */
    public int cleanUpAll() {
        int removed = 0;
        for (MemoryCache<Object> cache : caches.values()) {
            removed += cache.cleanUp();
        }
        return removed;
    }

    /**
     * Empties every preset cache and resets their counters.
     */
    public void clearAll() {
        caches.values().forEach(MemoryCache::clear);
    }
}
