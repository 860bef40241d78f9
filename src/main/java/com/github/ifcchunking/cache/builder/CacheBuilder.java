package com.github.ifcchunking.cache.builder;

import com.github.ifcchunking.cache.api.Sizer;
import com.github.ifcchunking.cache.impl.MemoryCache;
import com.github.ifcchunking.cache.listener.RemovalListener;
import com.github.ifcchunking.cache.model.CacheConfig;
import com.github.ifcchunking.cache.policy.CachePreset;
import com.github.ifcchunking.cache.policy.EvictionPolicy;
import com.github.ifcchunking.cache.time.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link MemoryCache} instances.
 *
 * <p>Every option is optional. Without any, the cache keeps entries for 30 minutes within a 10 MB
 * budget, evicts least-recently-used entries first, sizes values by their JSON length, and rejects
 * single values larger than the whole budget.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoryCache<QueryResult> results = CacheBuilder.<QueryResult>newBuilder()
 *     .ttl(30, TimeUnit.MINUTES)
 *     .maxSize(5 * 1024 * 1024)
 *     .evictionPolicy(EvictionPolicy.LRU)
 *     .build();
 *
 * MemoryCache<Object> ui = CacheBuilder.newBuilder()
 *     .preset(CachePreset.UI)
 *     .build();
 * }</pre>
 *
 * @param <V> the type of cached values
 */
public class CacheBuilder<V> {
    private Duration ttl = CacheConfig.DEFAULT_TTL;
    private long maxSize = CacheConfig.DEFAULT_MAX_SIZE;
    private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
    private Ticker ticker = Ticker.systemTicker();
    private Sizer<? super V> sizer;
    private RemovalListener<? super V> removalListener;
    private boolean admitOversized = false;

    private CacheBuilder() {
    }

    /**
     * Constructs a new builder with default settings.
     */
    public static <V> CacheBuilder<V> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Sets how long an entry stays live after it was written. Reads do not extend it.
     *
     * @throws IllegalArgumentException if {@code ttl} is not positive
     */
    public CacheBuilder<V> ttl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.ttl = ttl;
        return this;
    }

    public CacheBuilder<V> ttl(long duration, TimeUnit unit) {
        Objects.requireNonNull(unit, "unit cannot be null");
        return ttl(Duration.ofNanos(unit.toNanos(duration)));
    }

    /**
     * Sets the byte budget.
     *
     * @throws IllegalArgumentException if {@code bytes} is negative
     */
    public CacheBuilder<V> maxSize(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("max size must not be negative");
        }
        this.maxSize = bytes;
        return this;
    }

    public CacheBuilder<V> evictionPolicy(EvictionPolicy policy) {
        this.evictionPolicy = Objects.requireNonNull(policy, "policy cannot be null");
        return this;
    }

    /**
     * Copies ttl, max size and eviction policy from {@code config}.
     */
    public CacheBuilder<V> config(CacheConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.ttl = config.ttl();
        this.maxSize = config.maxSize();
        this.evictionPolicy = config.policy();
        return this;
    }

    /**
     * Copies ttl, max size and eviction policy from a named preset.
     */
    public CacheBuilder<V> preset(CachePreset preset) {
        Objects.requireNonNull(preset, "preset cannot be null");
        return config(preset.config());
    }

    /**
     * Sets the time source for entry timestamps. Tests use this to move time forward without
     * sleeping.
     */
    public CacheBuilder<V> ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        return this;
    }

    /**
     * Replaces the default serialization-based size estimate with an explicit size function.
     */
    public CacheBuilder<V> sizer(Sizer<? super V> sizer) {
        this.sizer = Objects.requireNonNull(sizer, "sizer cannot be null");
        return this;
    }

    public CacheBuilder<V> removalListener(RemovalListener<? super V> listener) {
        this.removalListener = Objects.requireNonNull(listener, "listener cannot be null");
        return this;
    }

    /**
     * Stores values larger than the whole budget instead of rejecting them. Such a write evicts every
     * other entry and leaves the cache over budget until the value is removed.
     */
    public CacheBuilder<V> admitOversizedEntries() {
        this.admitOversized = true;
        return this;
    }

    /**
     * Builds a cache with the current settings. The builder can be reused.
     */
    public MemoryCache<V> build() {
        return new MemoryCache<>(this);
    }

    // Getters for the implementation

    public CacheConfig getConfig() {
        return new CacheConfig(ttl, maxSize, evictionPolicy);
    }

    public Ticker getTicker() {
        return ticker;
    }

    public Sizer<? super V> getSizer() {
        return sizer;
    }

    public RemovalListener<? super V> getRemovalListener() {
        return removalListener;
    }

    public boolean isAdmittingOversizedEntries() {
        return admitOversized;
    }
}
