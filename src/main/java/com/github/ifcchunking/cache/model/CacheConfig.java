package com.github.ifcchunking.cache.model;

import com.github.ifcchunking.cache.policy.EvictionPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * The fixed parameters of a cache: how long entries live, how many bytes the cache may hold, and
 * which policy picks eviction victims. Immutable; a cache keeps the config it was built with for
 * its whole lifetime.
 */
public final class CacheConfig {
    /**
     * 30 minutes.
     */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    /**
     * 10 MB.
     */
    public static final long DEFAULT_MAX_SIZE = 10L * 1024 * 1024;

    private final Duration ttl;
    private final long maxSize;
    private final EvictionPolicy policy;

    /**
     * @param ttl the time-to-live of every entry, measured from insertion; must be positive
     * @param maxSize the byte budget; must not be negative
     * @param policy the eviction policy
     * @throws IllegalArgumentException if {@code ttl} is not positive or {@code maxSize} is negative
     */
    public CacheConfig(Duration ttl, long maxSize, EvictionPolicy policy) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (maxSize < 0) {
            throw new IllegalArgumentException("max size must not be negative: " + maxSize);
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.policy = policy;
    }

    /**
     * Returns the defaults: 30 minutes, 10 MB, LRU.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_TTL, DEFAULT_MAX_SIZE, EvictionPolicy.LRU);
    }

    public Duration ttl() {
        return ttl;
    }

    public long maxSize() {
        return maxSize;
    }

    public EvictionPolicy policy() {
        return policy;
    }

    /**
     * Returns a copy of this config with a different TTL.
     */
    public CacheConfig withTtl(Duration newTtl) {
        return new CacheConfig(newTtl, maxSize, policy);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheConfig)) {
            return false;
        }
        CacheConfig other = (CacheConfig) obj;
        return maxSize == other.maxSize && ttl.equals(other.ttl) && policy == other.policy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ttl, maxSize, policy);
    }

    @Override
    public String toString() {
        return "CacheConfig{ttl=" + ttl + ", maxSize=" + maxSize + ", policy=" + policy + '}';
    }
}
