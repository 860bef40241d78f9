package com.github.ifcchunking.cache.policy;

/**
 * Why an entry left a {@link com.github.ifcchunking.cache.api.Cache}.
 */
public enum RemovalCause {
    /**
     * Removed by {@code delete}, {@code clear}, or a replayed batch delete.
     */
    EXPLICIT,

    /**
     * Overwritten by a {@code set} for the same key.
     */
    REPLACED,

    /**
     * Chosen as a victim by the eviction policy to make room for a new entry.
     */
    SIZE,

    /**
     * Older than the cache's TTL when it was read, listed, or swept.
     */
    EXPIRED;

    /**
     * Returns {@code true} for removals the cache made on its own ({@link #SIZE} or
     * {@link #EXPIRED}).
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
