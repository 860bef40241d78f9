package com.github.ifcchunking.cache.durable;

/**
 * Lifecycle of a {@link DurableCacheManager}.
 */
public enum ManagerState {
    /** Constructed; {@code initialize()} not yet called, or it found no usable store. */
    UNINITIALIZED,
    /** The store bucket is open but periodic cleanup is not scheduled yet. */
    INITIALIZED,
    /** Bucket open and periodic cleanup scheduled. */
    ACTIVE,
    /** {@code close()} was called; every operation returns its fallback. */
    CLOSED
}
