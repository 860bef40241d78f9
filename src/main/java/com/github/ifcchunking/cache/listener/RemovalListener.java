package com.github.ifcchunking.cache.listener;

import com.github.ifcchunking.cache.policy.RemovalCause;

/**
 * Receives a callback each time an entry leaves a cache.
 *
 * <p>Called synchronously on the thread performing the cache operation, while the cache's lock is
 * held. Keep implementations short and never call back into the same cache. Exceptions thrown by a
 * listener are logged and otherwise ignored.
 *
 * <pre>{@code
 * MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
 *     .removalListener((key, value, cause) -> {
 *         if (cause.wasEvicted()) {
 *             evicted.incrementAndGet();
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @param <V> the type of cached values
 */
@FunctionalInterface
public interface RemovalListener<V> {

    /**
     * @param key the key of the removed entry
     * @param value the value of the removed entry
     * @param cause the reason for the removal
     */
    void onRemoval(String key, V value, RemovalCause cause);
}
