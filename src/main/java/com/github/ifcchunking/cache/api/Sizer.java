package com.github.ifcchunking.cache.api;

/**
 * Computes the approximate size, in bytes, that a value occupies in a cache. The cache compares the
 * sum of these sizes against its byte budget.
 *
 * <p>A sizer is called once per {@code set}, so it has to be cheap and must not touch the cache.
 * Sizes do not have to be exact, only roughly proportional to the real footprint. When the value
 * type is known, an explicit sizer beats the default serialization-based estimate:
 * <pre>{@code
 * Sizer<byte[]> bytes = value -> value.length;
 *
 * MemoryCache<byte[]> thumbnails = CacheBuilder.<byte[]>newBuilder()
 *     .maxSize(20 * 1024 * 1024)
 *     .sizer(bytes)
 *     .build();
 * }</pre>
 *
 * @param <V> the type of values being sized
 * @see com.github.ifcchunking.cache.impl.JsonSizer
 */
@FunctionalInterface
public interface Sizer<V> {

    /**
     * Returns the size of {@code value} in bytes. Must be non-negative.
     *
     * @param value the value being stored, never null
     * @return the approximate size in bytes
     */
    long sizeOf(V value);
}
