package com.github.ifcchunking.cache.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Binds a cache's {@link CacheMetrics} to a Micrometer {@link MeterRegistry}.
 *
 * <p>Exposes, tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.entries - current number of entries
 *   <li>cache.size.bytes - current total size
 *   <li>cache.max.size.bytes - byte budget
 *   <li>cache.utilization - share of the budget in use
 *   <li>cache.hits / cache.misses - lookup counters
 *   <li>cache.evictions - entries removed to make room
 *   <li>cache.hit.ratio - hits / (hits + misses)
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MemoryCache<Object> api = caches.api();
 * MicrometerCacheMetrics.monitor(registry, api, "api");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Registers the meters for {@code cache} and returns it, for chaining.
     */
    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    public static <C extends CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.entries", cache, CacheMetrics::entryCount)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.size.bytes", cache, CacheMetrics::totalSizeBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Approximate total size of the cached values")
                .register(registry);

        Gauge.builder("cache.max.size.bytes", cache, CacheMetrics::maxSizeBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Byte budget of the cache")
                .register(registry);

        Gauge.builder("cache.utilization", cache, CacheMetrics::utilization)
                .tags(allTags)
                .description("Share of the byte budget in use")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of entries evicted to make room")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long hits = c.hitCount();
                    long total = hits + c.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);
    }
}
