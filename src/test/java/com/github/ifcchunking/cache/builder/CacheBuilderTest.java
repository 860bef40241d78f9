package com.github.ifcchunking.cache.builder;

import com.github.ifcchunking.cache.impl.MemoryCache;
import com.github.ifcchunking.cache.model.CacheConfig;
import com.github.ifcchunking.cache.policy.CachePreset;
import com.github.ifcchunking.cache.policy.EvictionPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CacheBuilderTest {

    @Test
    void testDefaults() {
        MemoryCache<String> cache = CacheBuilder.<String>newBuilder().build();

        assertEquals(CacheConfig.defaults(), cache.config());
        assertEquals(Duration.ofMinutes(30), cache.config().ttl());
        assertEquals(10L * 1024 * 1024, cache.config().maxSize());
        assertEquals(EvictionPolicy.LRU, cache.config().policy());
    }

    @Test
    void testExplicitSettings() {
        MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
                .ttl(2, TimeUnit.MINUTES)
                .maxSize(2048)
                .evictionPolicy(EvictionPolicy.FIFO)
                .build();

        assertEquals(new CacheConfig(Duration.ofMinutes(2), 2048, EvictionPolicy.FIFO), cache.config());
    }

    @Test
    void testPresetCanBeAdjusted() {
        MemoryCache<Object> cache = CacheBuilder.newBuilder()
                .preset(CachePreset.FILES)
                .maxSize(1024)
                .build();

        assertEquals(Duration.ofHours(24), cache.config().ttl());
        assertEquals(EvictionPolicy.LFU, cache.config().policy());
        assertEquals(1024, cache.config().maxSize());
    }

    @Test
    void testInvalidSettingsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CacheBuilder.newBuilder().ttl(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> CacheBuilder.newBuilder().maxSize(-1));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().evictionPolicy(null));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().ticker(null));
    }
}
