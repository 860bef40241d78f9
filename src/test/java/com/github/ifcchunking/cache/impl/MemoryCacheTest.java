package com.github.ifcchunking.cache.impl;

import com.github.ifcchunking.cache.builder.CacheBuilder;
import com.github.ifcchunking.cache.model.CacheStats;
import com.github.ifcchunking.cache.policy.EvictionPolicy;
import com.github.ifcchunking.cache.policy.RemovalCause;
import com.github.ifcchunking.cache.time.FakeTicker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-process cache engine: expiry, size budget, eviction order and statistics.
 */
class MemoryCacheTest {

    private final FakeTicker ticker = new FakeTicker();

    /**
     * A cache of strings sized by their length, so budgets are easy to reason about.
     */
    private MemoryCache<String> newCache(long maxSize, EvictionPolicy policy) {
        return CacheBuilder.<String>newBuilder()
                .ttl(1000, TimeUnit.MILLISECONDS)
                .maxSize(maxSize)
                .evictionPolicy(policy)
                .ticker(ticker)
                .sizer(String::length)
                .build();
    }

    // ========== Basic operations ==========

    @Test
    void testSetThenGetReturnsValue() {
        MemoryCache<Object> cache = CacheBuilder.newBuilder().ticker(ticker).build();

        assertTrue(cache.set("k", Map.of("v", 1)));

        assertEquals(Map.of("v", 1), cache.get("k"));
        assertEquals(1, cache.stats().entries());
    }

    @Test
    void testGetMissingKeyReturnsNull() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);

        assertNull(cache.get("missing"));
        assertEquals(1, cache.stats().missCount());
    }

    @Test
    void testDelete() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("a", "aaaa");

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));
        assertNull(cache.get("a"));
        assertEquals(0, cache.stats().size());
    }

    @Test
    void testReplaceUpdatesSizeWithoutEviction() {
        List<RemovalCause> causes = new ArrayList<>();
        MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
                .maxSize(10)
                .ticker(ticker)
                .sizer(String::length)
                .removalListener((key, value, cause) -> causes.add(cause))
                .build();

        cache.set("a", "aaaaaaaa");
        cache.set("a", "bb");

        assertEquals("bb", cache.get("a"));
        assertEquals(2, cache.stats().size());
        assertEquals(0, cache.stats().evictions());
        assertEquals(List.of(RemovalCause.REPLACED), causes);
    }

    @Test
    void testReplaceThatFitsOnlyAfterRemovingOldValueEvictsNothing() {
        MemoryCache<String> cache = newCache(10, EvictionPolicy.LRU);
        cache.set("a", "aaaaa");
        cache.set("b", "bbbbb");

        cache.set("b", "cccc");

        assertEquals("aaaaa", cache.get("a"));
        assertEquals("cccc", cache.get("b"));
        assertEquals(0, cache.stats().evictions());
    }

    @Test
    void testNullKeyAndValueRejected() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);

        assertThrows(NullPointerException.class, () -> cache.get(null));
        assertThrows(NullPointerException.class, () -> cache.set("k", null));
        assertThrows(NullPointerException.class, () -> cache.set(null, "v"));
    }

    // ========== Expiry ==========

    @Test
    void testEntryLiveUntilTtlElapsed() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("k", "v");

        ticker.advance(999, TimeUnit.MILLISECONDS);
        assertEquals("v", cache.get("k"));

        ticker.advance(1, TimeUnit.MILLISECONDS);
        assertEquals("v", cache.get("k"), "entry is still live exactly at its ttl");

        ticker.advance(1, TimeUnit.MILLISECONDS);
        assertNull(cache.get("k"));
        assertEquals(0, cache.stats().entries());
    }

    @Test
    void testReadsDoNotExtendTtl() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("k", "v");

        ticker.advance(600, TimeUnit.MILLISECONDS);
        assertEquals("v", cache.get("k"));
        ticker.advance(600, TimeUnit.MILLISECONDS);

        assertNull(cache.get("k"));
    }

    @Test
    void testHasRemovesExpiredEntry() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("k", "v");
        assertTrue(cache.has("k"));

        ticker.advance(2, TimeUnit.SECONDS);

        assertFalse(cache.has("k"));
        assertTrue(cache.keys().isEmpty());
    }

    @Test
    void testHasDoesNotTouchStatistics() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("k", "v");

        cache.has("k");
        cache.has("other");

        CacheStats stats = cache.stats();
        assertEquals(0, stats.hitCount());
        assertEquals(0, stats.missCount());
    }

    @Test
    void testKeysIncludeExpiredUntilSwept() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("old", "1");
        ticker.advance(800, TimeUnit.MILLISECONDS);
        cache.set("new", "2");
        ticker.advance(400, TimeUnit.MILLISECONDS);

        assertEquals(List.of("old", "new"), cache.keys());

        assertEquals(1, cache.cleanUp());
        assertEquals(List.of("new"), cache.keys());
        assertEquals(0, cache.cleanUp());
    }

    @Test
    void testEntriesSkipsExpired() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("old", "1");
        ticker.advance(800, TimeUnit.MILLISECONDS);
        cache.set("new", "2");
        ticker.advance(400, TimeUnit.MILLISECONDS);

        assertEquals(Map.of("new", "2"), cache.entries());
        assertEquals(1, cache.stats().entries());
    }

    // ========== Size budget and eviction ==========

    @Test
    void testSizeNeverExceedsBudget() {
        MemoryCache<String> cache = newCache(10, EvictionPolicy.LRU);

        for (int i = 0; i < 20; i++) {
            cache.set("k" + i, "x".repeat(1 + i % 5));
            assertTrue(cache.stats().size() <= 10, "size after write " + i + ": " + cache.stats().size());
        }
    }

    @Test
    void testEvictionFreesOnlyWhatIsNeeded() {
        MemoryCache<String> cache = newCache(10, EvictionPolicy.LRU);
        cache.set("a", "aaaa");
        cache.set("b", "bbbb");
        cache.set("c", "cc");

        cache.set("d", "dddd");

        assertEquals(List.of("b", "c", "d"), cache.keys());
        assertEquals(10, cache.stats().size());
        assertEquals(1, cache.stats().evictions());
    }

    @Test
    void testLruEvictsLeastRecentlyRead() {
        MemoryCache<String> cache = newCache(12, EvictionPolicy.LRU);
        cache.set("a", "aaaa");
        ticker.advance(1, TimeUnit.MILLISECONDS);
        cache.set("b", "bbbb");
        ticker.advance(1, TimeUnit.MILLISECONDS);
        cache.set("c", "cccc");
        ticker.advance(1, TimeUnit.MILLISECONDS);
        cache.get("a");

        cache.set("d", "dddd");

        assertFalse(cache.has("b"));
        assertTrue(cache.has("a"));
        assertTrue(cache.has("c"));
        assertTrue(cache.has("d"));
    }

    @Test
    void testLruBreaksTiesByAccessOrder() {
        MemoryCache<String> cache = newCache(8, EvictionPolicy.LRU);
        cache.set("a", "aaaa");
        cache.set("b", "bbbb");
        cache.get("a");

        cache.set("c", "cccc");

        assertEquals(List.of("a", "c"), cache.keys());
    }

    @Test
    void testLfuEvictsLeastFrequentlyRead() {
        MemoryCache<String> cache = newCache(12, EvictionPolicy.LFU);
        cache.set("a", "aaaa");
        cache.set("b", "bbbb");
        cache.set("c", "cccc");
        cache.get("a");
        cache.get("a");
        cache.get("c");

        cache.set("d", "dddd");

        assertEquals(List.of("a", "c", "d"), cache.keys());
    }

    @Test
    void testLfuBreaksTiesByInsertionOrder() {
        MemoryCache<String> cache = newCache(8, EvictionPolicy.LFU);
        cache.set("a", "aaaa");
        cache.set("b", "bbbb");

        cache.set("c", "cccc");

        assertEquals(List.of("b", "c"), cache.keys());
    }

    @Test
    void testFifoIgnoresReads() {
        MemoryCache<String> cache = newCache(12, EvictionPolicy.FIFO);
        cache.set("a", "aaaa");
        ticker.advance(1, TimeUnit.MILLISECONDS);
        cache.set("b", "bbbb");
        ticker.advance(1, TimeUnit.MILLISECONDS);
        cache.set("c", "cccc");
        for (int i = 0; i < 5; i++) {
            cache.get("a");
        }

        cache.set("d", "dddd");

        assertEquals(List.of("b", "c", "d"), cache.keys());
    }

    @Test
    void testOversizedEntryRejectedByDefault() {
        MemoryCache<String> cache = newCache(10, EvictionPolicy.LRU);
        cache.set("a", "aaaa");

        assertFalse(cache.set("big", "x".repeat(11)));

        assertEquals(List.of("a"), cache.keys());
        assertEquals(0, cache.stats().evictions());
    }

    @Test
    void testOversizedEntryAdmittedWhenEnabled() {
        MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
                .maxSize(10)
                .ticker(ticker)
                .sizer(String::length)
                .admitOversizedEntries()
                .build();
        cache.set("a", "aaaa");
        cache.set("b", "bbbb");

        assertTrue(cache.set("big", "x".repeat(11)));

        assertEquals(List.of("big"), cache.keys());
        assertEquals(11, cache.stats().size());
        assertEquals(2, cache.stats().evictions());
    }

    @Test
    void testExpiredRemovalIsNotAnEviction() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("k", "v");
        ticker.advance(2, TimeUnit.SECONDS);

        cache.cleanUp();

        assertEquals(0, cache.stats().evictions());
    }

    // ========== Statistics ==========

    @Test
    void testHitAndMissRates() {
        MemoryCache<String> cache = newCache(100, EvictionPolicy.LRU);
        cache.set("k", "v");

        cache.get("k");
        cache.get("k");
        cache.get("k");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertEquals(3, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.75, stats.hitRate(), 0.0001);
        assertEquals(0.25, stats.missRate(), 0.0001);
    }

    @Test
    void testRatesAreZeroWithoutRequests() {
        CacheStats stats = newCache(100, EvictionPolicy.LRU).stats();

        assertEquals(0.0, stats.hitRate());
        assertEquals(0.0, stats.missRate());
    }

    @Test
    void testClearResetsEntriesAndCounters() {
        MemoryCache<String> cache = newCache(8, EvictionPolicy.LRU);
        cache.set("a", "aaaa");
        cache.set("b", "bbbb");
        cache.set("c", "cccc");
        cache.get("c");
        cache.get("a");

        cache.clear();

        assertEquals(new CacheStats(0, 0, 0, 0, 0), cache.stats());
        assertTrue(cache.keys().isEmpty());
    }

    // ========== Removal listener ==========

    @Test
    void testRemovalListenerReceivesCauses() {
        List<String> removals = new ArrayList<>();
        MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
                .ttl(1, TimeUnit.SECONDS)
                .maxSize(8)
                .ticker(ticker)
                .sizer(String::length)
                .removalListener((key, value, cause) -> removals.add(key + ":" + cause))
                .build();

        cache.set("a", "aaaa");
        cache.set("b", "bbbb");
        cache.set("c", "cccc");
        cache.delete("b");
        ticker.advance(2, TimeUnit.SECONDS);
        cache.get("c");

        assertEquals(List.of("a:SIZE", "b:EXPLICIT", "c:EXPIRED"), removals);
    }

    @Test
    void testFailingRemovalListenerDoesNotBreakCache() {
        MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
                .ticker(ticker)
                .removalListener((key, value, cause) -> {
                    throw new IllegalStateException("listener failure");
                })
                .build();
        cache.set("a", "1");

        assertTrue(cache.delete("a"));
        assertFalse(cache.has("a"));
    }

    /**
     * A listener that deletes a dependent key when its parent expires.
     */
    private MemoryCache<String> newCascadingCache(List<String> removals) {
        AtomicReference<MemoryCache<String>> self = new AtomicReference<>();
        MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
                .ttl(1, TimeUnit.SECONDS)
                .ticker(ticker)
                .sizer(String::length)
                .removalListener((key, value, cause) -> {
                    removals.add(key + ":" + cause);
                    if (cause == RemovalCause.EXPIRED && key.equals("parent")) {
                        self.get().delete("child");
                    }
                })
                .build();
        self.set(cache);
        cache.set("parent", "p");
        cache.set("child", "c");
        cache.set("other", "o");
        ticker.advance(2, TimeUnit.SECONDS);
        return cache;
    }

    @Test
    void testCleanUpToleratesListenerWritingBack() {
        List<String> removals = new ArrayList<>();
        MemoryCache<String> cache = newCascadingCache(removals);

        assertEquals(2, cache.cleanUp());

        assertEquals(List.of("parent:EXPIRED", "child:EXPLICIT", "other:EXPIRED"), removals);
        assertTrue(cache.keys().isEmpty());
        assertEquals(0, cache.stats().size());
    }

    @Test
    void testEntriesToleratesListenerWritingBack() {
        List<String> removals = new ArrayList<>();
        MemoryCache<String> cache = newCascadingCache(removals);
        cache.set("fresh", "f");

        assertEquals(Map.of("fresh", "f"), cache.entries());
        assertEquals(List.of("parent:EXPIRED", "child:EXPLICIT", "other:EXPIRED"), removals);
        assertEquals(1, cache.stats().size());
    }
}
