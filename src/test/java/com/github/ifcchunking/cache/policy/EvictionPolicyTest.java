package com.github.ifcchunking.cache.policy;

import com.github.ifcchunking.cache.model.CacheEntry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EvictionPolicyTest {

    private static List<String> keys(List<CacheEntry<String>> entries) {
        return entries.stream().map(CacheEntry::getKey).collect(Collectors.toList());
    }

    @Test
    void testSelectVictimsStopsOnceEnoughIsFreed() {
        CacheEntry<String> a = new CacheEntry<>("a", "a", 4, 0, 1);
        CacheEntry<String> b = new CacheEntry<>("b", "b", 4, 10, 2);
        CacheEntry<String> c = new CacheEntry<>("c", "c", 4, 20, 3);

        assertEquals(List.of("a"), keys(EvictionPolicy.FIFO.selectVictims(List.of(c, b, a), 3)));
        assertEquals(List.of("a", "b"), keys(EvictionPolicy.FIFO.selectVictims(List.of(c, b, a), 5)));
        assertTrue(EvictionPolicy.FIFO.selectVictims(List.of(a, b, c), 0).isEmpty());
    }

    @Test
    void testSelectVictimsReturnsEverythingWhenBudgetCannotBeMet() {
        CacheEntry<String> a = new CacheEntry<>("a", "a", 4, 0, 1);
        CacheEntry<String> b = new CacheEntry<>("b", "b", 4, 10, 2);

        assertEquals(List.of("a", "b"), keys(EvictionPolicy.LRU.selectVictims(List.of(b, a), 100)));
    }

    @Test
    void testOrderings() {
        CacheEntry<String> older = new CacheEntry<>("older", "v", 1, 0, 1);
        CacheEntry<String> newer = new CacheEntry<>("newer", "v", 1, 10, 2);
        older.recordAccess(20, 3);
        older.recordAccess(30, 4);

        assertEquals(List.of("newer", "older"), keys(EvictionPolicy.LRU.selectVictims(List.of(older, newer), 2)));
        assertEquals(List.of("newer", "older"), keys(EvictionPolicy.LFU.selectVictims(List.of(older, newer), 2)));
        assertEquals(List.of("older", "newer"), keys(EvictionPolicy.FIFO.selectVictims(List.of(older, newer), 2)));
    }
}
