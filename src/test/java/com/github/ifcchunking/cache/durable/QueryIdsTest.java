package com.github.ifcchunking.cache.durable;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryIdsTest {

    @Test
    void testGlobalAndFileScopedShapes() {
        assertTrue(QueryIds.of("count walls", null).matches("global_[0-9a-f]{64}"));
        assertTrue(QueryIds.of("count walls", "file-7").matches("file-7_[0-9a-f]{64}"));
    }

    @Test
    void testDeterministic() {
        assertEquals(QueryIds.of("count walls", "file-7"), QueryIds.of("count walls", "file-7"));
        assertNotEquals(QueryIds.of("count walls", "file-7"), QueryIds.of("count doors", "file-7"));
        assertNotEquals(QueryIds.of("count walls", "file-7"), QueryIds.of("count walls", null));
    }

    @Test
    void testKnownDigest() {
        // sha256("abc")
        assertEquals("global_ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                QueryIds.of("abc", null));
    }

    @Test
    void testFileNamedGlobalDoesNotShareGlobalSlot() {
        assertNotEquals(QueryIds.of("count walls", null), QueryIds.of("count walls", "global"));
        assertTrue(QueryIds.of("count walls", "global").matches("global_[0-9a-f]{64}"));
    }

    @Test
    void testFileIdAndQueryBoundaryIsUnambiguous() {
        assertNotEquals(QueryIds.of("b_c", "a"), QueryIds.of("c", "a_b"));
    }
}
