package com.github.ifcchunking.cache.durable.store;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBlobStoreTest {

    private static Blob blob(String text) {
        return new Blob(text.getBytes(StandardCharsets.UTF_8), Map.of(Blob.CONTENT_TYPE, "text/plain"));
    }

    @Test
    void testPutGetDelete() {
        BlobBucket bucket = new InMemoryBlobStore().open("ns").join();

        bucket.put("offline://queries/q1", blob("one")).join();

        Optional<Blob> stored = bucket.get("offline://queries/q1").join();
        assertTrue(stored.isPresent());
        assertEquals("one", new String(stored.get().data(), StandardCharsets.UTF_8));
        assertEquals("text/plain", stored.get().metadata(Blob.CONTENT_TYPE));

        assertTrue(bucket.delete("offline://queries/q1").join());
        assertFalse(bucket.delete("offline://queries/q1").join());
        assertTrue(bucket.get("offline://queries/q1").join().isEmpty());
    }

    @Test
    void testReopeningSeesSameData() {
        InMemoryBlobStore store = new InMemoryBlobStore();
        store.open("ns").join().put("k", blob("v")).join();

        assertEquals(List.of("k"), store.open("ns").join().keys().join());
        assertTrue(store.open("other").join().keys().join().isEmpty());
    }

    @Test
    void testKeysAreSorted() {
        BlobBucket bucket = new InMemoryBlobStore().open("ns").join();
        bucket.put("b", blob("2")).join();
        bucket.put("a", blob("1")).join();
        bucket.put("c", blob("3")).join();

        assertEquals(List.of("a", "b", "c"), bucket.keys().join());
    }

    @Test
    void testUnsupportedStoreRefusesToOpen() {
        InMemoryBlobStore store = InMemoryBlobStore.unsupported();

        assertFalse(store.isSupported());
        CompletionException e = assertThrows(CompletionException.class, () -> store.open("ns").join());
        assertInstanceOf(BlobStoreException.class, e.getCause());
    }

    @Test
    void testBlobIsImmutable() {
        byte[] data = {1, 2, 3};
        Blob blob = Blob.of(data);
        data[0] = 9;
        blob.data()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, blob.data());
        assertEquals(3, blob.size());
        assertThrows(UnsupportedOperationException.class, () -> blob.metadata().put("x", "y"));
    }
}
