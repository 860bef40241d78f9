package com.github.ifcchunking.cache.durable.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemBlobStoreTest {

    @TempDir
    Path root;

    private static Blob blob(String text, String cachedAt) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(Blob.CONTENT_TYPE, "application/json");
        metadata.put(Blob.CACHED_AT, cachedAt);
        return new Blob(text.getBytes(StandardCharsets.UTF_8), metadata);
    }

    @Test
    void testSupportedWhenRootWritable() {
        assertTrue(new FileSystemBlobStore(root.resolve("nested/cache")).isSupported());
        assertTrue(Files.isDirectory(root.resolve("nested/cache")));
    }

    @Test
    void testUnsupportedWhenRootIsAFile() throws Exception {
        Path file = Files.writeString(root.resolve("not-a-dir"), "x");

        assertFalse(new FileSystemBlobStore(file).isSupported());
    }

    @Test
    void testRoundTripWithMetadata() {
        BlobBucket bucket = new FileSystemBlobStore(root).open("ifc-chunking-offline-data").join();
        String key = "ifc-chunking-offline-data://queries/global_abc";

        bucket.put(key, blob("{\"q\":1}", "2026-03-01T10:15:30Z")).join();

        Optional<Blob> stored = bucket.get(key).join();
        assertTrue(stored.isPresent());
        assertEquals("{\"q\":1}", new String(stored.get().data(), StandardCharsets.UTF_8));
        assertEquals("application/json", stored.get().metadata(Blob.CONTENT_TYPE));
        assertEquals("2026-03-01T10:15:30Z", stored.get().metadata(Blob.CACHED_AT));
    }

    @Test
    void testKeysSurviveNewStoreInstance() {
        new FileSystemBlobStore(root).open("ns").join().put("ns://files/a b", blob("1", "t")).join();
        new FileSystemBlobStore(root).open("ns").join().put("ns://files/c", blob("2", "t")).join();

        List<String> keys = new FileSystemBlobStore(root).open("ns").join().keys().join();

        assertEquals(List.of("ns://files/a b", "ns://files/c"), keys);
    }

    @Test
    void testOverwriteReplacesPayload() {
        BlobBucket bucket = new FileSystemBlobStore(root).open("ns").join();
        bucket.put("k", blob("first", "t1")).join();

        bucket.put("k", blob("second", "t2")).join();

        Blob stored = bucket.get("k").join().orElseThrow();
        assertEquals("second", new String(stored.data(), StandardCharsets.UTF_8));
        assertEquals("t2", stored.metadata(Blob.CACHED_AT));
        assertEquals(List.of("k"), bucket.keys().join());
    }

    @Test
    void testMissingKeyAndDelete() {
        BlobBucket bucket = new FileSystemBlobStore(root).open("ns").join();
        bucket.put("k", blob("v", "t")).join();

        assertTrue(bucket.get("absent").join().isEmpty());
        assertTrue(bucket.delete("k").join());
        assertFalse(bucket.delete("k").join());
        assertTrue(bucket.keys().join().isEmpty());
    }
}
