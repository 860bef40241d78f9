package com.github.ifcchunking.cache.durable.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * A {@link BlobStore} kept in memory. Data lives as long as the store instance, so it is only
 * "durable" across managers sharing the instance; useful where no disk is available and in tests.
 *
 * <p>By default every operation completes on the calling thread. Pass an {@link Executor} to make
 * completion asynchronous.
 */
public class InMemoryBlobStore implements BlobStore {

    private final ConcurrentMap<String, ConcurrentMap<String, Blob>> buckets = new ConcurrentHashMap<>();
    private final Executor executor;
    private final boolean supported;

    public InMemoryBlobStore() {
        this(Runnable::run, true);
    }

    /**
     * @param executor runs every bucket operation
     * @param supported the value {@link #isSupported()} reports
     */
    public InMemoryBlobStore(Executor executor, boolean supported) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.supported = supported;
    }

    /**
     * Returns a store that reports itself unsupported.
     */
    public static InMemoryBlobStore unsupported() {
        return new InMemoryBlobStore(Runnable::run, false);
    }

    @Override
    public boolean isSupported() {
        return supported;
    }

    @Override
    public CompletableFuture<BlobBucket> open(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (!supported) {
            return CompletableFuture.failedFuture(new BlobStoreException("In-memory store disabled"));
        }
        return CompletableFuture.supplyAsync(
                () -> new MemoryBucket(name, buckets.computeIfAbsent(name, n -> new ConcurrentHashMap<>())),
                executor);
    }

    private final class MemoryBucket implements BlobBucket {
        private final String name;
        private final ConcurrentMap<String, Blob> blobs;

        MemoryBucket(String name, ConcurrentMap<String, Blob> blobs) {
            this.name = name;
            this.blobs = blobs;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CompletableFuture<Void> put(String key, Blob blob) {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(blob, "blob cannot be null");
            return CompletableFuture.runAsync(() -> blobs.put(key, blob), executor);
        }

        @Override
        public CompletableFuture<Optional<Blob>> get(String key) {
            Objects.requireNonNull(key, "key cannot be null");
            return CompletableFuture.supplyAsync(() -> Optional.ofNullable(blobs.get(key)), executor);
        }

        @Override
        public CompletableFuture<List<String>> keys() {
            return CompletableFuture.supplyAsync(() -> {
                List<String> keys = new ArrayList<>(blobs.keySet());
                keys.sort(null);
                return keys;
            }, executor);
        }

        @Override
        public CompletableFuture<Boolean> delete(String key) {
            Objects.requireNonNull(key, "key cannot be null");
            return CompletableFuture.supplyAsync(() -> blobs.remove(key) != null, executor);
        }
    }
}
