package com.github.ifcchunking.cache.durable.store;

import java.util.concurrent.CompletableFuture;

/**
 * A durable key-value store that outlives the process, organized into named buckets.
 *
 * @see FileSystemBlobStore
 * @see InMemoryBlobStore
 */
public interface BlobStore {

    /**
     * Returns whether this store can be used in the current environment. Callers check this before
     * {@link #open(String)}; an unsupported store is not an error.
     */
    boolean isSupported();

    /**
     * Opens the bucket called {@code name}, creating it if needed. Opening an existing bucket again
     * is cheap and returns a view of the same data.
     */
    CompletableFuture<BlobBucket> open(String name);
}
