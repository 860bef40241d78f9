package com.github.ifcchunking.cache.durable.store;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * An opened namespace of a {@link BlobStore}. Keys are arbitrary strings.
 *
 * <p>Every operation is asynchronous. Failures complete the returned future exceptionally, usually
 * with a {@link BlobStoreException}; implementations do not throw from the calling thread.
 */
public interface BlobBucket {

    /**
     * Returns the namespace this bucket was opened with.
     */
    String name();

    /**
     * Stores {@code blob} under {@code key}, replacing any previous blob.
     */
    CompletableFuture<Void> put(String key, Blob blob);

    /**
     * Returns the blob stored under {@code key}, or empty if there is none.
     */
    CompletableFuture<Optional<Blob>> get(String key);

    /**
     * Returns every key in this bucket.
     */
    CompletableFuture<List<String>> keys();

    /**
     * Removes the blob stored under {@code key}.
     *
     * @return a future completing with {@code true} if a blob was removed
     */
    CompletableFuture<Boolean> delete(String key);
}
