package com.github.ifcchunking.cache.durable.store;

/**
 * Thrown when a {@link BlobStore} or {@link BlobBucket} cannot complete a read, write, list or
 * delete.
 */
public class BlobStoreException extends RuntimeException {

    public BlobStoreException(String message) {
        super(message);
    }

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
