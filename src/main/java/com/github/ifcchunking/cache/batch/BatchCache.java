package com.github.ifcchunking.cache.batch;

import com.github.ifcchunking.cache.api.Cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers writes and deletes against one or more caches and applies them later in a single ordered
 * pass.
 *
 * <p>Buffering touches no cache. {@link #execute()} takes the buffered operations, empties the
 * buffer, then replays them in the order they were added. There is no atomicity: if an operation
 * throws, the operations before it stay applied, the ones after it are dropped, and the buffer is
 * not restored.
 *
 * <pre>{@code
 * new BatchCache()
 *     .set(apiCache, "files", fileList)
 *     .delete(uiCache, "selection")
 *     .execute();
 * }</pre>
 *
 * <p>Not thread-safe; use one batch per thread.
 */
public class BatchCache {
    private static final Logger LOGGER = Logger.getLogger("com.github.ifcchunking.cache.Cache");

    private List<Operation<?>> operations = new ArrayList<>();

    /**
     * Buffers {@code cache.set(key, value)}.
     */
    public <V> BatchCache set(Cache<V> cache, String key, V value) {
        Objects.requireNonNull(cache, "cache cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        operations.add(new Operation<>(OperationType.SET, cache, key, value));
        return this;
    }

    /**
     * Buffers {@code cache.delete(key)}.
     */
    public <V> BatchCache delete(Cache<V> cache, String key) {
        Objects.requireNonNull(cache, "cache cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        operations.add(new Operation<>(OperationType.DELETE, cache, key, null));
        return this;
    }

    /**
     * Replays every buffered operation in insertion order and empties the buffer.
     *
     * @return the number of operations applied
     */
    public int execute() {
        List<Operation<?>> pending = operations;
        operations = new ArrayList<>();

        int applied = 0;
        for (Operation<?> operation : pending) {
            operation.apply();
            applied++;
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Applied " + applied + " batched cache operations");
        }
        return applied;
    }

    /**
     * Discards every buffered operation without applying it.
     */
    public void clear() {
        operations.clear();
    }

    /**
     * Returns the number of buffered operations.
     */
    public int size() {
        return operations.size();
    }

    enum OperationType {
        SET,
        DELETE
    }

    private static final class Operation<V> {
        private final OperationType type;
        private final Cache<V> cache;
        private final String key;
        private final V value;

        Operation(OperationType type, Cache<V> cache, String key, V value) {
            this.type = type;
            this.cache = cache;
            this.key = key;
            this.value = value;
        }

        void apply() {
            switch (type) {
                case SET:
                    cache.set(key, value);
                    break;
                case DELETE:
                    cache.delete(key);
                    break;
                default:
                    throw new IllegalStateException("Unknown operation: " + type);
            }
        }
    }
}
