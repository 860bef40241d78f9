package com.github.ifcchunking.cache.durable;

import com.github.ifcchunking.cache.durable.codec.PayloadCodec;
import com.github.ifcchunking.cache.durable.codec.PayloadCodecException;
import com.github.ifcchunking.cache.durable.store.Blob;
import com.github.ifcchunking.cache.durable.store.BlobBucket;
import com.github.ifcchunking.cache.durable.store.BlobStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists query results, file metadata and user preferences in a {@link BlobStore} so they
 * survive the process.
 *
 * <p>Every record is its own blob under {@code {namespace}://{domain}/{id}}, where the domain is
 * one of {@code queries}, {@code files}, {@code preferences} or {@code meta}. Queries expire
 * {@link DurableCacheConfig#queryMaxAge()} after they were cached, files
 * {@link DurableCacheConfig#fileMaxAge()} after their upload date; expiry is checked when records
 * are read and enforced by {@link #cleanupCache()}, which also keeps the total stored size under
 * {@link DurableCacheConfig#maxCacheSize()}.
 *
 * <p>Failures never reach the caller: a store or codec error is logged and the operation returns
 * {@code false}, an empty result or {@link DurableCacheStats#empty()}. The {@code lookup*} methods
 * return a {@link CacheLookup} for callers that need to tell a miss from a failure. Until
 * {@link #initialize()} succeeds, and after {@link #close()}, every operation returns its fallback.
 *
 * <p>Reads and writes run on the calling thread. Cleanup and size enforcement, whether scheduled
 * or called directly, are serialized on a single maintenance thread, so two passes never
 * interleave.
 *
 * <p>Logging: uses java.util.logging under the name {@code com.github.ifcchunking.cache.DurableCache}.
 */
public class DurableCacheManager implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger("com.github.ifcchunking.cache.DurableCache");

    static final String QUERIES = "queries";
    static final String FILES = "files";
    static final String PREFERENCES = "preferences";
    static final String META = "meta";
    static final String USER_PREFERENCES_ID = "user";
    static final String LAST_CLEANUP_ID = "lastCleanup";

    private final BlobStore store;
    private final PayloadCodec codec;
    private final DurableCacheConfig config;
    private final Clock clock;
    private final ScheduledExecutorService maintenance;
    private final boolean ownsMaintenance;

    private final Object lifecycleLock = new Object();
    private volatile ManagerState state = ManagerState.UNINITIALIZED;
    private volatile BlobBucket bucket;
    private ScheduledFuture<?> cleanupTask;

    /**
     * Creates a manager with its own daemon maintenance thread.
     */
    public DurableCacheManager(BlobStore store, PayloadCodec codec, DurableCacheConfig config, Clock clock) {
        this(store, codec, config, clock, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "durable-cache-maintenance");
            t.setDaemon(true);
            return t;
        }), true);
    }

    /**
     * Creates a manager that runs maintenance on {@code maintenance}. The executor must run one
     * task at a time; it is not shut down by {@link #close()}.
     */
    public DurableCacheManager(BlobStore store, PayloadCodec codec, DurableCacheConfig config, Clock clock,
                               ScheduledExecutorService maintenance) {
        this(store, codec, config, clock, maintenance, false);
    }

    private DurableCacheManager(BlobStore store, PayloadCodec codec, DurableCacheConfig config, Clock clock,
                                ScheduledExecutorService maintenance, boolean ownsMaintenance) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.maintenance = Objects.requireNonNull(maintenance, "maintenance cannot be null");
        this.ownsMaintenance = ownsMaintenance;
    }

    // ===== Lifecycle =====

    /**
     * Opens the namespace bucket and schedules periodic cleanup.
     *
     * @return {@code false} if the store is not supported here or cannot be opened; calling again
     *         after success returns {@code true} without reopening
     */
    public boolean initialize() {
        synchronized (lifecycleLock) {
            if (state == ManagerState.ACTIVE) {
                return true;
            }
            if (state == ManagerState.CLOSED) {
                LOGGER.warning("Cannot initialize a closed durable cache");
                return false;
            }
            if (!store.isSupported()) {
                LOGGER.warning("Durable cache not supported by " + store.getClass().getSimpleName());
                return false;
            }
            try {
                BlobBucket opened = await(store.open(config.namespace()));
                state = ManagerState.INITIALIZED;
                long intervalMillis = config.cleanupInterval().toMillis();
                cleanupTask = maintenance.scheduleAtFixedRate(
                        this::scheduledCleanup, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
                // operations see the bucket only once the manager is fully active
                bucket = opened;
                state = ManagerState.ACTIVE;
                LOGGER.info("Durable cache initialized: namespace=" + config.namespace()
                        + ", cleanupInterval=" + config.cleanupInterval());
                return true;
            } catch (RuntimeException e) {
                bucket = null;
                cleanupTask = null;
                state = ManagerState.UNINITIALIZED;
                LOGGER.log(Level.SEVERE, "Failed to initialize durable cache " + config.namespace(), e);
                return false;
            }
        }
    }

    public ManagerState state() {
        return state;
    }

    public DurableCacheConfig config() {
        return config;
    }

    /**
     * Cancels periodic cleanup and detaches from the store. Stored records are kept.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (state == ManagerState.CLOSED) {
                return;
            }
            state = ManagerState.CLOSED;
            bucket = null;
            if (cleanupTask != null) {
                cleanupTask.cancel(false);
                cleanupTask = null;
            }
            if (ownsMaintenance) {
                maintenance.shutdown();
            }
        }
    }

    // ===== Queries =====

    public boolean cacheQuery(String query, Object results) {
        return cacheQuery(query, results, null);
    }

    /**
     * Stores {@code results} for {@code (query, fileId)}, replacing any earlier result for the
     * same pair.
     *
     * @param fileId file the query ran against, or {@code null} for a global query
     */
    public boolean cacheQuery(String query, Object results, String fileId) {
        Objects.requireNonNull(query, "query cannot be null");
        BlobBucket b = bucket;
        if (b == null) {
            return false;
        }
        try {
            CachedQuery cached = CachedQuery.of(query, results, fileId, clock.millis());
            write(b, QUERIES, cached.id(), cached);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Query cached: " + cached.id());
            }
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to cache query", e);
            return false;
        }
    }

    public CacheLookup<CachedQuery> lookupQuery(String query) {
        return lookupQuery(query, null);
    }

    /**
     * Reads the result cached for {@code (query, fileId)}. Results older than the query max age
     * are a miss even if still stored.
     */
    public CacheLookup<CachedQuery> lookupQuery(String query, String fileId) {
        Objects.requireNonNull(query, "query cannot be null");
        return lookup(QUERIES, QueryIds.of(query, fileId), CachedQuery.class, this::isFreshQuery);
    }

    public Optional<CachedQuery> getCachedQuery(String query) {
        return lookupQuery(query).toOptional();
    }

    public Optional<CachedQuery> getCachedQuery(String query, String fileId) {
        return lookupQuery(query, fileId).toOptional();
    }

    /**
     * Returns every unexpired cached query, newest first. Expired records are skipped, not deleted.
     */
    public List<CachedQuery> getAllQueries() {
        BlobBucket b = bucket;
        if (b == null) {
            return List.of();
        }
        try {
            return records(readAll(b, QUERIES, CachedQuery.class), this::isFreshQuery,
                    Comparator.comparingLong(CachedQuery::timestamp).reversed());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to list cached queries", e);
            return List.of();
        }
    }

    // ===== Files =====

    /**
     * Stores file metadata under its id, replacing any earlier record for that id.
     */
    public boolean cacheFile(CachedFile file) {
        Objects.requireNonNull(file, "file cannot be null");
        BlobBucket b = bucket;
        if (b == null) {
            return false;
        }
        try {
            write(b, FILES, file.id(), file);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("File cached: " + file.id());
            }
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to cache file " + file.id(), e);
            return false;
        }
    }

    /**
     * Reads the file record for {@code fileId}. Records whose upload date is older than the file
     * max age are a miss.
     */
    public CacheLookup<CachedFile> lookupFile(String fileId) {
        Objects.requireNonNull(fileId, "fileId cannot be null");
        return lookup(FILES, fileId, CachedFile.class, this::isFreshFile);
    }

    public Optional<CachedFile> getCachedFile(String fileId) {
        return lookupFile(fileId).toOptional();
    }

    /**
     * Returns every unexpired cached file, most recently uploaded first.
     */
    public List<CachedFile> getAllFiles() {
        BlobBucket b = bucket;
        if (b == null) {
            return List.of();
        }
        try {
            return records(readAll(b, FILES, CachedFile.class), this::isFreshFile,
                    Comparator.comparing(CachedFile::uploadDate).reversed());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to list cached files", e);
            return List.of();
        }
    }

    // ===== Preferences =====

    /**
     * Replaces the stored user preferences. Preferences never expire and are never size-evicted.
     */
    public boolean storeUserPreferences(Object preferences) {
        Objects.requireNonNull(preferences, "preferences cannot be null");
        BlobBucket b = bucket;
        if (b == null) {
            return false;
        }
        try {
            write(b, PREFERENCES, USER_PREFERENCES_ID, preferences);
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to store user preferences", e);
            return false;
        }
    }

    public <T> CacheLookup<T> lookupPreferences(Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return lookup(PREFERENCES, USER_PREFERENCES_ID, type, value -> true);
    }

    public <T> Optional<T> getUserPreferences(Class<T> type) {
        return lookupPreferences(type).toOptional();
    }

    /**
     * Returns the stored preferences in the codec's generic form.
     */
    public Optional<Object> getUserPreferences() {
        return getUserPreferences(Object.class);
    }

    // ===== Maintenance =====

    /**
     * Recomputes statistics from the store: the summed payload size of every record, the number of
     * unexpired queries and files, and the time of the last completed cleanup.
     */
    public DurableCacheStats getCacheStats() {
        BlobBucket b = bucket;
        if (b == null) {
            return DurableCacheStats.empty();
        }
        try {
            long totalSize = measure(b);
            int queryCount = countFresh(readAll(b, QUERIES, CachedQuery.class), this::isFreshQuery);
            int fileCount = countFresh(readAll(b, FILES, CachedFile.class), this::isFreshFile);
            long lastCleanup = read(b, META, LAST_CLEANUP_ID, Long.class).orElse(0L);
            return new DurableCacheStats(totalSize, queryCount, fileCount, lastCleanup);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to compute durable cache stats", e);
            return DurableCacheStats.empty();
        }
    }

    /**
     * Deletes expired queries and files, enforces the size budget and records the cleanup time.
     * Runs on the maintenance thread; the caller waits for it.
     *
     * @return {@code false} if any step failed
     */
    public boolean cleanupCache() {
        if (bucket == null) {
            return false;
        }
        Boolean result = runMaintenance(this::cleanupNow, "cleanup");
        return result != null && result;
    }

    /**
     * Brings the total stored size under budget if it is over: deletes the oldest queries (and,
     * with {@link SizeEvictionScope#QUERIES_THEN_FILES}, then the oldest files), re-measuring after
     * each deletion, until the size is at most {@link DurableCacheConfig#targetCacheSize()}. Runs on
     * the maintenance thread; the caller waits for it.
     *
     * @return the number of records deleted, 0 if under budget or on failure
     */
    public int enforceCacheSizeLimit() {
        BlobBucket b = bucket;
        if (b == null) {
            return 0;
        }
        Integer evicted = runMaintenance(() -> {
            try {
                return enforceSizeLimitNow(b);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Failed to enforce durable cache size limit", e);
                return 0;
            }
        }, "size enforcement");
        return evicted != null ? evicted : 0;
    }

    /**
     * Deletes every record in the namespace, preferences and cleanup marker included.
     */
    public boolean clearAllCache() {
        BlobBucket b = bucket;
        if (b == null) {
            return false;
        }
        try {
            List<String> keys = await(b.keys());
            CompletableFuture<?>[] deletes = keys.stream().map(b::delete).toArray(CompletableFuture[]::new);
            await(CompletableFuture.allOf(deletes));
            LOGGER.info("Cleared " + keys.size() + " durable cache records");
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to clear durable cache", e);
            return false;
        }
    }

    private void scheduledCleanup() {
        if (state == ManagerState.ACTIVE) {
            cleanupNow();
        }
    }

    private <T> T runMaintenance(Callable<T> task, String description) {
        Future<T> future;
        try {
            future = maintenance.submit(task);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.SEVERE, "Durable cache " + description + " rejected by maintenance executor", e);
            return null;
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while waiting for durable cache " + description);
            return null;
        } catch (ExecutionException e) {
            LOGGER.log(Level.SEVERE, "Durable cache " + description + " failed", e.getCause());
            return null;
        }
    }

    private boolean cleanupNow() {
        BlobBucket b = bucket;
        if (b == null) {
            return false;
        }
        try {
            LOGGER.fine("Starting durable cache cleanup");
            int expiredQueries = deleteExpired(b, readAll(b, QUERIES, CachedQuery.class), this::isFreshQuery);
            int expiredFiles = deleteExpired(b, readAll(b, FILES, CachedFile.class), this::isFreshFile);
            int evicted = enforceSizeLimitNow(b);
            write(b, META, LAST_CLEANUP_ID, clock.millis());
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Durable cache cleanup completed: expiredQueries=" + expiredQueries
                        + ", expiredFiles=" + expiredFiles + ", evicted=" + evicted);
            }
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Durable cache cleanup failed", e);
            return false;
        }
    }

    private int enforceSizeLimitNow(BlobBucket b) {
        long size = measure(b);
        if (size <= config.maxCacheSize()) {
            return 0;
        }
        long target = config.targetCacheSize();
        LOGGER.warning("Durable cache over budget: size=" + size + ", max=" + config.maxCacheSize()
                + ", target=" + target);

        int evicted = 0;
        List<Stored<CachedQuery>> queries = readAll(b, QUERIES, CachedQuery.class);
        queries.sort(Comparator.comparingLong((Stored<CachedQuery> s) -> s.record.timestamp())
                .thenComparing(s -> s.key));
        for (int i = 0; i < queries.size() && size > target; i++) {
            if (await(b.delete(queries.get(i).key))) {
                evicted++;
            }
            size = measure(b);
        }

        if (size > target && config.sizeEvictionScope() == SizeEvictionScope.QUERIES_THEN_FILES) {
            List<Stored<CachedFile>> files = readAll(b, FILES, CachedFile.class);
            files.sort(Comparator.comparing((Stored<CachedFile> s) -> s.record.uploadDate())
                    .thenComparing(s -> s.key));
            for (int i = 0; i < files.size() && size > target; i++) {
                if (await(b.delete(files.get(i).key))) {
                    evicted++;
                }
                size = measure(b);
            }
        }

        if (size > target) {
            LOGGER.warning("Durable cache still over target after evicting " + evicted
                    + " records: size=" + size + ", target=" + target);
        } else if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted " + evicted + " records for size, size=" + size);
        }
        return evicted;
    }

    // ===== Record access =====

    private <T> CacheLookup<T> lookup(String domain, String id, Class<T> type, Predicate<T> fresh) {
        BlobBucket b = bucket;
        if (b == null) {
            return CacheLookup.miss();
        }
        try {
            Optional<T> record = read(b, domain, id, type);
            if (record.isEmpty() || !fresh.test(record.get())) {
                return CacheLookup.miss();
            }
            return CacheLookup.hit(record.get());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to read " + key(domain, id), e);
            return CacheLookup.error(e);
        }
    }

    private void write(BlobBucket b, String domain, String id, Object value) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(Blob.CONTENT_TYPE, codec.contentType());
        metadata.put(Blob.CACHED_AT, clock.instant().toString());
        await(b.put(key(domain, id), new Blob(codec.encode(value), metadata)));
    }

    private <T> Optional<T> read(BlobBucket b, String domain, String id, Class<T> type) {
        Optional<Blob> blob = await(b.get(key(domain, id)));
        return blob.map(found -> codec.decode(found.data(), type));
    }

    /**
     * Reads every record of a domain. Records that fail to decode are logged and skipped.
     */
    private <T> List<Stored<T>> readAll(BlobBucket b, String domain, Class<T> type) {
        String prefix = key(domain, "");
        List<Stored<T>> records = new ArrayList<>();
        for (String key : await(b.keys())) {
            if (!key.startsWith(prefix)) {
                continue;
            }
            Optional<Blob> blob = await(b.get(key));
            if (blob.isEmpty()) {
                continue;
            }
            try {
                records.add(new Stored<>(key, codec.decode(blob.get().data(), type)));
            } catch (PayloadCodecException e) {
                LOGGER.log(Level.WARNING, "Skipping undecodable record " + key, e);
            }
        }
        return records;
    }

    private <T> int deleteExpired(BlobBucket b, List<Stored<T>> records, Predicate<T> fresh) {
        int deleted = 0;
        for (Stored<T> stored : records) {
            if (!fresh.test(stored.record) && await(b.delete(stored.key))) {
                deleted++;
            }
        }
        return deleted;
    }

    private long measure(BlobBucket b) {
        long total = 0;
        for (String key : await(b.keys())) {
            Optional<Blob> blob = await(b.get(key));
            if (blob.isPresent()) {
                total += blob.get().size();
            }
        }
        return total;
    }

    private boolean isFreshQuery(CachedQuery query) {
        return isFresh(query.timestamp(), config.queryMaxAge());
    }

    private boolean isFreshFile(CachedFile file) {
        return isFresh(file.uploadDate().toEpochMilli(), config.fileMaxAge());
    }

    private boolean isFresh(long timestampMillis, Duration maxAge) {
        return clock.millis() - timestampMillis < maxAge.toMillis();
    }

    String key(String domain, String id) {
        return config.namespace() + "://" + domain + "/" + id;
    }

    private static <T> List<T> records(List<Stored<T>> stored, Predicate<T> fresh, Comparator<T> order) {
        List<T> result = new ArrayList<>(stored.size());
        for (Stored<T> s : stored) {
            if (fresh.test(s.record)) {
                result.add(s.record);
            }
        }
        result.sort(order);
        return result;
    }

    private static <T> int countFresh(List<Stored<T>> stored, Predicate<T> fresh) {
        int count = 0;
        for (Stored<T> s : stored) {
            if (fresh.test(s.record)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Waits for a store operation, rethrowing its failure unwrapped.
     */
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static final class Stored<T> {
        final String key;
        final T record;

        Stored(String key, T record) {
            this.key = key;
            this.record = record;
        }
    }
}
