package com.github.ifcchunking.cache.durable;

/**
 * Snapshot of the durable cache, recomputed from the store on every call.
 */
public final class DurableCacheStats {
    private static final DurableCacheStats EMPTY = new DurableCacheStats(0, 0, 0, 0);

    private final long totalSize;
    private final int queryCount;
    private final int fileCount;
    private final long lastCleanup;

    /**
     * @param totalSize sum of stored payload sizes in bytes, across every domain
     * @param queryCount live (unexpired) cached queries
     * @param fileCount live (unexpired) cached files
     * @param lastCleanup epoch millis of the last completed cleanup, 0 if none
     */
    public DurableCacheStats(long totalSize, int queryCount, int fileCount, long lastCleanup) {
        this.totalSize = totalSize;
        this.queryCount = queryCount;
        this.fileCount = fileCount;
        this.lastCleanup = lastCleanup;
    }

    public static DurableCacheStats empty() {
        return EMPTY;
    }

    public long totalSize() {
        return totalSize;
    }

    public int queryCount() {
        return queryCount;
    }

    public int fileCount() {
        return fileCount;
    }

    public long lastCleanup() {
        return lastCleanup;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof DurableCacheStats)) {
            return false;
        }
        DurableCacheStats other = (DurableCacheStats) obj;
        return totalSize == other.totalSize
                && queryCount == other.queryCount
                && fileCount == other.fileCount
                && lastCleanup == other.lastCleanup;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(totalSize);
        result = 31 * result + queryCount;
        result = 31 * result + fileCount;
        return 31 * result + Long.hashCode(lastCleanup);
    }

    @Override
    public String toString() {
        return String.format("DurableCacheStats{totalSize=%d, queries=%d, files=%d, lastCleanup=%d}",
                totalSize, queryCount, fileCount, lastCleanup);
    }
}
