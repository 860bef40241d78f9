package com.github.ifcchunking.cache.durable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A query result persisted by {@link DurableCacheManager#cacheQuery}. {@code results} is whatever
 * the caller stored; after a round trip through the codec it comes back in the codec's generic
 * form (maps, lists, strings and numbers for JSON).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CachedQuery {
    private final String id;
    private final String query;
    private final Object results;
    private final long timestamp;
    private final String fileId;
    private final boolean cached;

    @JsonCreator
    public CachedQuery(@JsonProperty("id") String id,
                       @JsonProperty("query") String query,
                       @JsonProperty("results") Object results,
                       @JsonProperty("timestamp") long timestamp,
                       @JsonProperty("fileId") String fileId,
                       @JsonProperty("cached") boolean cached) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.query = Objects.requireNonNull(query, "query cannot be null");
        this.results = results;
        this.timestamp = timestamp;
        this.fileId = fileId;
        this.cached = cached;
    }

    static CachedQuery of(String query, Object results, String fileId, long timestamp) {
        return new CachedQuery(QueryIds.of(query, fileId), query, results, timestamp, fileId, true);
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("query")
    public String query() {
        return query;
    }

    @JsonProperty("results")
    public Object results() {
        return results;
    }

    /**
     * Epoch millis at which the query was cached.
     */
    @JsonProperty("timestamp")
    public long timestamp() {
        return timestamp;
    }

    /**
     * Soft reference to the file the query ran against; {@code null} for global queries.
     */
    @JsonProperty("fileId")
    public String fileId() {
        return fileId;
    }

    @JsonProperty("cached")
    public boolean cached() {
        return cached;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CachedQuery)) {
            return false;
        }
        CachedQuery other = (CachedQuery) obj;
        return timestamp == other.timestamp
                && cached == other.cached
                && id.equals(other.id)
                && query.equals(other.query)
                && Objects.equals(results, other.results)
                && Objects.equals(fileId, other.fileId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, query, results, timestamp, fileId, cached);
    }

    @Override
    public String toString() {
        return "CachedQuery{id=" + id + ", query=" + query + ", timestamp=" + timestamp
                + (fileId != null ? ", fileId=" + fileId : "") + '}';
    }
}
