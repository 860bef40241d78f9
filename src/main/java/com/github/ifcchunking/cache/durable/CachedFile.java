package com.github.ifcchunking.cache.durable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * File metadata persisted by {@link DurableCacheManager#cacheFile}. Expiry is measured from
 * {@link #uploadDate()}, not from when the record was stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CachedFile {
    private final String id;
    private final String name;
    private final long size;
    private final String type;
    private final Instant uploadDate;
    private final Map<String, Object> metadata;
    private final String thumbnail;
    private final boolean cached;

    @JsonCreator
    public CachedFile(@JsonProperty("id") String id,
                      @JsonProperty("name") String name,
                      @JsonProperty("size") long size,
                      @JsonProperty("type") String type,
                      @JsonProperty("uploadDate") Instant uploadDate,
                      @JsonProperty("metadata") Map<String, Object> metadata,
                      @JsonProperty("thumbnail") String thumbnail,
                      @JsonProperty("cached") boolean cached) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.size = size;
        this.type = type;
        this.uploadDate = Objects.requireNonNull(uploadDate, "uploadDate cannot be null");
        this.metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.thumbnail = thumbnail;
        this.cached = cached;
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("size")
    public long size() {
        return size;
    }

    @JsonProperty("type")
    public String type() {
        return type;
    }

    @JsonProperty("uploadDate")
    public Instant uploadDate() {
        return uploadDate;
    }

    @JsonProperty("metadata")
    public Map<String, Object> metadata() {
        return metadata;
    }

    @JsonProperty("thumbnail")
    public String thumbnail() {
        return thumbnail;
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
        if (!(obj instanceof CachedFile)) {
            return false;
        }
        CachedFile other = (CachedFile) obj;
        return size == other.size
                && cached == other.cached
                && id.equals(other.id)
                && name.equals(other.name)
                && Objects.equals(type, other.type)
                && uploadDate.equals(other.uploadDate)
                && Objects.equals(metadata, other.metadata)
                && Objects.equals(thumbnail, other.thumbnail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, size, type, uploadDate, metadata, thumbnail, cached);
    }

    @Override
    public String toString() {
        return "CachedFile{id=" + id + ", name=" + name + ", size=" + size + ", uploadDate=" + uploadDate + '}';
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private long size;
        private String type;
        private Instant uploadDate;
        private Map<String, Object> metadata;
        private String thumbnail;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder size(long size) {
            if (size < 0) {
                throw new IllegalArgumentException("size cannot be negative: " + size);
            }
            this.size = size;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder uploadDate(Instant uploadDate) {
            this.uploadDate = uploadDate;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder thumbnail(String thumbnail) {
            this.thumbnail = thumbnail;
            return this;
        }

        public CachedFile build() {
            return new CachedFile(id, name, size, type, uploadDate, metadata, thumbnail, true);
        }
    }
}
