package com.github.ifcchunking.cache.durable.store;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable payload held by a {@link BlobBucket}: opaque bytes plus string metadata such as
 * {@code Content-Type}.
 */
public final class Blob {
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CACHED_AT = "X-Cached-At";

    private final byte[] data;
    private final Map<String, String> metadata;

    public Blob(byte[] data, Map<String, String> metadata) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        this.data = data.clone();
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Blob of(byte[] data) {
        return new Blob(data, Collections.emptyMap());
    }

    /**
     * Returns a copy of the payload.
     */
    public byte[] data() {
        return data.clone();
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public String metadata(String name) {
        return metadata.get(name);
    }

    /**
     * Payload length in bytes. Metadata does not count.
     */
    public long size() {
        return data.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Blob)) {
            return false;
        }
        Blob other = (Blob) obj;
        return Arrays.equals(data, other.data) && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + metadata.hashCode();
    }

    @Override
    public String toString() {
        return "Blob{size=" + data.length + ", metadata=" + metadata + '}';
    }
}
