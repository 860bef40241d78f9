package com.github.ifcchunking.cache.durable;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for a {@link DurableCacheManager}. Build with {@link #builder()}; every setting has a
 * default, so {@code DurableCacheConfig.builder().build()} is a complete configuration.
 */
public final class DurableCacheConfig {
    public static final String DEFAULT_NAMESPACE = "ifc-chunking-offline-data";
    public static final long DEFAULT_MAX_CACHE_SIZE = 50L * 1024 * 1024;
    public static final Duration DEFAULT_QUERY_MAX_AGE = Duration.ofDays(7);
    public static final Duration DEFAULT_FILE_MAX_AGE = Duration.ofDays(30);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofHours(6);
    public static final double DEFAULT_SIZE_HEADROOM_RATIO = 0.8;

    private final String namespace;
    private final long maxCacheSize;
    private final Duration queryMaxAge;
    private final Duration fileMaxAge;
    private final Duration cleanupInterval;
    private final double sizeHeadroomRatio;
    private final SizeEvictionScope sizeEvictionScope;

    private DurableCacheConfig(Builder builder) {
        this.namespace = builder.namespace;
        this.maxCacheSize = builder.maxCacheSize;
        this.queryMaxAge = builder.queryMaxAge;
        this.fileMaxAge = builder.fileMaxAge;
        this.cleanupInterval = builder.cleanupInterval;
        this.sizeHeadroomRatio = builder.sizeHeadroomRatio;
        this.sizeEvictionScope = builder.sizeEvictionScope;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DurableCacheConfig defaults() {
        return builder().build();
    }

    /**
     * Bucket name in the blob store and scheme of every record key.
     */
    public String namespace() {
        return namespace;
    }

    public long maxCacheSize() {
        return maxCacheSize;
    }

    public Duration queryMaxAge() {
        return queryMaxAge;
    }

    public Duration fileMaxAge() {
        return fileMaxAge;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    /**
     * Fraction of {@link #maxCacheSize()} the enforcer shrinks the cache to once it is over budget.
     */
    public double sizeHeadroomRatio() {
        return sizeHeadroomRatio;
    }

    /**
     * Size the enforcer shrinks to: {@code maxCacheSize * sizeHeadroomRatio}.
     */
    public long targetCacheSize() {
        return (long) (maxCacheSize * sizeHeadroomRatio);
    }

    public SizeEvictionScope sizeEvictionScope() {
        return sizeEvictionScope;
    }

    @Override
    public String toString() {
        return "DurableCacheConfig{namespace=" + namespace
                + ", maxCacheSize=" + maxCacheSize
                + ", queryMaxAge=" + queryMaxAge
                + ", fileMaxAge=" + fileMaxAge
                + ", cleanupInterval=" + cleanupInterval
                + ", sizeHeadroomRatio=" + sizeHeadroomRatio
                + ", sizeEvictionScope=" + sizeEvictionScope + '}';
    }

    public static final class Builder {
        private String namespace = DEFAULT_NAMESPACE;
        private long maxCacheSize = DEFAULT_MAX_CACHE_SIZE;
        private Duration queryMaxAge = DEFAULT_QUERY_MAX_AGE;
        private Duration fileMaxAge = DEFAULT_FILE_MAX_AGE;
        private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        private double sizeHeadroomRatio = DEFAULT_SIZE_HEADROOM_RATIO;
        private SizeEvictionScope sizeEvictionScope = SizeEvictionScope.QUERIES_ONLY;

        private Builder() {
        }

        public Builder namespace(String namespace) {
            Objects.requireNonNull(namespace, "namespace cannot be null");
            if (namespace.isBlank()) {
                throw new IllegalArgumentException("namespace cannot be blank");
            }
            this.namespace = namespace;
            return this;
        }

        public Builder maxCacheSize(long bytes) {
            if (bytes <= 0) {
                throw new IllegalArgumentException("maxCacheSize must be positive: " + bytes);
            }
            this.maxCacheSize = bytes;
            return this;
        }

        public Builder queryMaxAge(Duration age) {
            this.queryMaxAge = requirePositive(age, "queryMaxAge");
            return this;
        }

        public Builder fileMaxAge(Duration age) {
            this.fileMaxAge = requirePositive(age, "fileMaxAge");
            return this;
        }

        public Builder cleanupInterval(Duration interval) {
            this.cleanupInterval = requirePositive(interval, "cleanupInterval");
            return this;
        }

        public Builder sizeHeadroomRatio(double ratio) {
            if (!(ratio > 0.0 && ratio <= 1.0)) {
                throw new IllegalArgumentException("sizeHeadroomRatio must be in (0, 1]: " + ratio);
            }
            this.sizeHeadroomRatio = ratio;
            return this;
        }

        public Builder sizeEvictionScope(SizeEvictionScope scope) {
            this.sizeEvictionScope = Objects.requireNonNull(scope, "scope cannot be null");
            return this;
        }

        public DurableCacheConfig build() {
            return new DurableCacheConfig(this);
        }

        private static Duration requirePositive(Duration duration, String name) {
            Objects.requireNonNull(duration, name + " cannot be null");
            if (duration.isZero() || duration.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + duration);
            }
            return duration;
        }
    }
}
