package com.github.ifcchunking.cache.memo;

import com.github.ifcchunking.cache.time.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Options for {@link Memoizer#cacheAsync(Function, com.github.ifcchunking.cache.api.Cache,
 * AsyncCacheOptions)}.
 *
 * <pre>{@code
 * AsyncCacheOptions<String> options = AsyncCacheOptions.<String>builder()
 *     .cacheErrors(true)
 *     .errorTtl(Duration.ofMinutes(1))
 *     .build();
 * }</pre>
 *
 * @param <T> the argument type of the wrapped function
 */
public final class AsyncCacheOptions<T> {
    /**
     * 5 minutes.
     */
    public static final Duration DEFAULT_ERROR_TTL = Duration.ofMinutes(5);

    private final Function<? super T, String> keyGenerator;
    private final boolean cacheErrors;
    private final Duration errorTtl;
    private final Ticker errorTicker;

    private AsyncCacheOptions(Builder<T> builder) {
        this.keyGenerator = builder.keyGenerator;
        this.cacheErrors = builder.cacheErrors;
        this.errorTtl = builder.errorTtl;
        this.errorTicker = builder.errorTicker;
    }

    /**
     * Returns the defaults: JSON keys, failures not cached.
     */
    public static <T> AsyncCacheOptions<T> defaults() {
        return AsyncCacheOptions.<T>builder().build();
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public Function<? super T, String> keyGenerator() {
        return keyGenerator;
    }

    public boolean cacheErrors() {
        return cacheErrors;
    }

    public Duration errorTtl() {
        return errorTtl;
    }

    /**
     * Time source of the error cache, or {@code null} to share the value cache's ticker when it has
     * one.
     */
    public Ticker errorTicker() {
        return errorTicker;
    }

    public static final class Builder<T> {
        private Function<? super T, String> keyGenerator = KeyGenerators.json();
        private boolean cacheErrors = false;
        private Duration errorTtl = DEFAULT_ERROR_TTL;
        private Ticker errorTicker;

        private Builder() {
        }

        public Builder<T> keyGenerator(Function<? super T, String> keyGenerator) {
            this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator cannot be null");
            return this;
        }

        /**
         * When enabled, a failure is remembered for {@link #errorTtl(Duration)} and replayed to
         * callers with the same key instead of invoking the function again.
         */
        public Builder<T> cacheErrors(boolean cacheErrors) {
            this.cacheErrors = cacheErrors;
            return this;
        }

        public Builder<T> errorTtl(Duration errorTtl) {
            Objects.requireNonNull(errorTtl, "errorTtl cannot be null");
            if (errorTtl.isNegative() || errorTtl.isZero()) {
                throw new IllegalArgumentException("error ttl must be positive: " + errorTtl);
            }
            this.errorTtl = errorTtl;
            return this;
        }

        public Builder<T> errorTicker(Ticker errorTicker) {
            this.errorTicker = Objects.requireNonNull(errorTicker, "errorTicker cannot be null");
            return this;
        }

        public AsyncCacheOptions<T> build() {
            return new AsyncCacheOptions<>(this);
        }
    }
}
