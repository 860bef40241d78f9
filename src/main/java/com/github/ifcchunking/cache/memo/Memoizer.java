package com.github.ifcchunking.cache.memo;

import com.github.ifcchunking.cache.api.Cache;
import com.github.ifcchunking.cache.builder.CacheBuilder;
import com.github.ifcchunking.cache.impl.JsonSizer;
import com.github.ifcchunking.cache.impl.MemoryCache;
import com.github.ifcchunking.cache.model.CacheConfig;
import com.github.ifcchunking.cache.time.Ticker;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wraps functions so their results are served from a {@link Cache}.
 *
 * <p>Multi-argument functions are memoized by passing the arguments as one value (a list or a small
 * value class); the default key is the JSON form of that value.
 *
 * <pre>{@code
 * MemoryCache<Summary> cache = CacheBuilder.<Summary>newBuilder().preset(CachePreset.API).build();
 * Function<String, Summary> summarize = Memoizer.memoize(this::summarizeFile, cache);
 *
 * Function<String, CompletableFuture<Answer>> ask = Memoizer.cacheAsync(
 *     client::submitQuery,
 *     answers,
 *     AsyncCacheOptions.<String>builder().cacheErrors(true).build());
 * }</pre>
 */
public final class Memoizer {
    private static final Logger LOGGER = Logger.getLogger("com.github.ifcchunking.cache.Cache");

    private Memoizer() {
    }

    /**
     * Same as {@link #memoize(Function, Cache, Function)} with {@link KeyGenerators#json()} keys.
     */
    public static <T, R> Function<T, R> memoize(Function<T, R> fn, Cache<R> cache) {
        return memoize(fn, cache, KeyGenerators.json());
    }

    /**
     * Returns a function that looks up {@code keyGenerator(argument)} in {@code cache} and only calls
     * {@code fn} on a miss, storing its result.
     *
     * <p>Exceptions thrown by {@code fn} reach the caller unchanged and nothing is cached for that
     * call. A {@code null} result is returned but not cached, so the next call computes again.
     */
    public static <T, R> Function<T, R> memoize(Function<T, R> fn, Cache<R> cache,
                                                Function<? super T, String> keyGenerator) {
        Objects.requireNonNull(fn, "fn cannot be null");
        Objects.requireNonNull(cache, "cache cannot be null");
        Objects.requireNonNull(keyGenerator, "keyGenerator cannot be null");

        return argument -> {
            String key = keyGenerator.apply(argument);
            R cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
            R result = fn.apply(argument);
            if (result != null) {
                cache.set(key, result);
            }
            return result;
        };
    }

    /**
     * Same as {@link #cacheAsync(Function, Cache, AsyncCacheOptions)} with default options.
     */
    public static <T, R> Function<T, CompletableFuture<R>> cacheAsync(
            Function<T, CompletableFuture<R>> fn, Cache<R> cache) {
        return cacheAsync(fn, cache, AsyncCacheOptions.defaults());
    }

    /**
     * Returns an asynchronous function that serves completed results from {@code cache}.
     *
     * <p>On a miss {@code fn} is invoked and its successful result stored. When
     * {@link AsyncCacheOptions#cacheErrors()} is on, a failure is stored in a separate error cache
     * owned by the returned function, with the byte budget of {@code cache} (never less than one
     * {@link JsonSizer#FALLBACK_SIZE} error) and a TTL of
     * {@link AsyncCacheOptions#errorTtl()}. Until that shorter TTL lapses, calls with the same key
     * fail with the remembered error without invoking {@code fn}; afterwards the call is retried.
     * A later success clears the remembered error.
     */
    public static <T, R> Function<T, CompletableFuture<R>> cacheAsync(
            Function<T, CompletableFuture<R>> fn, Cache<R> cache, AsyncCacheOptions<? super T> options) {
        Objects.requireNonNull(fn, "fn cannot be null");
        Objects.requireNonNull(cache, "cache cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        Function<? super T, String> keyGenerator = options.keyGenerator();
        MemoryCache<Throwable> errorCache = options.cacheErrors() ? newErrorCache(cache, options) : null;

        return argument -> {
            String key = keyGenerator.apply(argument);

            R cached = cache.get(key);
            if (cached != null) {
                return CompletableFuture.completedFuture(cached);
            }
            if (errorCache != null) {
                Throwable failure = errorCache.get(key);
                if (failure != null) {
                    return CompletableFuture.failedFuture(failure);
                }
            }

            CompletableFuture<R> future;
            try {
                future = Objects.requireNonNull(fn.apply(argument), "fn returned a null future");
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }

            return future.whenComplete((result, error) -> {
                if (error == null) {
                    if (result != null) {
                        cache.set(key, result);
                    }
                    if (errorCache != null) {
                        errorCache.delete(key);
                    }
                } else if (errorCache != null) {
                    Throwable cause = unwrap(error);
                    errorCache.set(key, cause);
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.fine("Remembering failure for key=" + key + " for " + options.errorTtl()
                                + ": " + cause);
                    }
                }
            });
        };
    }

    private static MemoryCache<Throwable> newErrorCache(Cache<?> cache, AsyncCacheOptions<?> options) {
        Ticker ticker = options.errorTicker();
        if (ticker == null) {
            ticker = cache instanceof MemoryCache ? ((MemoryCache<?>) cache).ticker() : Ticker.systemTicker();
        }
        // every error is sized FALLBACK_SIZE, so the budget must hold at least one
        CacheConfig valueConfig = cache.config();
        long maxSize = Math.max(valueConfig.maxSize(), JsonSizer.FALLBACK_SIZE);
        return CacheBuilder.<Throwable>newBuilder()
                .config(new CacheConfig(options.errorTtl(), maxSize, valueConfig.policy()))
                .ticker(ticker)
                .sizer(error -> JsonSizer.FALLBACK_SIZE)
                .build();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
