package com.github.ifcchunking.cache.time;

/**
 * A monotonic time source, in nanoseconds, used by the in-process cache for entry timestamps and
 * TTL checks.
 *
 * <p>Production code uses {@link #systemTicker()}. Tests substitute a ticker they can advance by
 * hand, so expiry boundaries can be checked without sleeping:
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 * MemoryCache<Integer> cache = CacheBuilder.<Integer>newBuilder()
 *     .ttl(Duration.ofSeconds(1))
 *     .ticker(ticker)
 *     .build();
 *
 * cache.set("k", 1);
 * ticker.advance(1001, TimeUnit.MILLISECONDS);
 * assertNull(cache.get("k"));
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since an arbitrary fixed origin. Values never go
     * backwards.
     */
    long read();

    /**
     * Returns the ticker backed by {@link System#nanoTime()}.
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
