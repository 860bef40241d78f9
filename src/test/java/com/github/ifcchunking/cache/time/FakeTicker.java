package com.github.ifcchunking.cache.time;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link Ticker} whose time only moves when a test advances it.
 *
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 * MemoryCache<String> cache = CacheBuilder.<String>newBuilder()
 *     .ticker(ticker)
 *     .ttl(10, TimeUnit.MINUTES)
 *     .build();
 *
 * cache.set("k", "v");
 * ticker.advance(11, TimeUnit.MINUTES);
 * assertNull(cache.get("k"));
 * }</pre>
 */
public class FakeTicker implements Ticker {

    private final AtomicLong nanos = new AtomicLong();

    /**
     * Advances the ticker. Negative durations are ignored.
     */
    public FakeTicker advance(long duration, TimeUnit unit) {
        return advance(unit.toNanos(duration));
    }

    public FakeTicker advance(long nanoseconds) {
        if (nanoseconds > 0) {
            nanos.addAndGet(nanoseconds);
        }
        return this;
    }

    @Override
    public long read() {
        return nanos.get();
    }

    @Override
    public String toString() {
        return "FakeTicker(" + nanos.get() + " ns)";
    }
}
