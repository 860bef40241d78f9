package com.github.ifcchunking.cache.durable;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a durable cache read. Unlike the plain getters, which fold every failure into
 * "absent", a lookup tells a miss (nothing stored, or expired) apart from an error (the store or
 * codec failed).
 *
 * @param <T> record type
 */
public final class CacheLookup<T> {

    public enum Status {
        HIT,
        MISS,
        ERROR
    }

    private static final CacheLookup<?> MISS = new CacheLookup<>(Status.MISS, null, null);

    private final Status status;
    private final T value;
    private final Throwable error;

    private CacheLookup(Status status, T value, Throwable error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> CacheLookup<T> hit(T value) {
        return new CacheLookup<>(Status.HIT, Objects.requireNonNull(value, "value cannot be null"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> CacheLookup<T> miss() {
        return (CacheLookup<T>) MISS;
    }

    public static <T> CacheLookup<T> error(Throwable error) {
        return new CacheLookup<>(Status.ERROR, null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public Status status() {
        return status;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public boolean isMiss() {
        return status == Status.MISS;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /**
     * @throws IllegalStateException if this is not a hit
     */
    public T value() {
        if (status != Status.HIT) {
            throw new IllegalStateException("No value for lookup with status " + status);
        }
        return value;
    }

    /**
     * The failure behind an {@link Status#ERROR} lookup, empty otherwise.
     */
    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        switch (status) {
            case HIT:
                return "CacheLookup{HIT, " + value + '}';
            case ERROR:
                return "CacheLookup{ERROR, " + error + '}';
            default:
                return "CacheLookup{MISS}";
        }
    }
}
