package com.github.ifcchunking.cache.memo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.function.Function;

/**
 * Ready-made cache-key functions for {@link Memoizer}.
 */
public final class KeyGenerators {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private KeyGenerators() {
    }

    /**
     * Returns a key function that serializes the argument, wrapped in a one-element JSON array, so
     * structurally equal arguments produce the same key. {@code "q"} becomes {@code ["q"]} and a
     * {@code List.of("q", 3)} becomes {@code [["q",3]]}.
     *
     * <p>Arguments Jackson cannot serialize are a programming error and raise
     * {@link IllegalArgumentException} from the wrapped function.
     */
    public static <T> Function<T, String> json() {
        return argument -> {
            try {
                return MAPPER.writeValueAsString(Collections.singletonList(argument));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot derive a cache key from argument of type "
                        + (argument == null ? "null" : argument.getClass().getName()), e);
            }
        };
    }

    /**
     * Returns a key function that uses {@link String#valueOf(Object)}.
     */
    public static <T> Function<T, String> toStringKey() {
        return String::valueOf;
    }
}
