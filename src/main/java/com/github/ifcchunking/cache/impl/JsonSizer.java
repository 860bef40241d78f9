package com.github.ifcchunking.cache.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.ifcchunking.cache.api.Sizer;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Sizer}: fixed widths for primitives, two bytes per character for text, and the
 * JSON-serialized length (two bytes per character) for anything else.
 *
 * <p>The serialized length is only an approximation. It overcounts shared substructures, and values
 * Jackson cannot serialize (cycles, objects without properties, opaque handles) get
 * {@link #FALLBACK_SIZE} instead of failing the write.
 */
public final class JsonSizer implements Sizer<Object> {
    private static final Logger LOGGER = Logger.getLogger("com.github.ifcchunking.cache.Cache");

    /**
     * Size assumed for values that cannot be serialized.
     */
    public static final long FALLBACK_SIZE = 1024;

    static final long BYTES_PER_CHAR = 2;
    static final long NUMBER_SIZE = 8;
    static final long BOOLEAN_SIZE = 4;

    private static final JsonSizer INSTANCE = new JsonSizer(new ObjectMapper());

    private final ObjectMapper mapper;

    public JsonSizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Returns a shared instance backed by a default {@link ObjectMapper}.
     */
    @SuppressWarnings("unchecked")
    public static <V> Sizer<V> instance() {
        return (Sizer<V>) INSTANCE;
    }

    @Override
    public long sizeOf(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() * BYTES_PER_CHAR;
        }
        if (value instanceof Number) {
            return NUMBER_SIZE;
        }
        if (value instanceof Boolean) {
            return BOOLEAN_SIZE;
        }
        if (value instanceof Character) {
            return BYTES_PER_CHAR;
        }
        if (value instanceof byte[]) {
            return ((byte[]) value).length;
        }
        try {
            return mapper.writeValueAsString(value).length() * BYTES_PER_CHAR;
        } catch (JsonProcessingException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Could not serialize " + value.getClass().getName()
                        + " for sizing, using fallback size " + FALLBACK_SIZE, e);
            }
            return FALLBACK_SIZE;
        }
    }
}
