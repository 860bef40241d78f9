package com.github.ifcchunking.cache.durable.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON payloads through Jackson. Instants are written as ISO-8601 strings and unknown properties
 * are ignored on read, so records written by a newer version still load.
 */
public class JacksonPayloadCodec implements PayloadCodec {
    public static final String APPLICATION_JSON = "application/json";

    private final ObjectMapper mapper;

    public JacksonPayloadCodec() {
        this(defaultMapper());
    }

    public JacksonPayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new PayloadCodecException("Cannot encode " + describe(value), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        Objects.requireNonNull(data, "data cannot be null");
        try {
            return mapper.readValue(data, type);
        } catch (IOException e) {
            throw new PayloadCodecException("Cannot decode " + data.length + " bytes as " + type.getSimpleName(), e);
        }
    }

    @Override
    public String contentType() {
        return APPLICATION_JSON;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
