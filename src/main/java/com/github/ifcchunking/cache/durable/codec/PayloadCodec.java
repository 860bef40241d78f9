package com.github.ifcchunking.cache.durable.codec;

/**
 * Turns durable cache records into bytes and back.
 */
public interface PayloadCodec {

    /**
     * @throws PayloadCodecException if {@code value} cannot be encoded
     */
    byte[] encode(Object value);

    /**
     * @throws PayloadCodecException if {@code data} is not a valid encoding of {@code type}
     */
    <T> T decode(byte[] data, Class<T> type);

    /**
     * MIME type stored next to every encoded payload.
     */
    String contentType();
}
