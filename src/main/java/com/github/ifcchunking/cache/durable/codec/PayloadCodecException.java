package com.github.ifcchunking.cache.durable.codec;

/**
 * Thrown when a {@link PayloadCodec} cannot encode or decode a payload.
 */
public class PayloadCodecException extends RuntimeException {

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
