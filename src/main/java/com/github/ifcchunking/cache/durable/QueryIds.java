package com.github.ifcchunking.cache.durable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Deterministic ids for cached queries: {@code global_{sha256(query)}} for a global query, and
 * {@code {fileId}_{sha256(fileId, query)}} when the query is scoped to a file. Identical
 * {@code (query, fileId)} pairs map to the same slot, which makes {@code cacheQuery} idempotent.
 *
 * <p>The file id is part of the scoped digest, so a file named {@code global} never lands on a
 * global query's slot.
 */
public final class QueryIds {
    static final String GLOBAL_PREFIX = "global";

    private QueryIds() {
    }

    public static String of(String query, String fileId) {
        Objects.requireNonNull(query, "query cannot be null");
        if (fileId == null) {
            return GLOBAL_PREFIX + '_' + sha256Hex(query);
        }
        // length prefix keeps (fileId, query) splits unambiguous
        return fileId + '_' + sha256Hex(fileId.length() + ":" + fileId + "\n" + query);
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
