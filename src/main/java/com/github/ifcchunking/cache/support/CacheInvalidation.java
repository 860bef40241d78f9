package com.github.ifcchunking.cache.support;

import com.github.ifcchunking.cache.api.Cache;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Bulk invalidation by key pattern.
 */
public final class CacheInvalidation {

    private CacheInvalidation() {
    }

    /**
     * Deletes every key containing a match for {@code glob}, where {@code *} matches any run of
     * characters and everything else is literal. {@code "query:*:file-7"} deletes
     * {@code query:summary:file-7} and {@code query:walls:file-7}.
     *
     * @return the number of entries deleted
     */
    public static int invalidatePattern(Cache<?> cache, String glob) {
        Objects.requireNonNull(glob, "glob cannot be null");
        return invalidatePattern(cache, globToPattern(glob));
    }

    /**
     * Deletes every key in which {@code pattern} finds a match.
     *
     * @return the number of entries deleted
     */
    public static int invalidatePattern(Cache<?> cache, Pattern pattern) {
        Objects.requireNonNull(cache, "cache cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");

        int invalidated = 0;
        for (String key : cache.keys()) {
            if (pattern.matcher(key).find() && cache.delete(key)) {
                invalidated++;
            }
        }
        return invalidated;
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(glob.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }
}
