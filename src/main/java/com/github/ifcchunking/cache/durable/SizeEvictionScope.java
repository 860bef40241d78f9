package com.github.ifcchunking.cache.durable;

/**
 * Which records the size-budget enforcer may delete when the durable cache is over budget.
 * Preferences and the cleanup marker are never size-evicted.
 */
public enum SizeEvictionScope {
    /** Delete oldest cached queries only; files stay until they age out. */
    QUERIES_ONLY,
    /** Delete oldest cached queries first, then oldest cached files (by upload date). */
    QUERIES_THEN_FILES
}
