package com.dosify.node.cache;

import java.time.Instant;

/**
 * A cached value with its expiry.
 *
 * @param key       logical key, unique within the cache's keyspace prefix
 * @param value     the stored representation (native scalar or JSON text)
 * @param expiresAt absolute expiry, or null when the entry lives until invalidated
 */
public record CacheEntry(String key, Object value, Instant expiresAt) {

    /**
     * An entry is expired once {@code now} reaches its expiry instant.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
