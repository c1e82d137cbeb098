package io.didacli.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One cached value as it is held in memory and written to disk.
 * {@code expiresAt} is always {@code cachedAt + ttl}.
 */
public record CacheEntry(
        String key,
        JsonNode value,
        long cachedAt,
        long expiresAt
) {
    static CacheEntry of(String key, JsonNode value, long nowMs, long ttlMs) {
        return new CacheEntry(key, value, nowMs, nowMs + ttlMs);
    }

    /** Strict: an entry expiring exactly at {@code nowMs} is still fresh. */
    public boolean isStale(long nowMs) {
        return nowMs > expiresAt;
    }
}
