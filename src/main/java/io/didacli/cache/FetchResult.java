package io.didacli.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of {@link ResultCache#fetch}. {@code error} is only set when an
 * origin failure was absorbed by a stale entry.
 */
public record FetchResult(
        JsonNode value,
        Source source,
        boolean stale,
        Long cachedAt,
        RuntimeException error
) {
    public enum Source {
        CACHE,
        ORIGIN
    }

    static FetchResult fromCache(CacheEntry entry) {
        return new FetchResult(entry.value(), Source.CACHE, false, entry.cachedAt(), null);
    }

    static FetchResult fromOrigin(JsonNode value) {
        return new FetchResult(value, Source.ORIGIN, false, null, null);
    }

    static FetchResult staleAfterError(CacheEntry entry, RuntimeException error) {
        return new FetchResult(entry.value(), Source.CACHE, true, entry.cachedAt(), error);
    }
}
