package io.didacli.cache;

/**
 * Per-call overrides for {@link ResultCache#fetch}; a null field falls back to
 * the cache-wide setting.
 */
public record FetchOptions(
        Long ttlMs,
        Long staleIfErrorMs
) {
    private static final FetchOptions DEFAULTS = new FetchOptions(null, null);

    public static FetchOptions defaults() {
        return DEFAULTS;
    }

    public static FetchOptions ttl(long ttlMs) {
        return new FetchOptions(ttlMs, null);
    }
}
