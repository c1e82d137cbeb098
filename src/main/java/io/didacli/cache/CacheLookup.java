package io.didacli.cache;

public record CacheLookup(
        CacheEntry entry,
        boolean stale,
        CacheSource source
) {
    static CacheLookup miss() {
        return new CacheLookup(null, false, CacheSource.NONE);
    }

    public boolean found() {
        return entry != null;
    }
}
