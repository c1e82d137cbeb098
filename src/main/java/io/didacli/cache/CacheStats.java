package io.didacli.cache;

public record CacheStats(
        String dir,
        int files,
        int memoryEntries,
        long ttlMs,
        long staleIfErrorMs
) {
}
