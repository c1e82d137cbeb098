package io.didacli.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.didacli.util.Futures;
import io.didacli.util.Hashing;
import io.didacli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Two-tier get-or-fetch cache: an in-process map in front of one JSON file per
 * key. Values are opaque JSON; the cache knows nothing about what it stores, so
 * callers pick the TTL for their key namespace.
 *
 * <p>Concurrent {@link #fetch} calls for the same key share a single origin
 * call. When the origin fails and a recently expired entry exists, that entry
 * is served marked stale instead of failing the caller.
 */
public final class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Path dir;
    private final long ttlMs;
    private final long staleIfErrorMs;
    private final Clock clock;
    private final Map<String, CacheEntry> memory = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<FetchResult>> inFlight = new ConcurrentHashMap<>();

    public ResultCache(Path dir, long ttlMs, long staleIfErrorMs) {
        this(dir, ttlMs, staleIfErrorMs, Clock.systemUTC());
    }

    ResultCache(Path dir, long ttlMs, long staleIfErrorMs, Clock clock) {
        this.dir = dir;
        this.ttlMs = ttlMs;
        this.staleIfErrorMs = staleIfErrorMs;
        this.clock = clock;
    }

    public CacheLookup get(String key) {
        long now = clock.millis();
        CacheEntry cached = memory.get(key);
        if (cached != null) {
            return new CacheLookup(cached, cached.isStale(now), CacheSource.MEMORY);
        }
        CacheEntry onDisk = readDisk(key);
        if (onDisk != null) {
            memory.put(key, onDisk);
            return new CacheLookup(onDisk, onDisk.isStale(now), CacheSource.DISK);
        }
        return CacheLookup.miss();
    }

    public void set(String key, JsonNode value) {
        set(key, value, null);
    }

    public void set(String key, JsonNode value, Long ttlOverrideMs) {
        long ttl = ttlOverrideMs == null ? ttlMs : ttlOverrideMs;
        CacheEntry entry = CacheEntry.of(key, value, clock.millis(), ttl);
        Path file = fileForKey(key);
        try {
            Files.createDirectories(dir);
            Files.writeString(file, Jsons.toCompactJson(entry), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write cache entry: " + key, e);
        }
        memory.put(key, entry);
    }

    public FetchResult fetch(String key, Fetcher fetcher) {
        return fetch(key, fetcher, FetchOptions.defaults());
    }

    public FetchResult fetch(String key, Fetcher fetcher, FetchOptions options) {
        FetchOptions opts = options == null ? FetchOptions.defaults() : options;
        long window = opts.staleIfErrorMs() == null ? staleIfErrorMs : opts.staleIfErrorMs();
        long startedAt = clock.millis();

        CacheLookup lookup = get(key);
        if (lookup.found() && !lookup.stale()) {
            return FetchResult.fromCache(lookup.entry());
        }

        CompletableFuture<FetchResult> pending = new CompletableFuture<>();
        CompletableFuture<FetchResult> running = inFlight.putIfAbsent(key, pending);
        if (running != null) {
            log.debug("cache fetch joined in-flight origin call: key={}", key);
            return Futures.joinUnwrapped(running);
        }

        try {
            JsonNode value = fetcher.fetch();
            set(key, value, opts.ttlMs());
            FetchResult result = FetchResult.fromOrigin(value);
            pending.complete(result);
            return result;
        } catch (RuntimeException e) {
            CacheEntry previous = lookup.entry();
            if (previous != null && startedAt - previous.expiresAt() <= window) {
                log.warn("origin fetch failed, serving stale cache: key={} error={}", key, e.getMessage());
                FetchResult result = FetchResult.staleAfterError(previous, e);
                pending.complete(result);
                return result;
            }
            pending.completeExceptionally(e);
            throw e;
        } catch (Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, pending);
            if (!pending.isDone()) {
                pending.completeExceptionally(new IllegalStateException("Origin fetch aborted: " + key));
            }
        }
    }

    public void invalidate(String key) {
        memory.remove(key);
        try {
            Files.delete(fileForKey(key));
        } catch (NoSuchFileException ignored) {
            // Nothing on disk for this key.
        } catch (IOException e) {
            throw new RuntimeException("Failed to invalidate cache entry: " + key, e);
        }
    }

    public void purge() {
        memory.clear();
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.comparingInt(Path::getNameCount).reversed()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (NoSuchFileException ignored) {
            // Removed concurrently.
        } catch (IOException e) {
            throw new RuntimeException("Failed to purge cache directory: " + dir, e);
        }
    }

    public CacheStats stats() {
        int files = 0;
        if (Files.isDirectory(dir)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path ignored : stream) {
                    files++;
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to list cache directory: " + dir, e);
            }
        }
        return new CacheStats(dir.toString(), files, memory.size(), ttlMs, staleIfErrorMs);
    }

    Path fileForKey(String key) {
        return dir.resolve(Hashing.sha1Hex(key) + ".json");
    }

    private CacheEntry readDisk(String key) {
        Path file = fileForKey(key);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(file.toFile());
            if (!isEntryShape(node)) {
                log.debug("ignoring malformed cache file: key={} file={}", key, file);
                return null;
            }
            if (!key.equals(node.get("key").asText())) {
                log.debug("ignoring cache file stored for another key: key={} file={}", key, file);
                return null;
            }
            return new CacheEntry(
                    key,
                    node.get("value"),
                    node.get("cachedAt").asLong(),
                    node.get("expiresAt").asLong()
            );
        } catch (IOException e) {
            log.debug("cache file unreadable, treating as miss: key={} file={}", key, file, e);
            return null;
        }
    }

    private static boolean isEntryShape(JsonNode node) {
        return node != null
                && node.isObject()
                && node.path("key").isTextual()
                && node.has("value")
                && node.path("cachedAt").isNumber()
                && node.path("expiresAt").isNumber();
    }
}
