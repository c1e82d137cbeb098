package io.didacli.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.api.DidaClient;
import io.didacli.api.TaskDrafts;
import io.didacli.auth.CredentialProvider;
import io.didacli.auth.OAuthClient;
import io.didacli.auth.RefreshCoordinator;
import io.didacli.auth.TokenStore;
import io.didacli.cache.FetchOptions;
import io.didacli.cache.FetchResult;
import io.didacli.cache.Fetcher;
import io.didacli.cache.ResultCache;
import io.didacli.config.CliConfig;
import io.didacli.config.ConfigLoader;
import io.didacli.config.GlobalOptions;
import io.didacli.http.TransportClient;
import io.didacli.util.Jsons;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Everything one command invocation needs, built on first use: commands that
 * only touch the config file never require a token.
 */
final class CommandContext {
    static final String PROJECTS_KEY = "projects:list";
    static final String ALL_TASKS_KEY = "tasks:get-all:all";
    static final String STALE_WARNING = "Returned stale cache due to fetch error.";

    private final ConfigLoader loader;
    private final GlobalOptions options;
    private final TokenStore tokenStore;
    private final CopyOnWriteArrayList<String> warnings = new CopyOnWriteArrayList<>();

    private ConfigLoader.LoadedConfig loaded;
    private CliConfig config;
    private ResultCache cache;
    private DidaClient client;

    CommandContext(ConfigLoader loader, GlobalOptions options, TokenStore tokenStore) {
        this.loader = loader;
        this.options = options;
        this.tokenStore = tokenStore;
    }

    static String tasksKey(String projectId) {
        return "tasks:get-all:" + projectId;
    }

    ConfigLoader loader() {
        return loader;
    }

    GlobalOptions options() {
        return options;
    }

    TokenStore tokenStore() {
        return tokenStore;
    }

    ConfigLoader.LoadedConfig loaded() {
        if (loaded == null) {
            loaded = loader.load(options.configPath());
            warnings.addAll(loaded.warnings());
        }
        return loaded;
    }

    CliConfig config() {
        if (config == null) {
            config = CliConfig.resolve(loaded().file(), options);
        }
        return config;
    }

    ResultCache cache() {
        if (cache == null) {
            CliConfig c = config();
            cache = new ResultCache(c.cacheDir(), c.cacheTtlMs(), c.staleIfErrorMs());
        }
        return cache;
    }

    CredentialProvider credentials() {
        CliConfig c = config();
        return new CredentialProvider(
                c.token(),
                c.oauth(),
                tokenStore,
                RefreshCoordinator.processWide(),
                refreshToken -> new OAuthClient(c.oauth()).refresh(refreshToken)
        );
    }

    DidaClient client() {
        if (client == null) {
            CliConfig c = config();
            CredentialProvider.Resolved resolved = credentials().resolve();
            warnings.addAll(resolved.warnings());
            TransportClient transport = new TransportClient(
                    c.baseUrl(),
                    resolved.accessToken(),
                    Duration.ofMillis(c.timeoutMs()),
                    c.retries()
            );
            client = new DidaClient(transport);
        }
        return client;
    }

    TaskDrafts drafts() {
        CliConfig c = config();
        return new TaskDrafts(c.timezone(), c.requiredTags(), c.enableRequiredTags());
    }

    List<String> warnings() {
        return warnings;
    }

    /**
     * Cache-first read. {@code forceRefresh} goes to the origin and overwrites
     * the entry; a stale answer carries {@link #STALE_WARNING}.
     */
    CommandResult cachedRead(String key, long ttlMs, boolean forceRefresh, Fetcher fetcher) {
        if (forceRefresh) {
            JsonNode value = fetcher.fetch();
            cache().set(key, value, ttlMs);
            ObjectNode meta = Jsons.mapper().createObjectNode();
            ObjectNode cacheMeta = meta.putObject("cache");
            cacheMeta.put("source", "origin");
            cacheMeta.put("forced", true);
            return new CommandResult(value, List.of(), meta);
        }
        FetchResult result = cache().fetch(key, fetcher, FetchOptions.ttl(ttlMs));
        ObjectNode meta = Jsons.mapper().createObjectNode();
        ObjectNode cacheMeta = meta.putObject("cache");
        cacheMeta.put("source", result.source().name().toLowerCase(Locale.ROOT));
        cacheMeta.put("stale", result.stale());
        if (result.cachedAt() != null) {
            cacheMeta.put("cachedAt", result.cachedAt());
        }
        List<String> resultWarnings = result.stale() ? List.of(STALE_WARNING) : List.of();
        return new CommandResult(result.value(), resultWarnings, meta);
    }

    /** Like {@link #cachedRead} but keeps only the value; a stale warning is recorded on the context. */
    JsonNode cachedValue(String key, long ttlMs, boolean forceRefresh, Fetcher fetcher) {
        CommandResult result = cachedRead(key, ttlMs, forceRefresh, fetcher);
        for (String warning : result.warnings()) {
            warnings.addIfAbsent(warning);
        }
        return (JsonNode) result.data();
    }

    void invalidateProjects() {
        cache().invalidate(PROJECTS_KEY);
    }

    void invalidateTasks(String projectId) {
        cache().invalidate(PROJECTS_KEY);
        cache().invalidate(tasksKey(projectId));
    }
}
