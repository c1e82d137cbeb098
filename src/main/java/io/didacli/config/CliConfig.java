package io.didacli.config;

import io.didacli.error.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * Effective, validated settings for one CLI invocation. Built from the config
 * file plus command-line overrides; numeric values outside their allowed range
 * fail fast with a {@link ValidationException}.
 */
public final class CliConfig {
    public static final String DEFAULT_BASE_URL = "https://api.dida365.com/open/v1/";
    public static final String DEFAULT_AUTHORIZE_URL = "https://dida365.com/oauth/authorize";
    public static final String DEFAULT_TOKEN_URL = "https://dida365.com/oauth/token";
    public static final String DEFAULT_TIMEZONE = "Asia/Shanghai";
    public static final List<String> DEFAULT_REQUIRED_TAGS = List.of("cli");
    public static final long DEFAULT_TIMEOUT_MS = 15_000L;
    public static final int DEFAULT_RETRIES = 3;
    public static final long DEFAULT_CACHE_TTL_SECONDS = 3_600L;
    public static final long DEFAULT_STALE_IF_ERROR_SECONDS = 86_400L;
    public static final long DEFAULT_PROJECTS_TTL_SECONDS = 604_800L;
    public static final long DEFAULT_TASKS_TTL_SECONDS = 600L;
    public static final long DEFAULT_CALLBACK_TIMEOUT_MS = 120_000L;

    public static final long MIN_TIMEOUT_MS = 1_000L;
    public static final long MAX_TIMEOUT_MS = 300_000L;
    public static final int MIN_RETRIES = 0;
    public static final int MAX_RETRIES = 10;
    public static final long MIN_TTL_SECONDS = 1L;
    public static final long MAX_TTL_SECONDS = 604_800L;

    private final String token;
    private final String baseUrl;
    private final String timezone;
    private final List<String> requiredTags;
    private final boolean enableRequiredTags;
    private final Path cacheDir;
    private final long cacheTtlSeconds;
    private final long staleIfErrorSeconds;
    private final long projectsCacheTtlSeconds;
    private final long tasksCacheTtlSeconds;
    private final long timeoutMs;
    private final int retries;
    private final OAuthSettings oauth;

    private CliConfig(
            String token,
            String baseUrl,
            String timezone,
            List<String> requiredTags,
            boolean enableRequiredTags,
            Path cacheDir,
            long cacheTtlSeconds,
            long staleIfErrorSeconds,
            long projectsCacheTtlSeconds,
            long tasksCacheTtlSeconds,
            long timeoutMs,
            int retries,
            OAuthSettings oauth
    ) {
        this.token = token;
        this.baseUrl = baseUrl;
        this.timezone = timezone;
        this.requiredTags = requiredTags;
        this.enableRequiredTags = enableRequiredTags;
        this.cacheDir = cacheDir;
        this.cacheTtlSeconds = cacheTtlSeconds;
        this.staleIfErrorSeconds = staleIfErrorSeconds;
        this.projectsCacheTtlSeconds = projectsCacheTtlSeconds;
        this.tasksCacheTtlSeconds = tasksCacheTtlSeconds;
        this.timeoutMs = timeoutMs;
        this.retries = retries;
        this.oauth = oauth;
    }

    public static CliConfig resolve(ConfigFile file, GlobalOptions options) {
        ConfigFile f = file == null ? ConfigFile.empty() : file;
        GlobalOptions o = options == null ? GlobalOptions.none() : options;
        ConfigFile.TagsSection tags = f.tags();
        ConfigFile.CacheSection cache = f.cache();
        ConfigFile.HttpSection http = f.http();
        ConfigFile.OAuthSection oauthFile = f.oauth();

        String token = firstNonNull(o.token(), f.token());
        if (token != null && token.isEmpty()) {
            throw new ValidationException("Invalid token: cannot be empty string", "token");
        }

        String timezone = firstNonNull(o.timezone(), f.timezone(), DEFAULT_TIMEZONE);
        validateTimezone(timezone);

        List<String> requiredTags = firstNonNull(
                tags == null ? null : tags.requiredTags(),
                f.requiredTags(),
                DEFAULT_REQUIRED_TAGS
        );
        Boolean enableRequiredTags = firstNonNull(
                tags == null ? null : tags.enableRequiredTags(),
                f.enableRequiredTags(),
                Boolean.TRUE
        );

        String cacheDirRaw = firstNonNull(o.cacheDir(), f.cacheDir(), cache == null ? null : cache.dir());
        Path cacheDir = cacheDirRaw == null || cacheDirRaw.isBlank()
                ? userHome().resolve(".cache").resolve("dida-cli")
                : Paths.get(cacheDirRaw);

        long cacheTtl = validateRange("cacheTtlSeconds",
                firstNonNull(cache == null ? null : cache.ttlSeconds(), f.cacheTtlSeconds()),
                MIN_TTL_SECONDS, MAX_TTL_SECONDS, DEFAULT_CACHE_TTL_SECONDS);
        long staleIfError = validateRange("cacheStaleIfErrorSeconds",
                firstNonNull(cache == null ? null : cache.staleIfErrorSeconds(), f.cacheStaleIfErrorSeconds()),
                MIN_TTL_SECONDS, MAX_TTL_SECONDS, DEFAULT_STALE_IF_ERROR_SECONDS);
        long projectsTtl = validateRange("projectsCacheTtlSeconds", f.projectsCacheTtlSeconds(),
                MIN_TTL_SECONDS, MAX_TTL_SECONDS, DEFAULT_PROJECTS_TTL_SECONDS);
        long tasksTtl = validateRange("tasksCacheTtlSeconds", f.tasksCacheTtlSeconds(),
                MIN_TTL_SECONDS, MAX_TTL_SECONDS, DEFAULT_TASKS_TTL_SECONDS);

        String baseUrl = normalizeBaseUrl(firstNonNull(http == null ? null : http.baseUrl(), f.baseUrl(), DEFAULT_BASE_URL));
        long timeoutMs = validateRange("timeoutMs",
                firstNonNull(http == null ? null : http.timeoutMs(), f.timeoutMs()),
                MIN_TIMEOUT_MS, MAX_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
        Integer retriesRaw = firstNonNull(http == null ? null : http.retries(), f.retries());
        int retries = (int) validateRange("retries", retriesRaw == null ? null : retriesRaw.longValue(),
                MIN_RETRIES, MAX_RETRIES, DEFAULT_RETRIES);

        return new CliConfig(
                token,
                baseUrl,
                timezone,
                List.copyOf(requiredTags),
                enableRequiredTags,
                cacheDir,
                cacheTtl,
                staleIfError,
                projectsTtl,
                tasksTtl,
                timeoutMs,
                retries,
                resolveOAuth(oauthFile, f.tokenPath())
        );
    }

    public static Path defaultTokenPath() {
        return userHome().resolve(".config").resolve("dida-cli").resolve("token.json");
    }

    static long validateRange(String name, Long value, long min, long max, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value < min || value > max) {
            throw new ValidationException(
                    "Invalid " + name + ": must be a number between " + min + " and " + max + ", got " + value,
                    name
            );
        }
        return value;
    }

    static String normalizeBaseUrl(String raw) {
        String value = raw.trim();
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ValidationException("Invalid baseUrl: \"" + raw + "\". Must be a valid HTTP/HTTPS URL.", "baseUrl");
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid baseUrl: \"" + raw + "\". Must be a valid HTTP/HTTPS URL.", "baseUrl");
        }
        return value.endsWith("/") ? value : value + "/";
    }

    private static OAuthSettings resolveOAuth(ConfigFile.OAuthSection section, String flatTokenPath) {
        ConfigFile.OAuthSection s = section == null
                ? new ConfigFile.OAuthSection(null, null, null, null, null, null, null, null, null, null)
                : section;
        String tokenPathRaw = firstNonNull(s.tokenPath(), flatTokenPath);
        Path tokenPath = tokenPathRaw == null || tokenPathRaw.isBlank() ? defaultTokenPath() : Paths.get(tokenPathRaw);
        long callbackTimeoutMs = s.callbackTimeoutMs() == null || s.callbackTimeoutMs() <= 0
                ? DEFAULT_CALLBACK_TIMEOUT_MS
                : s.callbackTimeoutMs();
        return new OAuthSettings(
                s.clientId(),
                s.clientSecret(),
                firstNonNull(s.authorizeUrl(), DEFAULT_AUTHORIZE_URL),
                firstNonNull(s.tokenUrl(), DEFAULT_TOKEN_URL),
                s.redirectUri(),
                s.listenHost(),
                s.scope(),
                tokenPath,
                s.openBrowser() == null || s.openBrowser(),
                callbackTimeoutMs
        );
    }

    private static void validateTimezone(String timezone) {
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone: " + timezone, "timezone");
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Path userHome() {
        return Paths.get(System.getProperty("user.home", "."));
    }

    public String token() {
        return token;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String timezone() {
        return timezone;
    }

    public List<String> requiredTags() {
        return requiredTags;
    }

    public boolean enableRequiredTags() {
        return enableRequiredTags;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    public long cacheTtlMs() {
        return cacheTtlSeconds * 1000L;
    }

    public long staleIfErrorMs() {
        return staleIfErrorSeconds * 1000L;
    }

    public long projectsCacheTtlMs() {
        return projectsCacheTtlSeconds * 1000L;
    }

    public long tasksCacheTtlMs() {
        return tasksCacheTtlSeconds * 1000L;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public int retries() {
        return retries;
    }

    public OAuthSettings oauth() {
        return oauth;
    }

    public Path tokenPath() {
        return oauth.tokenPath();
    }
}
