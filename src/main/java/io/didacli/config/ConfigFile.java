package io.didacli.config;

import java.util.List;

/**
 * Config file as written by users. Every field is optional; nested sections
 * take precedence over the equivalent flat keys.
 */
public record ConfigFile(
        String token,
        String baseUrl,
        String cacheDir,
        String timezone,
        String tokenPath,
        List<String> requiredTags,
        Boolean enableRequiredTags,
        Long cacheTtlSeconds,
        Long cacheStaleIfErrorSeconds,
        Long projectsCacheTtlSeconds,
        Long tasksCacheTtlSeconds,
        Long timeoutMs,
        Integer retries,
        OAuthSection oauth,
        TagsSection tags,
        CacheSection cache,
        HttpSection http
) {
    public static ConfigFile empty() {
        return new ConfigFile(null, null, null, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null);
    }

    public record OAuthSection(
            String clientId,
            String clientSecret,
            String authorizeUrl,
            String tokenUrl,
            String redirectUri,
            String listenHost,
            String scope,
            String tokenPath,
            Boolean openBrowser,
            Long callbackTimeoutMs
    ) {
    }

    public record TagsSection(
            List<String> requiredTags,
            Boolean enableRequiredTags
    ) {
    }

    public record CacheSection(
            String dir,
            Long ttlSeconds,
            Long staleIfErrorSeconds
    ) {
    }

    public record HttpSection(
            String baseUrl,
            Long timeoutMs,
            Integer retries
    ) {
    }
}
