package io.didacli.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.didacli.config.OAuthSettings;
import io.didacli.error.AuthException;
import io.didacli.error.NetworkException;
import io.didacli.error.ValidationException;
import io.didacli.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Authorization-code (with PKCE) and refresh-token grants against the
 * configured OAuth endpoints. Both endpoints must be HTTPS and the redirect
 * URI must point at the local machine.
 */
public final class OAuthClient implements TokenRefresher {
    public static final Duration TOKEN_TIMEOUT = Duration.ofSeconds(30);
    public static final Set<String> ALLOWED_REDIRECT_HOSTS = Set.of("localhost", "127.0.0.1", "::1");

    private static final Pattern[] SECRET_PATTERNS = {
            Pattern.compile("(?i)client_secret[=:]\\s*\\S+"),
            Pattern.compile("(?i)access_token[=:]\\s*\\S+"),
            Pattern.compile("(?i)refresh_token[=:]\\s*\\S+"),
            Pattern.compile("(?i)code[=:]\\s*\\S+")
    };
    private static final String[] SECRET_REPLACEMENTS = {
            "client_secret=[REDACTED]",
            "access_token=[REDACTED]",
            "refresh_token=[REDACTED]",
            "code=[REDACTED]"
    };

    private final OAuthSettings settings;
    private final HttpClient http;
    private final Clock clock;

    public OAuthClient(OAuthSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(TOKEN_TIMEOUT).build(), Clock.systemUTC());
    }

    OAuthClient(OAuthSettings settings, HttpClient http, Clock clock) {
        this.settings = settings;
        this.http = http;
        this.clock = clock;
    }

    public String authorizeUrl(String state, String codeChallenge) {
        requireHttps(settings.authorizeUrl(), "authorizeUrl");
        requireLoopbackRedirect(settings.redirectUri());
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", requireClientId());
        params.put("redirect_uri", settings.redirectUri());
        params.put("scope", settings.scope() == null ? "" : settings.scope());
        params.put("state", state);
        params.put("code_challenge", codeChallenge);
        params.put("code_challenge_method", Pkce.METHOD_S256);
        String base = settings.authorizeUrl();
        return base + (base.contains("?") ? "&" : "?") + formEncode(params);
    }

    public Credential exchangeCode(String code, String codeVerifier) {
        requireHttps(settings.tokenUrl(), "tokenUrl");
        requireLoopbackRedirect(settings.redirectUri());
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", settings.redirectUri());
        form.put("client_id", requireClientId());
        form.put("code_verifier", codeVerifier);
        if (settings.clientSecret() != null && !settings.clientSecret().isBlank()) {
            form.put("client_secret", settings.clientSecret());
        }
        return postTokenRequest(form, "Token exchange failed");
    }

    @Override
    public Credential refresh(String refreshToken) {
        requireHttps(settings.tokenUrl(), "tokenUrl");
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("client_id", requireClientId());
        if (settings.clientSecret() != null && !settings.clientSecret().isBlank()) {
            form.put("client_secret", settings.clientSecret());
        }
        return postTokenRequest(form, "Token refresh failed");
    }

    private Credential postTokenRequest(Map<String, String> form, String failurePrefix) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(settings.tokenUrl()))
                .timeout(TOKEN_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new NetworkException("Request timeout after " + TOKEN_TIMEOUT.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new NetworkException(sanitize("Network error: " + e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Token request interrupted", e);
        }
        int status = response.statusCode();
        String body = response.body() == null ? "" : response.body();
        if (status < 200 || status >= 300) {
            throw new AuthException(sanitize(failurePrefix + ": " + status + " " + body));
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new AuthException("Invalid token response: expected object", e);
        }
        return Credential.fromNode(node, "Invalid token response").normalized(clock.millis());
    }

    private String requireClientId() {
        if (!settings.canRefresh()) {
            throw new ValidationException("Missing OAuth config: set oauth.clientId in your config file.", "oauth.clientId");
        }
        return settings.clientId();
    }

    static void requireHttps(String url, String name) {
        URI uri = parse(url, name);
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            throw new ValidationException(name + " must use HTTPS: " + url, name);
        }
    }

    static void requireLoopbackRedirect(String redirectUri) {
        URI uri = parse(redirectUri, "redirectUri");
        if (!ALLOWED_REDIRECT_HOSTS.contains(hostOf(uri))) {
            throw new ValidationException(
                    "Invalid redirect_uri: " + redirectUri + ". Must be localhost or whitelisted.", "redirectUri");
        }
    }

    static String hostOf(URI uri) {
        String host = uri.getHost();
        if (host == null) {
            return "";
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    static String sanitize(String message) {
        String out = message == null ? "" : message;
        for (int i = 0; i < SECRET_PATTERNS.length; i++) {
            out = SECRET_PATTERNS[i].matcher(out).replaceAll(SECRET_REPLACEMENTS[i]);
        }
        return out;
    }

    private static URI parse(String url, String name) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Missing OAuth " + name, name);
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid " + name + ": " + url, name);
        }
    }

    private static String formEncode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
