package io.didacli.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.didacli.error.ApiException;
import io.didacli.error.NetworkException;
import io.didacli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Issues JSON requests against the API base URL.
 *
 * <p>Every attempt gets its own timeout. Client errors (4xx) fail on the first
 * attempt; server errors and transport failures are retried with exponential
 * backoff, at most {@value #HARD_RETRY_CAP} extra attempts whatever the
 * configured retry count.
 */
public final class TransportClient {
    private static final Logger log = LoggerFactory.getLogger(TransportClient.class);

    public static final int HARD_RETRY_CAP = 5;
    public static final long BASE_BACKOFF_MS = 200L;
    public static final long MAX_BACKOFF_MS = 5_000L;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_RETRIES = 2;

    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final int retries;
    private final HttpClient http;
    private final Sleeper sleeper;
    private final AtomicInteger attempts = new AtomicInteger();

    public TransportClient(String baseUrl, String token, Duration timeout, int retries) {
        this(baseUrl, token, timeout, retries, defaultHttpClient(), Sleeper.THREAD);
    }

    TransportClient(String baseUrl, String token, Duration timeout, int retries, HttpClient http, Sleeper sleeper) {
        this.baseUrl = baseUrl;
        this.token = token == null || token.isBlank() ? null : token;
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.retries = Math.max(0, retries);
        this.http = http;
        this.sleeper = sleeper;
    }

    public JsonNode get(String path) {
        return request(HttpMethod.GET, path, null);
    }

    public JsonNode post(String path, JsonNode body) {
        return request(HttpMethod.POST, path, body);
    }

    public JsonNode delete(String path) {
        return request(HttpMethod.DELETE, path, null);
    }

    public JsonNode request(HttpMethod method, String path, JsonNode body) {
        URI uri = resolve(path);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json");
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json");
            builder.method(method.name(), HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8));
        } else {
            builder.method(method.name(), HttpRequest.BodyPublishers.noBody());
        }
        HttpResponse<String> response = sendWithRetry(builder.build(), path);
        return parse(response, path);
    }

    /** Total attempts issued by this client, retries included. */
    public int attemptCount() {
        return attempts.get();
    }

    static long backoffMs(int attempt) {
        long factor = 1L << Math.min(attempt, 30);
        return Math.min(BASE_BACKOFF_MS * factor, MAX_BACKOFF_MS);
    }

    private HttpResponse<String> sendWithRetry(HttpRequest request, String path) {
        int maxRetries = Math.min(retries, HARD_RETRY_CAP);
        long startedNs = System.nanoTime();
        RuntimeException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            attempts.incrementAndGet();
            try {
                HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return response;
                }
                ApiException failure = new ApiException(reasonFor(status), status, path, response.body());
                if (status < 500) {
                    throw failure;
                }
                last = failure;
            } catch (HttpTimeoutException e) {
                last = new NetworkException("Request timed out after " + timeout.toMillis() + "ms: " + path, e);
            } catch (IOException e) {
                last = new NetworkException("Network request failed: " + path, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException("Request interrupted: " + path, e);
            }
            if (attempt < maxRetries) {
                long delayMs = backoffMs(attempt);
                log.debug("retrying {} {} after {}ms (attempt {}/{}): {}",
                        request.method(), path, delayMs, attempt + 1, maxRetries + 1, last.getMessage());
                pause(delayMs, path);
            }
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNs).toMillis();
        log.warn("{} {} failed after {} attempt(s) in {}ms: {}",
                request.method(), path, maxRetries + 1, elapsedMs, last.getMessage());
        throw last;
    }

    private void pause(long delayMs, String path) {
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Retry backoff interrupted: " + path, e);
        }
    }

    private JsonNode parse(HttpResponse<String> response, String path) {
        String text = response.body();
        if (text == null || text.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        int status = response.statusCode();
        String contentType = response.headers().firstValue("content-type").orElse("").toLowerCase(Locale.ROOT);
        if (contentType.contains("application/json")) {
            try {
                return Jsons.mapper().readTree(text);
            } catch (JsonProcessingException e) {
                throw new ApiException("Invalid JSON response from API", status, path, text);
            }
        }
        if (status >= 200 && status < 300) {
            return TextNode.valueOf(text);
        }
        throw new ApiException("Unexpected response", status, path, text);
    }

    private URI resolve(String path) {
        if (baseUrl == null || baseUrl.isBlank() || baseUrl.startsWith("TODO")) {
            throw new NetworkException("HTTP endpoint not configured. Set baseUrl in config.");
        }
        String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        String relative = path == null ? "" : path;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return URI.create(base).resolve(relative);
    }

    private static String reasonFor(int status) {
        if (status >= 500) {
            return "server error";
        }
        return switch (status) {
            case 400 -> "bad request";
            case 401 -> "unauthorized";
            case 403 -> "forbidden";
            case 404 -> "not found";
            case 429 -> "too many requests";
            default -> "request rejected";
        };
    }

    private static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
