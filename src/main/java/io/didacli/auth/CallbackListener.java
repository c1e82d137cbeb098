package io.didacli.auth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.didacli.error.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot local HTTP listener for the OAuth redirect. Only the redirect path
 * is served; the first request carrying a code and the expected state
 * resolves {@link #awaitCode}.
 */
public final class CallbackListener implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CallbackListener.class);

    private final HttpServer server;
    private final String callbackPath;
    private final String expectedState;
    private final CompletableFuture<String> code = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private CallbackListener(HttpServer server, String callbackPath, String expectedState) {
        this.server = server;
        this.callbackPath = callbackPath;
        this.expectedState = expectedState;
    }

    /**
     * Binds to the redirect URI's port. {@code listenHost} overrides the
     * interface taken from the redirect URI.
     */
    public static CallbackListener start(String redirectUri, String expectedState, String listenHost) throws IOException {
        OAuthClient.requireLoopbackRedirect(redirectUri);
        URI uri = URI.create(redirectUri);
        String host = listenHost != null && !listenHost.isBlank() ? listenHost : OAuthClient.hostOf(uri);
        if (host.isEmpty()) {
            host = "127.0.0.1";
        }
        int port = uri.getPort() < 0 ? 80 : uri.getPort();
        String path = uri.getPath() == null || uri.getPath().isEmpty() ? "/" : uri.getPath();

        HttpServer server = HttpServer.create(new InetSocketAddress(host, port), 0);
        CallbackListener listener = new CallbackListener(server, path, expectedState);
        server.createContext("/", listener::handle);
        server.setExecutor(null);
        server.start();
        log.debug("oauth callback listener bound to {}:{}{}", host, listener.port(), path);
        return listener;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public String awaitCode(Duration timeout) {
        try {
            return code.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AuthException("OAuth callback timeout", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException("Interrupted while waiting for OAuth callback", e);
        } catch (ExecutionException e) {
            throw new AuthException("OAuth callback failed", e.getCause());
        } finally {
            close();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            server.stop(0);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        URI requestUri = exchange.getRequestURI();
        if (!callbackPath.equals(requestUri.getPath())) {
            respond(exchange, 404, "Not Found");
            return;
        }
        Map<String, String> query = parseQuery(requestUri.getRawQuery());
        String received = query.get("code");
        if (received == null || received.isEmpty()) {
            respond(exchange, 400, "Missing code");
            return;
        }
        if (expectedState != null && !expectedState.isEmpty() && !expectedState.equals(query.get("state"))) {
            respond(exchange, 400, "State mismatch");
            return;
        }
        respond(exchange, 200, "Authorization received. You can close this window.");
        code.complete(received);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> out = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return out;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.putIfAbsent(
                    URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8)
            );
        }
        return out;
    }
}
