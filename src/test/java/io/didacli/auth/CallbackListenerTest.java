package io.didacli.auth;

import io.didacli.error.AuthException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

final class CallbackListenerTest {
    private final HttpClient http = HttpClient.newHttpClient();

    @Test
    void rejectsBadRequestsThenResolvesWithCode() throws Exception {
        try (CallbackListener listener = CallbackListener.start("http://127.0.0.1:0/callback", "st-1", null)) {
            String base = "http://127.0.0.1:" + listener.port();

            Assertions.assertEquals(404, get(base + "/other?code=x&state=st-1").statusCode());
            HttpResponse<String> missing = get(base + "/callback?state=st-1");
            Assertions.assertEquals(400, missing.statusCode());
            Assertions.assertEquals("Missing code", missing.body());
            HttpResponse<String> mismatch = get(base + "/callback?code=abc&state=wrong");
            Assertions.assertEquals(400, mismatch.statusCode());
            Assertions.assertEquals("State mismatch", mismatch.body());

            HttpResponse<String> ok = get(base + "/callback?code=auth%2Fcode&state=st-1");
            Assertions.assertEquals(200, ok.statusCode());

            Assertions.assertEquals("auth/code", listener.awaitCode(Duration.ofSeconds(5)));
        }
    }

    @Test
    void timesOutWithAuthException() throws Exception {
        try (CallbackListener listener = CallbackListener.start("http://localhost:0/cb", "st", "127.0.0.1")) {
            AuthException error = Assertions.assertThrows(AuthException.class,
                    () -> listener.awaitCode(Duration.ofMillis(50)));
            Assertions.assertEquals("OAuth callback timeout", error.getMessage());
        }
    }

    @Test
    void nonLoopbackRedirectIsRefusedBeforeBinding() {
        Assertions.assertThrows(RuntimeException.class,
                () -> CallbackListener.start("http://example.com:0/cb", "st", null));
    }

    @Test
    void parseQueryDecodesAndKeepsFirstValue() {
        Map<String, String> query = CallbackListener.parseQuery("code=a%20b&state=s&code=second&flag");
        Assertions.assertEquals("a b", query.get("code"));
        Assertions.assertEquals("s", query.get("state"));
        Assertions.assertEquals("", query.get("flag"));
        Assertions.assertTrue(CallbackListener.parseQuery(null).isEmpty());
    }

    private HttpResponse<String> get(String url) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(url)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }
}
