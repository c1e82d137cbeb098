package io.didacli.auth;

import io.didacli.config.OAuthSettings;
import io.didacli.error.AuthException;
import io.didacli.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;

/**
 * Interactive authorization-code login. Waits on the local redirect listener
 * unless headless; falls back to asking for the code on stdin when the
 * listener cannot be used.
 */
public final class LoginFlow {
    private static final Logger log = LoggerFactory.getLogger(LoginFlow.class);

    private final OAuthSettings settings;
    private final OAuthClient client;
    private final Browser browser;
    private final BufferedReader stdin;
    private final PrintStream prompt;

    public LoginFlow(OAuthSettings settings, OAuthClient client, Browser browser, BufferedReader stdin, PrintStream prompt) {
        this.settings = settings;
        this.client = client;
        this.browser = browser;
        this.stdin = stdin;
        this.prompt = prompt;
    }

    public Credential login(boolean headless, boolean openBrowser, Duration callbackTimeout) {
        if (!settings.canLogin()) {
            throw new ValidationException(
                    "Missing OAuth config. Please set oauth.clientId and oauth.redirectUri in your config file.",
                    "oauth");
        }
        OAuthClient.requireHttps(settings.authorizeUrl(), "authorizeUrl");
        OAuthClient.requireHttps(settings.tokenUrl(), "tokenUrl");
        OAuthClient.requireLoopbackRedirect(settings.redirectUri());

        Pkce pkce = Pkce.create();
        String state = Pkce.randomState();
        String url = client.authorizeUrl(state, pkce.challenge());

        String code = null;
        if (!headless) {
            code = awaitCallback(url, state, openBrowser, callbackTimeout);
        }
        if (code == null) {
            prompt.println(url);
            code = promptForCode();
        }
        if (code.isEmpty()) {
            throw new AuthException("No authorization code provided.");
        }
        return client.exchangeCode(code, pkce.verifier());
    }

    private String awaitCallback(String url, String state, boolean openBrowser, Duration timeout) {
        try (CallbackListener listener = CallbackListener.start(settings.redirectUri(), state, settings.listenHost())) {
            if (openBrowser) {
                browser.open(URI.create(url));
            } else {
                prompt.println(url);
            }
            return listener.awaitCode(timeout);
        } catch (IOException | AuthException e) {
            log.warn("callback login unavailable, falling back to manual code entry: {}", e.getMessage());
            return null;
        }
    }

    private String promptForCode() {
        prompt.print("Paste authorization code: ");
        prompt.flush();
        try {
            String line = stdin.readLine();
            return line == null ? "" : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read authorization code", e);
        }
    }

    @FunctionalInterface
    public interface Browser {
        void open(URI uri) throws IOException;

        /** Desktop browser when available; otherwise the URL is printed. */
        static Browser desktopOr(PrintStream fallback) {
            return uri -> {
                if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
                    Desktop.getDesktop().browse(uri);
                } else {
                    fallback.println(uri);
                }
            };
        }
    }
}
