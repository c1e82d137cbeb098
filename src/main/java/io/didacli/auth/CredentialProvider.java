package io.didacli.auth;

import io.didacli.config.OAuthSettings;
import io.didacli.error.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the bearer token for a run. An explicit token wins; otherwise the
 * stored credential is used, refreshed first when it has expired and a
 * refresh is possible.
 */
public final class CredentialProvider {
    private static final Logger log = LoggerFactory.getLogger(CredentialProvider.class);

    private final String explicitToken;
    private final OAuthSettings oauth;
    private final TokenStore store;
    private final RefreshCoordinator coordinator;
    private final TokenRefresher refresher;

    public CredentialProvider(
            String explicitToken,
            OAuthSettings oauth,
            TokenStore store,
            RefreshCoordinator coordinator,
            TokenRefresher refresher
    ) {
        this.explicitToken = explicitToken;
        this.oauth = oauth;
        this.store = store;
        this.coordinator = coordinator;
        this.refresher = refresher;
    }

    public Resolved resolve() {
        if (explicitToken != null && !explicitToken.isEmpty()) {
            return new Resolved(explicitToken, Source.EXPLICIT, List.of());
        }
        Path tokenPath = oauth.tokenPath();
        Credential stored = loadStored(tokenPath)
                .orElseThrow(() -> new AuthException(
                        "No valid access token found. Provide --token or configure OAuth authentication."));
        if (!store.isExpired(stored)) {
            return new Resolved(stored.accessToken(), Source.TOKEN_FILE, List.of());
        }

        List<String> warnings = new ArrayList<>();
        if (stored.hasRefreshToken() && oauth.canRefresh() && refresher != null) {
            Credential refreshed = refreshAndSave(tokenPath, stored.refreshToken());
            log.info("access token refreshed: path={}", tokenPath);
            return new Resolved(refreshed.accessToken(), Source.REFRESHED, List.of());
        }
        String warning = "Access token has expired and cannot be refreshed; run 'dida auth login'.";
        log.warn("{} path={}", warning, tokenPath);
        warnings.add(warning);
        return new Resolved(stored.accessToken(), Source.TOKEN_FILE, warnings);
    }

    /** Forced refresh, regardless of expiry. */
    public Credential refresh() {
        Path tokenPath = oauth.tokenPath();
        Credential stored = loadStored(tokenPath).orElse(null);
        if (stored == null || !stored.hasRefreshToken()) {
            throw new AuthException("No refresh_token found. Please run 'dida auth login' first.");
        }
        if (refresher == null || !oauth.canRefresh()) {
            throw new AuthException("Missing OAuth config. Please set oauth.clientId in your config file.");
        }
        return refreshAndSave(tokenPath, stored.refreshToken());
    }

    private Credential refreshAndSave(Path tokenPath, String refreshToken) {
        return coordinator.withMutex(() -> {
            Credential refreshed = refresher.refresh(refreshToken);
            if (!refreshed.hasRefreshToken()) {
                // Keep the previous refresh token when the response omits one.
                refreshed = new Credential(refreshed.accessToken(), refreshToken, refreshed.tokenType(),
                        refreshed.scope(), refreshed.expiresIn(), refreshed.expiresAt());
            }
            try {
                return store.save(tokenPath, refreshed);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to save refreshed token to " + tokenPath, e);
            }
        });
    }

    private Optional<Credential> loadStored(Path tokenPath) {
        try {
            return store.load(tokenPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load token from " + tokenPath, e);
        }
    }

    public enum Source {
        EXPLICIT,
        TOKEN_FILE,
        REFRESHED
    }

    public record Resolved(String accessToken, Source source, List<String> warnings) {
    }
}
