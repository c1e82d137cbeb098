package io.didacli.auth;

import io.didacli.config.OAuthSettings;
import io.didacli.error.AuthException;
import io.didacli.testing.MutableClock;
import io.didacli.testing.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class CredentialProviderTest {
    private Path root;
    private Path tokenPath;
    private MutableClock clock;
    private TokenStore store;
    private final List<String> refreshCalls = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("dida-cred-");
        tokenPath = root.resolve("token.json");
        clock = new MutableClock(1_700_000_000_000L);
        store = new TokenStore(clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        TestFiles.deleteRecursively(root);
    }

    @Test
    void explicitTokenWinsWithoutTouchingDisk() {
        CredentialProvider provider = provider("explicit", "client", refresher("unused"));
        CredentialProvider.Resolved resolved = provider.resolve();

        Assertions.assertEquals("explicit", resolved.accessToken());
        Assertions.assertEquals(CredentialProvider.Source.EXPLICIT, resolved.source());
        Assertions.assertTrue(refreshCalls.isEmpty());
    }

    @Test
    void missingTokenFileIsAnAuthError() {
        AuthException error = Assertions.assertThrows(AuthException.class,
                () -> provider(null, "client", refresher("x")).resolve());
        Assertions.assertTrue(error.getMessage().startsWith("No valid access token found"));
    }

    @Test
    void validStoredTokenIsUsedAsIs() throws Exception {
        store.save(tokenPath, new Credential("stored", "r1", "Bearer", null, 3600L, null));

        CredentialProvider.Resolved resolved = provider(null, "client", refresher("new")).resolve();
        Assertions.assertEquals("stored", resolved.accessToken());
        Assertions.assertEquals(CredentialProvider.Source.TOKEN_FILE, resolved.source());
        Assertions.assertTrue(refreshCalls.isEmpty());
    }

    @Test
    void expiredTokenIsRefreshedAndPersisted() throws Exception {
        store.save(tokenPath, new Credential("old", "r1", "Bearer", null, 3600L, null));
        clock.advance(3_600_000L);

        CredentialProvider.Resolved resolved = provider(null, "client", refresher("new")).resolve();

        Assertions.assertEquals("new", resolved.accessToken());
        Assertions.assertEquals(CredentialProvider.Source.REFRESHED, resolved.source());
        Assertions.assertEquals(List.of("r1"), refreshCalls);
        Credential persisted = store.load(tokenPath).orElseThrow();
        Assertions.assertEquals("new", persisted.accessToken());
        Assertions.assertEquals("r1", persisted.refreshToken());
        Assertions.assertEquals(clock.millis() + 7_200_000L, persisted.expiresAt());
    }

    @Test
    void expiredTokenWithoutOAuthConfigIsUsedWithWarning() throws Exception {
        store.save(tokenPath, new Credential("old", "r1", null, null, 60L, null));
        clock.advance(60_000L);

        CredentialProvider.Resolved resolved = provider(null, null, refresher("new")).resolve();

        Assertions.assertEquals("old", resolved.accessToken());
        Assertions.assertEquals(1, resolved.warnings().size());
        Assertions.assertTrue(resolved.warnings().get(0).contains("expired"));
        Assertions.assertTrue(refreshCalls.isEmpty());
    }

    @Test
    void forcedRefreshNeedsStoredRefreshToken() throws Exception {
        store.save(tokenPath, Credential.ofAccessToken("only-access"));
        AuthException error = Assertions.assertThrows(AuthException.class,
                () -> provider(null, "client", refresher("new")).refresh());
        Assertions.assertTrue(error.getMessage().startsWith("No refresh_token found"));
    }

    @Test
    void forcedRefreshNeedsClientId() throws Exception {
        store.save(tokenPath, new Credential("a", "r1", null, null, null, null));
        AuthException error = Assertions.assertThrows(AuthException.class,
                () -> provider(null, " ", refresher("new")).refresh());
        Assertions.assertTrue(error.getMessage().startsWith("Missing OAuth config"));
    }

    @Test
    void forcedRefreshKeepsRotatedRefreshToken() throws Exception {
        store.save(tokenPath, new Credential("a", "r1", null, null, null, null));
        TokenRefresher rotating = refreshToken -> {
            refreshCalls.add(refreshToken);
            return new Credential("a2", "r2", "Bearer", null, 0L, null);
        };

        Credential refreshed = provider(null, "client", rotating).refresh();

        Assertions.assertEquals("r2", refreshed.refreshToken());
        Assertions.assertNull(refreshed.expiresAt());
        Assertions.assertEquals("r2", store.load(tokenPath).orElseThrow().refreshToken());
    }

    private TokenRefresher refresher(String newAccessToken) {
        return refreshToken -> {
            refreshCalls.add(refreshToken);
            return new Credential(newAccessToken, null, "Bearer", null, 7200L, null);
        };
    }

    private CredentialProvider provider(String explicit, String clientId, TokenRefresher refresher) {
        OAuthSettings oauth = new OAuthSettings(clientId, null, "https://dida365.com/oauth/authorize",
                "https://dida365.com/oauth/token", "http://localhost:8080/callback", "127.0.0.1",
                "tasks:read tasks:write", tokenPath, false, 1_000L);
        return new CredentialProvider(explicit, oauth, store, new RefreshCoordinator(), refresher);
    }
}
