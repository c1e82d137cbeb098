package io.didacli.config;

import java.nio.file.Path;

public record OAuthSettings(
        String clientId,
        String clientSecret,
        String authorizeUrl,
        String tokenUrl,
        String redirectUri,
        String listenHost,
        String scope,
        Path tokenPath,
        boolean openBrowser,
        long callbackTimeoutMs
) {
    public boolean canRefresh() {
        return clientId != null && !clientId.isBlank();
    }

    public boolean canLogin() {
        return canRefresh() && redirectUri != null && !redirectUri.isBlank();
    }
}
