package io.didacli.auth;

@FunctionalInterface
public interface TokenRefresher {
    Credential refresh(String refreshToken);
}
