package io.didacli.auth;

import io.didacli.util.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/** PKCE verifier/challenge pair (RFC 7636, S256). */
public record Pkce(String verifier, String challenge, String method) {
    public static final String METHOD_S256 = "S256";

    private static final SecureRandom RANDOM = new SecureRandom();

    public static Pkce create() {
        return create(RANDOM);
    }

    static Pkce create(SecureRandom random) {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String verifier = Hashing.base64Url(bytes);
        return new Pkce(verifier, challengeFor(verifier), METHOD_S256);
    }

    public static String challengeFor(String verifier) {
        return Hashing.base64Url(Hashing.sha256(verifier.getBytes(StandardCharsets.US_ASCII)));
    }

    public static String randomState() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Hashing.base64Url(bytes);
    }
}
