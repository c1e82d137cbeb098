package io.didacli.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.didacli.error.AuthException;

/**
 * OAuth token record as stored on disk, using the OAuth wire names.
 * {@code expiresIn} is seconds, {@code expiresAt} epoch milliseconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credential(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("scope") String scope,
        @JsonProperty("expires_in") Long expiresIn,
        @JsonProperty("expires_at") Long expiresAt
) {
    public static Credential ofAccessToken(String accessToken) {
        return new Credential(accessToken, null, null, null, null, null);
    }

    /**
     * Fills {@code expiresAt} from {@code expiresIn} when only the latter is
     * known. An {@code expiresIn} of zero means the token never expires.
     */
    public Credential normalized(long nowMs) {
        if (expiresAt != null || expiresIn == null || expiresIn == 0L) {
            return this;
        }
        return withExpiresAt(nowMs + expiresIn * 1000L);
    }

    public Credential withExpiresAt(Long value) {
        return new Credential(accessToken, refreshToken, tokenType, scope, expiresIn, value);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /**
     * Reads a credential from a parsed JSON tree. Numeric fields of the wrong
     * type are dropped; a missing or empty access token is rejected.
     */
    static Credential fromNode(JsonNode node, String label) {
        if (node == null || !node.isObject()) {
            throw new AuthException(label + ": not an object");
        }
        JsonNode access = node.get("access_token");
        if (access == null || !access.isTextual() || access.asText().isEmpty()) {
            throw new AuthException(label + ": missing or invalid access_token");
        }
        return new Credential(
                access.asText(),
                text(node, "refresh_token"),
                text(node, "token_type"),
                text(node, "scope"),
                number(node, "expires_in"),
                number(node, "expires_at")
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static Long number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }
}
