package io.didacli.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.didacli.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks secrets in config values before they are printed. Keys naming a
 * secret (token, client secret, password) are masked; file paths and URLs
 * that merely mention one are kept.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";

    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "credential"
    );
    private static final Set<String> SAFE_SUFFIXES = Set.of("path", "url", "uri", "dir", "ttlseconds");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(entry.getKey()) && !value.isContainerNode() && !value.isNull()) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && isBearerValue(input.asText(""))) {
            return TextNode.valueOf(MASK);
        }
        return input;
    }

    /** Masks a single value looked up under {@code dottedKey}. */
    public static JsonNode maskedValue(String dottedKey, JsonNode value) {
        if (value == null || value.isNull()) {
            return Jsons.mapper().nullNode();
        }
        String leaf = dottedKey == null ? "" : dottedKey.substring(dottedKey.lastIndexOf('.') + 1);
        if (isSensitiveKey(leaf) && !value.isContainerNode()) {
            return TextNode.valueOf(MASK);
        }
        return masked(value);
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        for (String suffix : SAFE_SUFFIXES) {
            if (key.endsWith(suffix)) {
                return false;
            }
        }
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBearerValue(String value) {
        return value.regionMatches(true, 0, "Bearer ", 0, 7) && value.length() > 7;
    }
}
