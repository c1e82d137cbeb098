package io.didacli.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Produces a fresh value from the origin. Failures are reported as unchecked
 * exceptions and reach every caller waiting on the same key unchanged.
 */
@FunctionalInterface
public interface Fetcher {
    JsonNode fetch();
}
