package io.didacli.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class TaskTags {
    private TaskTags() {
    }

    public static String normalize(String tag) {
        return tag == null ? "" : tag.trim().replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    /** Normalizes, drops empties and keeps the first occurrence of each tag. */
    public static List<String> dedupe(List<String> tags) {
        Set<String> seen = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                String normalized = normalize(tag);
                if (!normalized.isEmpty()) {
                    seen.add(normalized);
                }
            }
        }
        return new ArrayList<>(seen);
    }

    /** Required tags first (when enabled), then hints not already present. */
    public static List<String> merge(List<String> requiredTags, List<String> hints, boolean enableRequiredTags) {
        List<String> merged = enableRequiredTags ? dedupe(requiredTags) : new ArrayList<>();
        for (String hint : dedupe(hints)) {
            if (!merged.contains(hint)) {
                merged.add(hint);
            }
        }
        return merged;
    }
}
