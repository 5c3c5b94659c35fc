package com.eainde.relviz.fact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for ordered attribute mappings.
 */
public final class Attributes {

    private Attributes() {
    }

    /** Immutable copy that keeps insertion order; null becomes empty. */
    public static Map<String, String> copyOf(Map<String, String> attrs) {
        if (attrs == null || attrs.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    /**
     * Merges mappings left to right; a later mapping overrides matching keys
     * of an earlier one.
     */
    @SafeVarargs
    public static Map<String, String> merged(Map<String, String>... layers) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map<String, String> layer : layers) {
            if (layer != null) {
                result.putAll(layer);
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
