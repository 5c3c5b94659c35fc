package com.eainde.relviz.model;

import java.util.List;
import java.util.Map;

/**
 * Resolved view of one name in a {@link FactModel}.
 *
 * @param name          the name
 * @param bases         direct bases in declaration order
 * @param directAttrs   attributes merged from the object facts of this name
 * @param linearization this name followed by all its ancestors, nearest first
 * @param attrs         effective attributes: direct attributes folded along the
 *                      linearization, nearer entries overriding farther ones
 */
public record Entity(
        String name,
        List<String> bases,
        Map<String, String> directAttrs,
        List<String> linearization,
        Map<String, String> attrs
) {

    public boolean isRoot() {
        return bases.isEmpty();
    }
}
