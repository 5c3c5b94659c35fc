package com.eainde.relviz.model;

import java.util.List;

/**
 * The declared base orders of an entity and its ancestors contradict each
 * other, so its ancestors cannot be put in a single order.
 */
public class InconsistentHierarchyException extends FactModelException {

    private final String entity;
    private final List<String> bases;

    public InconsistentHierarchyException(String entity, List<String> bases) {
        super("Cannot create a consistent linearization for " + entity
                + " with bases " + String.join(", ", bases));
        this.entity = entity;
        this.bases = List.copyOf(bases);
    }

    public String getEntity() { return entity; }
    public List<String> getBases() { return bases; }
}
