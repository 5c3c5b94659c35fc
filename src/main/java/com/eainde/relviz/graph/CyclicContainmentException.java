package com.eainde.relviz.graph;

import java.util.List;

/**
 * Clusters contain each other in a circle.
 */
public class CyclicContainmentException extends GraphException {

    private final List<String> cycle;

    public CyclicContainmentException(List<String> cycle) {
        super("Circular containment: " + String.join(" in ", cycle) + " in " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /** Cluster names in containment order; the last one is inside the first. */
    public List<String> getCycle() {
        return cycle;
    }
}
