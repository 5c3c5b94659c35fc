package com.eainde.relviz.model;

import java.util.List;

/**
 * Generalization edges form a cycle, so no bases-first order exists.
 */
public class CyclicInheritanceException extends FactModelException {

    private final List<String> cycle;

    public CyclicInheritanceException(List<String> cycle) {
        super("Circular generalization: " + String.join(" is-a ", cycle) + " is-a " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /** Names on the cycle; each is a direct specialization of the next, the last of the first. */
    public List<String> getCycle() {
        return cycle;
    }
}
