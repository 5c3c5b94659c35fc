package com.eainde.relviz.graph;

import java.util.List;

/**
 * A cluster is directly contained in more than one other cluster.
 */
public class MultipleParentException extends GraphException {

    private final String cluster;
    private final List<String> parents;

    public MultipleParentException(String cluster, List<String> parents) {
        super("Cluster " + cluster + " in more than one parent: " + String.join(", ", parents));
        this.cluster = cluster;
        this.parents = List.copyOf(parents);
    }

    public String getCluster() { return cluster; }
    public List<String> getParents() { return parents; }
}
