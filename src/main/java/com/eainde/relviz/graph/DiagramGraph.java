package com.eainde.relviz.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Fully styled graph description handed to the layout engine: a directed,
 * non-strict graph with top-level nodes and edges and a forest of clusters.
 *
 * @param nodes    plain nodes, in declaration order
 * @param edges    edges, in relation order
 * @param clusters top-level clusters, parents before children
 */
public record DiagramGraph(
        @JsonProperty("nodes")    List<DiagramNode> nodes,
        @JsonProperty("edges")    List<DiagramEdge> edges,
        @JsonProperty("clusters") List<DiagramCluster> clusters
) {

    public DiagramGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        clusters = List.copyOf(clusters);
    }
}
