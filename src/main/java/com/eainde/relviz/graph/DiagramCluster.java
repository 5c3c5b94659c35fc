package com.eainde.relviz.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A nested container of the diagram.
 *
 * @param id       subgraph identifier ({@code cluster} + name)
 * @param name     the cluster object's name
 * @param attrs    rendering attributes
 * @param nodes    ids of the plain nodes directly contained
 * @param clusters clusters directly contained
 */
public record DiagramCluster(
        @JsonProperty("id")       String id,
        @JsonProperty("name")     String name,
        @JsonProperty("attrs")    Map<String, String> attrs,
        @JsonProperty("nodes")    List<String> nodes,
        @JsonProperty("clusters") List<DiagramCluster> clusters
) {}
