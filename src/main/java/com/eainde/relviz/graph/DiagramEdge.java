package com.eainde.relviz.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One edge per relation fact; parallel edges between the same pair are kept
 * apart by {@code key}.
 *
 * @param key   position of the relation among the content's relation facts
 * @param tail  id of the source node or cluster
 * @param head  id of the target node or cluster
 * @param attrs rendering attributes, including {@code taillabel}/{@code headlabel}
 *              when the relation has end labels
 */
public record DiagramEdge(
        @JsonProperty("key")   int key,
        @JsonProperty("tail")  String tail,
        @JsonProperty("head")  String head,
        @JsonProperty("attrs") Map<String, String> attrs
) {}
