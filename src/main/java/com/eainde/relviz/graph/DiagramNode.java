package com.eainde.relviz.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * @param id    node identifier, the object name
 * @param attrs rendering attributes
 */
public record DiagramNode(
        @JsonProperty("id")    String id,
        @JsonProperty("attrs") Map<String, String> attrs
) {}
