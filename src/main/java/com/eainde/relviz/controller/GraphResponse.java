package com.eainde.relviz.controller;

import com.eainde.relviz.graph.DiagramGraph;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param graph       the styled graph description
 * @param diagnostics narration collected while building it
 */
public record GraphResponse(
        @JsonProperty("graph")       DiagramGraph graph,
        @JsonProperty("diagnostics") List<String> diagnostics
) {}
