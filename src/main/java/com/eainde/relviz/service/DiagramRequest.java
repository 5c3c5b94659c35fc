package com.eainde.relviz.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What to draw and which style sheets apply.
 *
 * @param facts        content in the fact language
 * @param style        additional style sheet text; may be null
 * @param defaultStyle start from the default style sheet
 * @param inlineStyle  also treat the content facts as style facts
 */
public record DiagramRequest(
        @JsonProperty("facts")        String facts,
        @JsonProperty("style")        String style,
        @JsonProperty("defaultStyle") boolean defaultStyle,
        @JsonProperty("inlineStyle")  boolean inlineStyle
) {

    public DiagramRequest {
        if (facts == null) {
            throw new IllegalArgumentException("facts must not be null");
        }
    }

    /** Content only, with the default style sheet. */
    public static DiagramRequest of(String facts) {
        return new DiagramRequest(facts, null, true, false);
    }
}
