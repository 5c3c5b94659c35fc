package com.eainde.relviz.diagnostics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One narration event emitted while a fact model or diagram is being built.
 *
 * @param stage   which stage produced the event
 * @param message human-readable text, already formatted
 */
public record Diagnostic(
        @JsonProperty("stage")   Stage stage,
        @JsonProperty("message") String message
) {

    public enum Stage {
        MODEL,
        GRAPH
    }

    @Override
    public String toString() {
        return "[" + stage + "] " + message;
    }
}
