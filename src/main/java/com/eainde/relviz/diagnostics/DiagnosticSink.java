package com.eainde.relviz.diagnostics;

/**
 * Receives the narration of a single parse/model/graph run.
 *
 * <p>The core classes take a sink as a parameter instead of writing to a shared
 * logger, so each run stays a function of its inputs.</p>
 */
@FunctionalInterface
public interface DiagnosticSink {

    /** Discards everything. */
    DiagnosticSink NONE = diagnostic -> { };

    void report(Diagnostic diagnostic);

    default void model(String format, Object... args) {
        report(new Diagnostic(Diagnostic.Stage.MODEL, String.format(format, args)));
    }

    default void graph(String format, Object... args) {
        report(new Diagnostic(Diagnostic.Stage.GRAPH, String.format(format, args)));
    }
}
