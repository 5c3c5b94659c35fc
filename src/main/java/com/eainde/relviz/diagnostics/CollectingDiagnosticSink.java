package com.eainde.relviz.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every diagnostic in arrival order, optionally passing each one on to
 * another sink as well.
 */
public class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final DiagnosticSink downstream;

    public CollectingDiagnosticSink() {
        this(DiagnosticSink.NONE);
    }

    public CollectingDiagnosticSink(DiagnosticSink downstream) {
        this.downstream = downstream;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        downstream.report(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<String> getMessages() {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }
}
