package com.eainde.relviz.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards diagnostics to SLF4J at DEBUG level.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private final Logger log;

    public LoggingDiagnosticSink() {
        this(LoggerFactory.getLogger(LoggingDiagnosticSink.class));
    }

    public LoggingDiagnosticSink(Logger log) {
        this.log = log;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        if (log.isDebugEnabled()) {
            log.debug("{}", diagnostic);
        }
    }
}
