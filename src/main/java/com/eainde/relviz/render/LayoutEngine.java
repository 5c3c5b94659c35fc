package com.eainde.relviz.render;

import java.util.Locale;

/**
 * Graphviz layout programs that can render a diagram.
 */
public enum LayoutEngine {

    /** Hierarchical layout. */
    DOT("dot"),
    /** Force-directed layout. */
    FDP("fdp");

    private final String processor;

    LayoutEngine(String processor) {
        this.processor = processor;
    }

    /** Name used in requests and configuration keys. */
    public String processor() {
        return processor;
    }

    /**
     * @throws UnknownProcessorException if no engine has that name
     */
    public static LayoutEngine fromProcessor(String processor) {
        if (processor != null) {
            String wanted = processor.trim().toLowerCase(Locale.ROOT);
            for (LayoutEngine engine : values()) {
                if (engine.processor.equals(wanted)) {
                    return engine;
                }
            }
        }
        throw new UnknownProcessorException(processor);
    }
}
