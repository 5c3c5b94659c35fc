package com.eainde.relviz.render;

import com.eainde.relviz.RelvizException;

/**
 * A layout engine was requested that is not supported or not configured.
 */
public class UnknownProcessorException extends RelvizException {

    private final String processor;

    public UnknownProcessorException(String processor) {
        super("Unsupported processor: " + processor);
        this.processor = processor;
    }

    public String getProcessor() {
        return processor;
    }
}
