package com.eainde.relviz.model;

import com.eainde.relviz.RelvizException;

/**
 * The inheritance structure described by a set of facts cannot be resolved.
 */
public class FactModelException extends RelvizException {

    public FactModelException(String message) {
        super(message);
    }
}
