package com.eainde.relviz;

/**
 * Base class for every failure raised while turning fact text into a diagram.
 *
 * <p>All subclasses are unchecked: each stage is all-or-nothing and the first
 * failure travels up to whoever started the run (controller or command line),
 * which decides how to report it.</p>
 */
public class RelvizException extends RuntimeException {

    public RelvizException(String message) {
        super(message);
    }

    public RelvizException(String message, Throwable cause) {
        super(message, cause);
    }
}
