package com.eainde.relviz.render;

import com.eainde.relviz.RelvizException;

/**
 * The layout engine could not be run or reported a failure.
 */
public class RenderException extends RelvizException {

    /** Exit code used when the process never produced one. */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;

    public RenderException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = NO_EXIT_CODE;
    }

    public int getExitCode() {
        return exitCode;
    }
}
