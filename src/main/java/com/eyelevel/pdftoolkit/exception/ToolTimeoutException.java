package com.eyelevel.pdftoolkit.exception;

import java.io.Serial;

/**
 * Thrown when an external binary does not finish within its configured timeout.
 */
public class ToolTimeoutException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 2466009154337718903L;

    public ToolTimeoutException(String message) {
        super(message);
    }

    public ToolTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
