package com.eyelevel.pdftoolkit.exception;

import java.io.Serial;

/**
 * Thrown when none of the candidate binaries for an external tool can be found on this host.
 */
public class ToolUnavailableException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public ToolUnavailableException(String message) {
        super(message);
    }

    public ToolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
