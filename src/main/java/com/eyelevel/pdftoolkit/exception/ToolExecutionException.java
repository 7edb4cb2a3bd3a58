package com.eyelevel.pdftoolkit.exception;

import java.io.Serial;

/**
 * Thrown when an external binary exits abnormally or does not produce the expected output.
 */
public class ToolExecutionException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -6126842397550913312L;

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
