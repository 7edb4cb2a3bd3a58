package com.eyelevel.pdftoolkit.exception;

import java.io.Serial;

/**
 * Thrown when no compression preset produced a candidate file.
 */
public class CompressionFailedException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public CompressionFailedException(String message) {
        super(message);
    }

    public CompressionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
