package com.eyelevel.pdftoolkit.exception;

import java.io.Serial;

/**
 * Thrown when uploaded bytes cannot be parsed as a PDF document.
 */
public class DocumentLoadException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 7719315409254637826L;

    public DocumentLoadException(String message) {
        super(message);
    }

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
