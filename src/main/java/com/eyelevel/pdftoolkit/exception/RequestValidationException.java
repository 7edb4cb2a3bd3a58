package com.eyelevel.pdftoolkit.exception;

import java.io.Serial;

/**
 * Thrown when a request is missing a required file or parameter, or carries one the user must correct.
 */
public class RequestValidationException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -2093410837615260571L;

    public RequestValidationException(String message) {
        super(message);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
