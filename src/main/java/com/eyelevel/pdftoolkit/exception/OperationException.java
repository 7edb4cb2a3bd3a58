package com.eyelevel.pdftoolkit.exception;

import java.io.Serial;

/**
 * Generic failure of an operation. Messages are safe to return to the client and never carry paths.
 */
public class OperationException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 391091864299701366L;

    public OperationException(String message) {
        super(message);
    }

    public OperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
