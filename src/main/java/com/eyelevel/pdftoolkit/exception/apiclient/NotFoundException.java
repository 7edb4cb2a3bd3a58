package com.eyelevel.pdftoolkit.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a resource was not found (HTTP 404).
 *
 * <p>Raised when a download artifact does not exist, has expired, or was requested under a name
 * that could never have been issued by the artifact store.
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
