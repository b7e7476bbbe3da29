package com.libragraph.datasink.core.error;

/**
 * Malformed title, identifier or query.
 */
public class ValidationException extends CatalogException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
