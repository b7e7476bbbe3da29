package com.libragraph.datasink.core.error;

/**
 * Duplicate title, or delete of a catalog that still holds datasets.
 */
public class ConflictException extends CatalogException {

    public ConflictException(String message) {
        super(message);
    }
}
