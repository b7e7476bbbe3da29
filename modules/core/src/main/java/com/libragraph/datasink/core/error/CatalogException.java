package com.libragraph.datasink.core.error;

/**
 * Root of the catalog error taxonomy. Every failure the engine reports to its
 * callers is one of the subclasses.
 */
public abstract class CatalogException extends RuntimeException {

    protected CatalogException(String message) {
        super(message);
    }

    protected CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the message may be shown to a client as-is. */
    public boolean isClientFacing() {
        return true;
    }
}
