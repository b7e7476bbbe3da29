package com.libragraph.datasink.core.graph;

/**
 * A client-supplied query does not parse, or is not a read query.
 */
public class InvalidQueryException extends GraphStoreException {

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
