package com.libragraph.datasink.core.graph;

/**
 * Wraps failures raised by the underlying graph store.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public GraphStoreException(String message) {
        super(message);
    }
}
