package com.libragraph.datasink.util;

/**
 * Thrown when an operation starts or runs past its request {@link Deadline}.
 */
public class DeadlineExceededException extends RuntimeException {

    public DeadlineExceededException(String operation) {
        super("Deadline exceeded before: " + operation);
    }
}
