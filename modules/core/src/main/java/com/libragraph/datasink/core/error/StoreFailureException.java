package com.libragraph.datasink.core.error;

/**
 * An underlying graph or binary store operation failed. The message names the
 * operation and the stage it reached; the store's own error text stays in the
 * cause and is never part of the message.
 */
public class StoreFailureException extends CatalogException {

    private final String operation;
    private final String stage;

    public StoreFailureException(String operation, String stage, Throwable cause) {
        super("Operation '" + operation + "' failed at stage " + stage, cause);
        this.operation = operation;
        this.stage = stage;
    }

    public String operation() {
        return operation;
    }

    public String stage() {
        return stage;
    }

    @Override
    public boolean isClientFacing() {
        return false;
    }
}
