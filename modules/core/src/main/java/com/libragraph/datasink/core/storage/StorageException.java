package com.libragraph.datasink.core.storage;

/**
 * A binary store backend (filesystem, S3 or PostgreSQL) could not complete an
 * operation. Carries the dataset id when the failure concerns one dataset.
 * The engine reports it to callers as an opaque store failure.
 */
public class StorageException extends RuntimeException {

    private final String datasetId;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.datasetId = null;
    }

    public StorageException(String message) {
        super(message);
        this.datasetId = null;
    }

    private StorageException(String action, String datasetId, Throwable cause) {
        super("Failed to " + action + " content: " + datasetId, cause);
        this.datasetId = datasetId;
    }

    /** A failed {@code action} (read, write, delete, check) on one dataset's content. */
    public static StorageException forDataset(String action, String datasetId, Throwable cause) {
        return new StorageException(action, datasetId, cause);
    }

    /** The dataset concerned, or null for store-wide failures. */
    public String datasetId() {
        return datasetId;
    }
}
