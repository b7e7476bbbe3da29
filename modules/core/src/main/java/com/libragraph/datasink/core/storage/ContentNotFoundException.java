package com.libragraph.datasink.core.storage;

/**
 * Thrown when a delete targets a dataset that has no stored content.
 */
public class ContentNotFoundException extends RuntimeException {

    private final String datasetId;

    public ContentNotFoundException(String datasetId) {
        super("No content stored for dataset " + datasetId);
        this.datasetId = datasetId;
    }

    public String datasetId() {
        return datasetId;
    }
}
