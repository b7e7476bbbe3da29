package com.libragraph.datasink.core.error;

/**
 * A catalog, dataset or parent id/title does not resolve.
 */
public class NotFoundException extends CatalogException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException collection(String title) {
        return new NotFoundException("Collection '" + title + "' not found");
    }

    public static NotFoundException catalogId(String id) {
        return new NotFoundException("Catalog with id '" + id + "' not found");
    }

    public static NotFoundException dataset(String collection, String title) {
        return new NotFoundException(
                "Dataset '" + title + "' not found in collection '" + collection + "'");
    }
}
