package com.libragraph.datasink.core.error;

/**
 * Stored data is inconsistent: a cyclic part-of chain, duplicate matches for a
 * unique entity, or metadata that disagrees with the binary store.
 */
public class IntegrityException extends CatalogException {

    public IntegrityException(String message) {
        super(message);
    }

    @Override
    public boolean isClientFacing() {
        return false;
    }
}
