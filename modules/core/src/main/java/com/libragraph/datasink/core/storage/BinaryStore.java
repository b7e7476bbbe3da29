package com.libragraph.datasink.core.storage;

import com.libragraph.datasink.util.ContentHash;
import io.smallrye.mutiny.Uni;

import java.util.Optional;

/**
 * Key-addressed store for dataset payloads, keyed by dataset id.
 *
 * <p>Exactly one backend is active, selected by the {@code datasink.binary-store.type}
 * build property.
 */
public interface BinaryStore {

    /**
     * Reads a dataset's content.
     *
     * @return the record, or empty if nothing is stored under the id
     * @throws StorageException on I/O errors
     */
    Uni<Optional<BinaryRecord>> get(String datasetId);

    /**
     * Stores content, replacing anything already stored under the id.
     *
     * @return hash computed from {@code data}
     * @throws StorageException on I/O errors
     */
    Uni<ContentHash> put(String datasetId, byte[] data);

    /**
     * Deletes a dataset's content.
     *
     * @throws ContentNotFoundException if nothing is stored under the id
     * @throws StorageException on I/O errors
     */
    Uni<Void> delete(String datasetId);

    Uni<Boolean> exists(String datasetId);

    /** Short backend name for logs and health output. */
    String backend();
}
