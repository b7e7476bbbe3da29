package com.libragraph.datasink.core.storage;

import com.libragraph.datasink.util.ContentHash;
import io.smallrye.mutiny.Uni;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Map-backed BinaryStore for engine tests. Individual operations can be made to fail.
 */
public class InMemoryBinaryStore implements BinaryStore {

    private final Map<String, byte[]> contents = new ConcurrentHashMap<>();

    public final AtomicBoolean failGet = new AtomicBoolean();
    public final AtomicBoolean failPut = new AtomicBoolean();
    public final AtomicBoolean failDelete = new AtomicBoolean();

    @Override
    public Uni<Optional<BinaryRecord>> get(String datasetId) {
        return Uni.createFrom().item(() -> {
            if (failGet.get()) {
                throw new StorageException("injected get failure: " + datasetId);
            }
            byte[] data = contents.get(datasetId);
            return Optional.ofNullable(data).map(d -> BinaryRecord.of(datasetId, d.clone()));
        });
    }

    @Override
    public Uni<ContentHash> put(String datasetId, byte[] data) {
        return Uni.createFrom().item(() -> {
            if (failPut.get()) {
                throw new StorageException("injected put failure: " + datasetId);
            }
            contents.put(datasetId, data.clone());
            return ContentHash.of(data);
        });
    }

    @Override
    public Uni<Void> delete(String datasetId) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (failDelete.get()) {
                throw new StorageException("injected delete failure: " + datasetId);
            }
            if (contents.remove(datasetId) == null) {
                throw new ContentNotFoundException(datasetId);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String datasetId) {
        return Uni.createFrom().item(() -> contents.containsKey(datasetId));
    }

    @Override
    public String backend() {
        return "memory";
    }

    public int size() {
        return contents.size();
    }

    public boolean contains(String datasetId) {
        return contents.containsKey(datasetId);
    }

    /** Drops content behind the engine's back. */
    public void discard(String datasetId) {
        contents.remove(datasetId);
    }

    /** Replaces content behind the engine's back. */
    public void overwrite(String datasetId, byte[] data) {
        contents.put(datasetId, data.clone());
    }
}
