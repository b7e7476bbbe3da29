package com.libragraph.datasink.core.storage;

import com.libragraph.datasink.core.dao.DatasetContentDao;
import com.libragraph.datasink.core.dao.DatasetContentRecord;
import com.libragraph.datasink.core.db.DatabaseService;
import com.libragraph.datasink.util.ContentHash;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.function.Function;

/**
 * PostgreSQL-backed BinaryStore: one {@code dataset_content} row per dataset.
 */
@ApplicationScoped
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "jdbc")
public class JdbiBinaryStore implements BinaryStore {

    private static final Logger log = Logger.getLogger(JdbiBinaryStore.class);

    @Inject
    DatabaseService databaseService;

    @Override
    public Uni<Optional<BinaryRecord>> get(String datasetId) {
        return Uni.createFrom().item(() -> {
            Optional<DatasetContentRecord> row = withDao(
                    dao -> dao.findById(datasetId), "read", datasetId);
            return row.map(r -> {
                BinaryRecord record = BinaryRecord.of(datasetId, r.data());
                if (!record.hash().equals(new ContentHash(r.contentHash()))) {
                    throw new StorageException("Stored hash does not match content: " + datasetId);
                }
                return record;
            });
        });
    }

    @Override
    public Uni<ContentHash> put(String datasetId, byte[] data) {
        return Uni.createFrom().item(() -> {
            ContentHash hash = ContentHash.of(data);
            withDao(dao -> {
                dao.upsert(datasetId, data, hash.bytes(), data.length);
                return null;
            }, "write", datasetId);
            log.debugf("Stored %d bytes for dataset %s", data.length, datasetId);
            return hash;
        });
    }

    @Override
    public Uni<Void> delete(String datasetId) {
        return Uni.createFrom().voidItem().invoke(() -> {
            int removed = withDao(dao -> dao.delete(datasetId), "delete", datasetId);
            if (removed == 0) {
                throw new ContentNotFoundException(datasetId);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String datasetId) {
        return Uni.createFrom().item(() -> withDao(dao -> dao.exists(datasetId), "check", datasetId));
    }

    @Override
    public String backend() {
        return "jdbc";
    }

    private <T> T withDao(Function<DatasetContentDao, T> call, String action, String datasetId) {
        try {
            return databaseService.jdbi().withExtension(DatasetContentDao.class, call::apply);
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw StorageException.forDataset(action, datasetId, e);
        }
    }
}
