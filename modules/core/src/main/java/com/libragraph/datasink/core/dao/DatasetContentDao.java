package com.libragraph.datasink.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(DatasetContentRecord.class)
public interface DatasetContentDao {

    @SqlUpdate("CREATE TABLE IF NOT EXISTS dataset_content (" +
            "dataset_id VARCHAR(36) PRIMARY KEY, " +
            "data BYTEA NOT NULL, " +
            "content_hash BYTEA NOT NULL, " +
            "byte_size BIGINT NOT NULL, " +
            "modified_at TIMESTAMPTZ NOT NULL DEFAULT now())")
    void createTable();

    @SqlQuery("SELECT * FROM dataset_content WHERE dataset_id = :datasetId")
    Optional<DatasetContentRecord> findById(@Bind("datasetId") String datasetId);

    /**
     * Inserts or replaces the content row for a dataset.
     */
    @SqlUpdate("INSERT INTO dataset_content (dataset_id, data, content_hash, byte_size, modified_at) " +
            "VALUES (:datasetId, :data, :contentHash, :byteSize, now()) " +
            "ON CONFLICT (dataset_id) DO UPDATE SET data = EXCLUDED.data, " +
            "content_hash = EXCLUDED.content_hash, byte_size = EXCLUDED.byte_size, " +
            "modified_at = EXCLUDED.modified_at")
    void upsert(@Bind("datasetId") String datasetId,
                @Bind("data") byte[] data,
                @Bind("contentHash") byte[] contentHash,
                @Bind("byteSize") long byteSize);

    @SqlUpdate("DELETE FROM dataset_content WHERE dataset_id = :datasetId")
    int delete(@Bind("datasetId") String datasetId);

    @SqlQuery("SELECT EXISTS (SELECT 1 FROM dataset_content WHERE dataset_id = :datasetId)")
    boolean exists(@Bind("datasetId") String datasetId);

    @SqlQuery("SELECT count(*) FROM dataset_content")
    long count();
}
