package com.libragraph.datasink.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.OffsetDateTime;

public record DatasetContentRecord(
        @ColumnName("dataset_id") String datasetId,
        @ColumnName("data") byte[] data,
        @ColumnName("content_hash") byte[] contentHash,
        @ColumnName("byte_size") long byteSize,
        @ColumnName("modified_at") OffsetDateTime modifiedAt
) {}
