package com.libragraph.datasink.core.storage;

import com.libragraph.datasink.util.ContentHash;

import java.util.Arrays;
import java.util.Objects;

/**
 * A dataset's stored payload. {@code hash} is always computed from {@code data}.
 */
public record BinaryRecord(String datasetId, byte[] data, ContentHash hash) {

    public BinaryRecord {
        Objects.requireNonNull(datasetId, "datasetId cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(hash, "hash cannot be null");
    }

    public static BinaryRecord of(String datasetId, byte[] data) {
        return new BinaryRecord(datasetId, data, ContentHash.of(data));
    }

    public long size() {
        return data.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryRecord other)) return false;
        return datasetId.equals(other.datasetId) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * datasetId.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "BinaryRecord[" + datasetId + ", " + data.length + " bytes, " + hash + "]";
    }
}
