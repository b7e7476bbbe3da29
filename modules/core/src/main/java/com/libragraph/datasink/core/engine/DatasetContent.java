package com.libragraph.datasink.core.engine;

import com.libragraph.datasink.core.catalog.DatasetRecord;
import com.libragraph.datasink.util.ContentHash;

/**
 * A dataset's metadata together with its stored bytes.
 */
public record DatasetContent(DatasetRecord dataset, byte[] data, ContentHash hash, String relativePath) {

    public String contentType() {
        return dataset.distribution().mediaType();
    }

    public long size() {
        return data.length;
    }
}
