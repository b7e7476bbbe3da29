package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.types.DatasetFormat;

import java.time.Instant;

/**
 * The payload description owned by exactly one dataset.
 *
 * @param contentGraph name of the named subgraph with the parsed content, null for raw datasets
 */
public record DistributionRecord(
        String id,
        String iri,
        DatasetFormat format,
        String downloadUrl,
        long byteSize,
        Instant modified,
        String contentGraph
) {
    public String mediaType() {
        return format.mediaType();
    }
}
