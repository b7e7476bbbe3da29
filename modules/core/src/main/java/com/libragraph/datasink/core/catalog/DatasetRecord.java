package com.libragraph.datasink.core.catalog;

import java.time.Instant;

/**
 * A dataset as stored in the metadata graph, with its distribution.
 */
public record DatasetRecord(
        String id,
        String iri,
        String title,
        Instant issued,
        Instant modified,
        String parentId,
        DistributionRecord distribution
) {
    public boolean isStructured() {
        return distribution.format().isStructured();
    }
}
