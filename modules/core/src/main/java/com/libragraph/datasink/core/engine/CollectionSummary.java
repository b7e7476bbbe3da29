package com.libragraph.datasink.core.engine;

import java.time.Instant;

/**
 * A root collection with totals over every dataset in its tree.
 */
public record CollectionSummary(
        String id,
        String name,
        Instant lastModified,
        int datasetCount,
        long totalBytes
) {}
