package com.libragraph.datasink.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.datasink.core.engine.CollectionSummary;

import java.time.Instant;

public record CollectionItem(
        String id,
        String name,
        int count,
        long bytes,
        @JsonProperty("last_modified") Instant lastModified
) {
    public static CollectionItem from(CollectionSummary summary) {
        return new CollectionItem(summary.id(), summary.name(), summary.datasetCount(),
                summary.totalBytes(), summary.lastModified());
    }
}
