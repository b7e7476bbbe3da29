package com.libragraph.datasink.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.datasink.core.engine.DatasetListing;

import java.time.Instant;

public record DatasetItem(
        String id,
        String name,
        String type,
        @JsonProperty("relative_path") String relativePath,
        long bytes,
        String hash,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("last_modified") Instant lastModified
) {
    public static DatasetItem from(DatasetListing listing) {
        return new DatasetItem(listing.id(), listing.name(), listing.type().label(),
                listing.relativePath(), listing.bytes(), listing.hash(), listing.contentType(),
                listing.lastModified());
    }
}
