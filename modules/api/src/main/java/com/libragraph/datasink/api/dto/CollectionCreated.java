package com.libragraph.datasink.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CollectionCreated(
        @JsonProperty("collection_id") String collectionId,
        @JsonProperty("last_modified") Instant lastModified
) {
}
