package com.libragraph.datasink.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DatasetCreated(
        @JsonProperty("dataset_id") String datasetId,
        String format,
        @JsonProperty("download_url") String downloadUrl,
        @JsonProperty("last_modified") Instant lastModified
) {
}
