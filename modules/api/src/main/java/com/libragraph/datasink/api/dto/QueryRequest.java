package com.libragraph.datasink.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param metaData query the catalog metadata instead of dataset content
 */
public record QueryRequest(String query, @JsonProperty("meta_data") boolean metaData) {
}
