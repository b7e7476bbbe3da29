package com.libragraph.datasink.api.dto;

import java.util.List;

/** Listing envelope: {@code {"items": [...]}}. */
public record ItemsResponse<T>(List<T> items) {
}
