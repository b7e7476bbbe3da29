package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.types.CatalogItemType;

import java.time.Instant;

/**
 * One entry reachable from a catalog through contains links.
 */
public record CatalogItem(
        CatalogItemType type,
        String id,
        String iri,
        String title,
        Instant modified,
        String parentId
) {
    public boolean isDataset() {
        return type == CatalogItemType.DATASET;
    }
}
