package com.libragraph.datasink.core.catalog;

import java.time.Instant;

/**
 * A catalog as stored in the metadata graph. {@code parentId} is null for root catalogs.
 */
public record CatalogRecord(
        String id,
        String iri,
        String title,
        Instant issued,
        Instant modified,
        boolean root,
        String parentId
) {}
