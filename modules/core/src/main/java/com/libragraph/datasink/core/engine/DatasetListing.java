package com.libragraph.datasink.core.engine;

import com.libragraph.datasink.types.CatalogItemType;

import java.time.Instant;

/**
 * One entry of a collection listing. Sub-collections report zero bytes and no hash.
 *
 * @param relativePath display path of the enclosing catalogs, e.g. {@code ./alpha/beta/}
 * @param hash         hex content hash, null for catalogs and for missing content
 */
public record DatasetListing(
        String id,
        String name,
        Instant lastModified,
        CatalogItemType type,
        String relativePath,
        long bytes,
        String hash,
        String contentType
) {}
