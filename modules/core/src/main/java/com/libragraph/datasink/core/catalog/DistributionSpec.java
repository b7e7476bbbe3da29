package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.types.DatasetFormat;

/**
 * What the engine knows about a payload before writing its distribution.
 *
 * @param contentGraph subgraph name for structured content, null for raw
 */
public record DistributionSpec(DatasetFormat format, long byteSize, String contentGraph) {}
