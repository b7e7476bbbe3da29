package com.libragraph.datasink.core.engine;

/**
 * Stages of a create or update workflow, in order. {@link #FAILED} is reachable from any stage.
 */
public enum CreateStage {
    VALIDATING,
    FORMAT_SNIFFING,
    METADATA_WRITE,
    BINARY_WRITE,
    STRUCTURED_SUBGRAPH_WRITE,
    COMMITTED,
    FAILED
}
