package com.libragraph.datasink.core.engine;

/**
 * Stages of a delete workflow, in order. Binary and subgraph removal come before the
 * metadata commit so that a crash leaves a dangling reference, never orphaned content.
 */
public enum DeleteStage {
    LOCATE,
    CHECK_EMPTY_OR_DIRECT,
    UNLINK_METADATA,
    DELETE_SUBGRAPH,
    DELETE_BINARY,
    COMMIT_METADATA,
    FAILED
}
