package com.libragraph.datasink.formats.api;

import com.libragraph.datasink.types.DatasetFormat;

/**
 * Capability to test whether a text document is valid in one serialization format.
 *
 * <p>Each call must parse into its own scratch graph that is discarded afterwards,
 * so a failed attempt leaves nothing behind for the next probe.
 */
public interface FormatProbe {

    /** The format this probe recognizes. Never {@link DatasetFormat#RAW}. */
    DatasetFormat format();

    /**
     * Attempts a full parse of {@code text}. Parse errors are reported in the
     * returned result, not thrown.
     */
    ProbeResult probe(String text);
}
