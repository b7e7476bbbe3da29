package com.libragraph.datasink.core.graph;

import com.libragraph.datasink.types.DatasetFormat;

/**
 * Handle on one named subgraph inside an open write transaction.
 */
public interface NamedSubgraph {

    String name();

    String iri();

    /**
     * Parses {@code text} as {@code format} and adds the statements. Quads from
     * formats with named graphs land in this subgraph regardless of their graph label.
     *
     * @return number of statements read
     * @throws GraphStoreException if the text does not parse
     */
    long load(String text, DatasetFormat format);

    long size();
}
