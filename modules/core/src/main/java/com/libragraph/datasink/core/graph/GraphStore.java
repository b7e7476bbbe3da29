package com.libragraph.datasink.core.graph;

/**
 * Triple store holding the catalog metadata graph plus one named subgraph per
 * structured dataset. All access goes through transactions.
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Begins a transaction on the calling thread. Write transactions are
     * serialized; readers see the last committed state.
     *
     * @throws GraphStoreException if the store cannot start a transaction
     */
    GraphTransaction begin(TxnMode mode);

    /** IRI used for the named subgraph called {@code name}. */
    String subgraphIri(String name);

    /** Where the data lives, for logs and health output. */
    String location();

    @Override
    void close();
}
