package com.libragraph.datasink.core.graph;

import com.libragraph.datasink.util.Deadline;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;

import java.util.Collection;
import java.util.List;

/**
 * A read or write transaction on a {@link GraphStore}. Closing without
 * {@link #commit()} discards every change.
 *
 * <p>Transactions are bound to the thread that began them.
 */
public interface GraphTransaction extends AutoCloseable {

    TxnMode mode();

    /**
     * Pattern match on the metadata graph. A null position matches anything.
     */
    List<Triple> find(Node subject, Node predicate, Node object);

    /**
     * Runs a read query (SELECT, ASK, CONSTRUCT or DESCRIBE).
     *
     * @throws InvalidQueryException if the query does not parse
     * @throws GraphStoreException if the query fails or runs past the deadline
     */
    QueryResult query(String sparql, QueryTarget target, Deadline deadline);

    /**
     * Adds triples to the named subgraph {@code namedGraph}, or to the metadata graph when null.
     */
    void addTriples(String namedGraph, Collection<Triple> triples);

    /**
     * Removes metadata triples matching the pattern. A null position matches anything.
     *
     * @return number of triples removed
     */
    int removeTriples(Node subject, Node predicate, Node object);

    NamedSubgraph openNamedSubgraph(String name);

    /**
     * @return true if the subgraph existed
     */
    boolean removeNamedSubgraph(String name);

    boolean hasNamedSubgraph(String name);

    long metadataSize();

    long subgraphCount();

    void commit();

    void abort();

    boolean isActive();

    @Override
    void close();
}
