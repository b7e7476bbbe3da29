package com.libragraph.datasink.core.graph;

import java.util.Objects;

/**
 * Which part of the store a query runs against.
 *
 * <ul>
 *   <li>{@link #metadata()}: the catalog metadata graph</li>
 *   <li>{@link #content()}: the union of every dataset's named subgraph</li>
 *   <li>{@link #subgraph(String)}: one named subgraph</li>
 * </ul>
 */
public final class QueryTarget {

    public enum Kind { METADATA, CONTENT, SUBGRAPH }

    private static final QueryTarget METADATA = new QueryTarget(Kind.METADATA, null);
    private static final QueryTarget CONTENT = new QueryTarget(Kind.CONTENT, null);

    private final Kind kind;
    private final String subgraph;

    private QueryTarget(Kind kind, String subgraph) {
        this.kind = kind;
        this.subgraph = subgraph;
    }

    public static QueryTarget metadata() {
        return METADATA;
    }

    public static QueryTarget content() {
        return CONTENT;
    }

    public static QueryTarget subgraph(String name) {
        return new QueryTarget(Kind.SUBGRAPH, Objects.requireNonNull(name, "subgraph name cannot be null"));
    }

    public Kind kind() {
        return kind;
    }

    /** Subgraph name for {@link Kind#SUBGRAPH}, null otherwise. */
    public String subgraphName() {
        return subgraph;
    }

    @Override
    public String toString() {
        return kind == Kind.SUBGRAPH ? "subgraph(" + subgraph + ")" : kind.name().toLowerCase();
    }
}
