package com.libragraph.datasink.core.graph;

import java.util.List;
import java.util.Map;

/**
 * Materialized result of a read query.
 *
 * <p>SELECT fills {@code variables} and {@code rows}. ASK sets {@code booleanResult}
 * and leaves the rest empty. CONSTRUCT and DESCRIBE return one row per triple under
 * the variables {@code subject}, {@code predicate} and {@code object}. Values are
 * IRIs, literal lexical forms or {@code _:label} for blank nodes; unbound
 * variables are absent from the row map.
 */
public record QueryResult(
        Form form,
        List<String> variables,
        List<Map<String, String>> rows,
        Boolean booleanResult
) {
    public enum Form { SELECT, ASK, CONSTRUCT, DESCRIBE }

    public static final List<String> TRIPLE_VARIABLES = List.of("subject", "predicate", "object");

    public QueryResult {
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    public static QueryResult ask(boolean value) {
        return new QueryResult(Form.ASK, List.of(), List.of(), value);
    }

    public int size() {
        return rows.size();
    }
}
