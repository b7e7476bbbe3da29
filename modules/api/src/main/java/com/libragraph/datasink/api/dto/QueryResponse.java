package com.libragraph.datasink.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.datasink.core.graph.QueryResult;

import java.util.List;
import java.util.Map;

/**
 * Wire form of a query result. ASK results carry only {@code boolean}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
        String form,
        List<String> variables,
        List<Map<String, String>> rows,
        @JsonProperty("boolean") Boolean booleanResult
) {
    public static QueryResponse from(QueryResult result) {
        if (result.form() == QueryResult.Form.ASK) {
            return new QueryResponse("ask", null, null, result.booleanResult());
        }
        return new QueryResponse(result.form().name().toLowerCase(), result.variables(), result.rows(), null);
    }
}
