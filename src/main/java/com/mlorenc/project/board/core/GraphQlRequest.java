package com.mlorenc.project.board.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A GraphQL document with its variables. {@code operationName} only labels logs and errors.
 * Variables may hold null values (e.g. the first page cursor).
 */
public record GraphQlRequest(String operationName, String query, Map<String, Object> variables) {

    public GraphQlRequest {
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static GraphQlRequest of(String operationName, String query, Map<String, Object> variables) {
        return new GraphQlRequest(operationName, query, variables);
    }
}
