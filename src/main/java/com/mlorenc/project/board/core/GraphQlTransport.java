package com.mlorenc.project.board.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public interface GraphQlTransport {

    /**
     * Sends one GraphQL request and returns the raw response document
     * ({@code data} and/or {@code errors}).
     *
     * @throws com.mlorenc.project.board.exception.TransportException when the call itself fails
     */
    JsonNode execute(String query, Map<String, Object> variables);
}
