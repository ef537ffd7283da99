package com.mlorenc.project.board.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.exception.RemoteLogicalException;
import com.mlorenc.project.board.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single entry point for remote GraphQL calls. Transport failures are retried under the
 * configured {@link RetryPolicy}; {@code errors[]} payloads are returned at once. Never throws.
 */
@Service
public class RemoteCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteCallExecutor.class);

    private final GraphQlTransport transport;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RemoteCallExecutor(GraphQlTransport transport, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public CallResult execute(GraphQlRequest request) {
        JsonNode response;
        try {
            response = Retry.withRetry(retryPolicy, sleeper, request.operationName(),
                    () -> transport.execute(request.query(), request.variables()));
        } catch (TransportException ex) {
            log.atError().setCause(ex)
                    .addKeyValue("event", "board.remote.transport.failed")
                    .addKeyValue("operation", request.operationName())
                    .log("Remote call failed");
            return CallResult.failure(ex);
        } catch (RuntimeException ex) {
            log.atError().setCause(ex)
                    .addKeyValue("event", "board.remote.unexpected")
                    .addKeyValue("operation", request.operationName())
                    .log("Remote call failed unexpectedly");
            return CallResult.failure(new TransportException("Unexpected failure in " + request.operationName() + ": " + ex.getMessage(), ex));
        }

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            List<String> types = new ArrayList<>();
            for (JsonNode error : errors) {
                messages.add(error.path("message").asText("Unknown error"));
                types.add(error.path("type").asText(""));
            }
            RemoteLogicalException logical = new RemoteLogicalException(request.operationName(), messages, types);
            log.atWarn().addKeyValue("event", "board.remote.logical_error")
                    .addKeyValue("operation", request.operationName())
                    .addKeyValue("errorTypes", types)
                    .log("Remote call returned errors: {}", logical.getMessage());
            return CallResult.failure(logical);
        }
        return CallResult.success(response.path("data"));
    }
}
