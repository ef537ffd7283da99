package com.mlorenc.project.board.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlorenc.project.board.exception.TransportException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Sends GraphQL through the {@code gh} command-line proxy ({@code gh api graphql --input -}),
 * reusing whatever login {@code gh} already holds.
 */
public class GhCliGraphQlTransport implements GraphQlTransport {

    private static final List<String> API_ARGS = List.of("api", "graphql", "--input", "-");

    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public GhCliGraphQlTransport(List<String> command, Duration timeout, ObjectMapper objectMapper) {
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode execute(String query, Map<String, Object> variables) {
        byte[] request = requestBody(query, variables);

        List<String> invocation = new ArrayList<>(command);
        invocation.addAll(API_ARGS);

        Process process;
        try {
            process = new ProcessBuilder(invocation).start();
        } catch (IOException ex) {
            throw new TransportException("Could not start " + String.join(" ", command) + ": " + ex.getMessage(), ex);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(request);
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TransportException("gh api graphql timed out after " + timeout.toSeconds() + "s");
            }

            String output = stdout.get();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                // gh exits non-zero on GraphQL errors but still prints the response document
                JsonNode body = parseOrNull(output);
                if (body != null && body.path("errors").isArray()) {
                    return body;
                }
                throw new TransportException("gh api graphql exited with " + exitCode + ": " + stderr.get().strip());
            }
            JsonNode body = parseOrNull(output);
            if (body == null) {
                throw new TransportException("gh api graphql returned a non-JSON response");
            }
            return body;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new TransportException("Interrupted while waiting for gh api graphql", ex);
        } catch (IOException | ExecutionException ex) {
            process.destroyForcibly();
            throw new TransportException("gh api graphql I/O failure: " + ex.getMessage(), ex);
        }
    }

    private byte[] requestBody(String query, Map<String, Object> variables) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize GraphQL request", e);
        }
    }

    private JsonNode parseOrNull(String output) {
        if (output == null || output.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
