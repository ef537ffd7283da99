package com.mlorenc.project.board.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.exception.BoardException;
import com.mlorenc.project.board.exception.RemoteLogicalException;

import java.util.Optional;

/**
 * Outcome of one executed remote call: the response {@code data} node or the typed failure.
 */
public final class CallResult {

    private final JsonNode data;
    private final BoardException error;

    private CallResult(JsonNode data, BoardException error) {
        this.data = data;
        this.error = error;
    }

    public static CallResult success(JsonNode data) {
        return new CallResult(data, null);
    }

    public static CallResult failure(BoardException error) {
        return new CallResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<BoardException> error() {
        return Optional.ofNullable(error);
    }

    public boolean isNotFound() {
        return error instanceof RemoteLogicalException logical && logical.isNotFound();
    }

    public JsonNode getOrThrow() {
        if (error != null) {
            throw error;
        }
        return data;
    }
}
