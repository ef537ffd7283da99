package com.mlorenc.project.board.exception;

import java.util.List;

/**
 * A GraphQL {@code errors[]} payload delivered with an otherwise successful response.
 * Messages are kept verbatim.
 */
public class RemoteLogicalException extends BoardException {

    private static final String NOT_FOUND_TYPE = "NOT_FOUND";

    private final String operation;
    private final List<String> errorTypes;

    public RemoteLogicalException(String operation, List<String> messages, List<String> errorTypes) {
        super(ErrorKind.REMOTE_LOGICAL, String.join("; ", messages));
        this.operation = operation;
        this.errorTypes = List.copyOf(errorTypes);
    }

    public String operation() {
        return operation;
    }

    public List<String> errorTypes() {
        return errorTypes;
    }

    public boolean isNotFound() {
        return !errorTypes.isEmpty() && errorTypes.stream().allMatch(NOT_FOUND_TYPE::equals);
    }
}
