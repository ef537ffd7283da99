package com.mlorenc.project.board.exception;

/**
 * Base type for every failure the field engine reports to its callers.
 * The {@link ErrorKind} is what bulk reports and the HTTP layer key on.
 */
public abstract class BoardException extends RuntimeException {

    private final ErrorKind kind;

    protected BoardException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected BoardException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
