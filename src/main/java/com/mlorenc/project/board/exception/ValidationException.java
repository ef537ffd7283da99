package com.mlorenc.project.board.exception;

/**
 * Input rejected locally. Raised before any remote call is made.
 */
public class ValidationException extends BoardException {

    public ValidationException(String message, Object... args) {
        super(ErrorKind.VALIDATION, format(message, args));
    }
}
