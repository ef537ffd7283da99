package com.mlorenc.project.board.exception;

public class NotFoundException extends BoardException {

    public NotFoundException(String message, Object... args) {
        super(ErrorKind.NOT_FOUND, format(message, args));
    }
}
