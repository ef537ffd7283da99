package com.mlorenc.project.board.exception;

public enum ErrorKind {
    NOT_FOUND,
    VALIDATION,
    UNSUPPORTED_FIELD_TYPE,
    TRANSPORT,
    REMOTE_LOGICAL,
    UNEXPECTED
}
