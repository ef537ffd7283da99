package com.mlorenc.project.board.controller;

import com.mlorenc.project.board.exception.BoardException;
import com.mlorenc.project.board.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps {@link ErrorKind} to HTTP status codes.
 */
@RestControllerAdvice
public class BoardExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BoardExceptionHandler.class);

    @ExceptionHandler(BoardException.class)
    public ResponseEntity<ErrorResponse> handleBoardException(BoardException ex) {
        HttpStatus status = statusFor(ex.kind());
        if (status.is5xxServerError()) {
            log.atError().setCause(ex)
                    .addKeyValue("event", "board.http.error")
                    .addKeyValue("errorKind", ex.kind())
                    .log("Request failed: {}", ex.getMessage());
        } else {
            log.atWarn().addKeyValue("event", "board.http.rejected")
                    .addKeyValue("errorKind", ex.kind())
                    .log("Request rejected: {}", ex.getMessage());
        }
        return respond(status, ex.kind(), ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.atWarn().addKeyValue("event", "board.http.bad_request").log("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, ex.getMessage());
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case UNSUPPORTED_FIELD_TYPE, REMOTE_LOGICAL -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSPORT -> HttpStatus.BAD_GATEWAY;
            case UNEXPECTED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorKind kind, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(kind, message));
    }

    public record ErrorResponse(ErrorKind kind, String message) {
    }
}
