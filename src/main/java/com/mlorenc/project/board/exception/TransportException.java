package com.mlorenc.project.board.exception;

/**
 * Network or process level failure of a remote call. The only failure that is retried.
 */
public class TransportException extends BoardException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
