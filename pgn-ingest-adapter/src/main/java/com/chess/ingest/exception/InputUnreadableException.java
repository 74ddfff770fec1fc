package com.chess.ingest.exception;

/**
 * Thrown when an import source cannot be opened or read.
 */
public class InputUnreadableException extends RuntimeException {

    public InputUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
