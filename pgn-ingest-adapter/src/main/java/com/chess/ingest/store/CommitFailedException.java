package com.chess.ingest.store;

/**
 * The store was reachable but refused a batch write, e.g. a constraint violation.
 */
public class CommitFailedException extends RuntimeException {

    public CommitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
