package com.chess.ingest.pgn;

/**
 * Thrown by {@link MoveTextTokenizer} when move text is not well formed.
 */
public class MalformedMoveTextException extends RuntimeException {

    public MalformedMoveTextException(String message) {
        super(message);
    }
}
