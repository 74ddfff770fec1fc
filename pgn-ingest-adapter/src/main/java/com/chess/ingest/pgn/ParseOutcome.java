package com.chess.ingest.pgn;

/**
 * Either an accepted record or a rejection, never both.
 */
public record ParseOutcome(GameRecord record, Rejection rejection) {

    public static ParseOutcome accepted(GameRecord record) {
        return new ParseOutcome(record, null);
    }

    public static ParseOutcome rejected(Rejection rejection) {
        return new ParseOutcome(null, rejection);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
