package com.chess.ingest.pgn;

import java.util.Optional;

/**
 * Outcome of a game as written in the PGN Result tag.
 */
public enum GameResult {

    WHITE_WIN("1-0"),
    BLACK_WIN("0-1"),
    DRAW("1/2-1/2");

    private final String notation;

    GameResult(String notation) {
        this.notation = notation;
    }

    public String getNotation() {
        return notation;
    }

    /**
     * Resolve a PGN result token. The unfinished marker "*" and anything else
     * outside the closed set yields empty.
     */
    public static Optional<GameResult> fromNotation(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (GameResult result : values()) {
            if (result.notation.equals(trimmed)) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }
}
