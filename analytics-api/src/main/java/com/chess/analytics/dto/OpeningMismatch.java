package com.chess.analytics.dto;

/**
 * Stored opening counters next to the values recomputed from games.
 * A stored side of all zeros means the opening document is missing.
 */
public record OpeningMismatch(
        String ecoCode,
        long storedGames,
        long storedWhiteWins,
        long storedBlackWins,
        long storedDraws,
        long actualGames,
        long actualWhiteWins,
        long actualBlackWins,
        long actualDraws
) {
}
