package com.chess.analytics.dto;

/**
 * Result rates for one opening. Rates are fractions in [0, 1].
 *
 * @param whiteAdvantage white win rate minus black win rate
 */
public record OpeningStats(
        String ecoCode,
        String openingName,
        long totalGames,
        long whiteWins,
        long blackWins,
        long draws,
        double whiteWinRate,
        double blackWinRate,
        double drawRate,
        double averageRating,
        double whiteAdvantage
) {
}
