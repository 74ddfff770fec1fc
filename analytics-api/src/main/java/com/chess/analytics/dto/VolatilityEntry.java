package com.chess.analytics.dto;

/**
 * Rating volatility of one player.
 *
 * @param volatility    population standard deviation of successive rating changes
 * @param averageChange mean of those changes
 * @param points        rating points considered
 */
public record VolatilityEntry(
        String playerId,
        String playerName,
        long points,
        double volatility,
        double averageChange,
        int minRating,
        int maxRating,
        int ratingRange
) {
}
