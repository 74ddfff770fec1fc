package com.chess.analytics.dto;

import com.chess.analytics.model.TimeControlClass;

import java.util.List;

/**
 * Rating points of one player in ascending time order.
 *
 * @param timeControl the filter applied, null for all time controls
 * @param change      last rating minus first rating, 0 with fewer than two points
 */
public record RatingTrend(
        String playerId,
        String playerName,
        TimeControlClass timeControl,
        List<RatingPoint> points,
        int change
) {
}
