package com.chess.analytics.dto;

import com.chess.analytics.model.TimeControlClass;

public record TimeControlStats(
        TimeControlClass timeControl,
        long games,
        double averageRating,
        double whiteWinRate,
        double blackWinRate,
        double drawRate
) {
}
