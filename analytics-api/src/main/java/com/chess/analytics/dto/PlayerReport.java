package com.chess.analytics.dto;

import java.util.List;

/**
 * Everything shown for one player: profile, recent rating trend, repertoire with white and recent games.
 */
public record PlayerReport(
        PlayerProfile profile,
        RatingTrend recentTrend,
        List<RepertoireEntry> whiteRepertoire,
        List<GameSummary> recentGames
) {
}
