package com.chess.analytics.dto;

import java.time.Instant;

/**
 * One opening in a player's repertoire for one color.
 *
 * @param scoreRate points per game, a win counting 1 and a draw 0.5
 */
public record RepertoireEntry(
        String ecoCode,
        String openingName,
        long games,
        long wins,
        long draws,
        long losses,
        double winRate,
        double scoreRate,
        Instant lastPlayed
) {
}
