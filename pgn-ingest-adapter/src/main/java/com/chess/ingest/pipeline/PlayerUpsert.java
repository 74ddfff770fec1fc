package com.chess.ingest.pipeline;

import java.time.Instant;

/**
 * Player mutation implied by one batch.
 *
 * @param playerId         stable identity, synthesized when the player is new
 * @param created          true when no stored player had this natural key
 * @param gamesPlayedDelta games in this batch referencing the player
 * @param peakRating       highest rating seen in this batch, merged by monotone max
 * @param currentRating    rating from the player's most recent game, or null to leave it unchanged
 * @param lastRatingAt     timestamp of that game, null together with currentRating
 * @param firstSeenAt      earliest game timestamp in this batch, used only on creation
 */
public record PlayerUpsert(
        String playerId,
        String nameKey,
        String displayName,
        String title,
        boolean created,
        int gamesPlayedDelta,
        int peakRating,
        Integer currentRating,
        Instant lastRatingAt,
        Instant firstSeenAt
) {

    public PlayerUpsert withPlayerId(String storedId) {
        return new PlayerUpsert(storedId, nameKey, displayName, title, false, gamesPlayedDelta, peakRating,
                currentRating, lastRatingAt, firstSeenAt);
    }
}
