package com.chess.ingest.pipeline;

import com.chess.ingest.model.GameDocument;
import com.chess.ingest.model.PlayerDocument;
import com.chess.ingest.model.RatingHistoryDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A batch rewritten against stored identities, ready for one atomic commit.
 *
 * @param duplicatesSkipped  records dropped because their game is already stored or repeated in the batch
 * @param staleRatingPoints  rating points dropped for being older than the player's newest stored point
 */
public record ResolvedBatch(
        long sequence,
        List<GameDocument> games,
        List<PlayerUpsert> players,
        List<OpeningUpsert> openings,
        List<RatingHistoryDocument> ratingPoints,
        int duplicatesSkipped,
        int staleRatingPoints
) {

    public boolean isEmpty() {
        return games.isEmpty();
    }

    /**
     * Point players this batch meant to create at the players another writer
     * stored first under the same natural key. Games and rating points move to
     * the stored id; points older than that player's last rating are dropped.
     *
     * @param storedByNameKey players found at commit time, as they were before this batch's writes
     */
    public ResolvedBatch rebindPlayers(Map<String, PlayerDocument> storedByNameKey) {
        if (storedByNameKey.isEmpty()) {
            return this;
        }
        Map<String, PlayerDocument> byPlannedId = new HashMap<>();
        List<PlayerUpsert> rebound = new ArrayList<>(players.size());
        for (PlayerUpsert player : players) {
            PlayerDocument stored = storedByNameKey.get(player.nameKey());
            if (stored == null || stored.getId().equals(player.playerId())) {
                rebound.add(player);
                continue;
            }
            byPlannedId.put(player.playerId(), stored);
            rebound.add(player.withPlayerId(stored.getId()));
        }
        if (byPlannedId.isEmpty()) {
            return this;
        }

        for (GameDocument game : games) {
            PlayerDocument white = byPlannedId.get(game.getWhitePlayerId());
            if (white != null) {
                game.setWhitePlayerId(white.getId());
            }
            PlayerDocument black = byPlannedId.get(game.getBlackPlayerId());
            if (black != null) {
                game.setBlackPlayerId(black.getId());
            }
        }

        List<RatingHistoryDocument> points = new ArrayList<>(ratingPoints.size());
        int stale = staleRatingPoints;
        for (RatingHistoryDocument point : ratingPoints) {
            PlayerDocument stored = byPlannedId.get(point.getPlayerId());
            if (stored == null) {
                points.add(point);
                continue;
            }
            Instant last = stored.getLastRatingAt();
            if (last != null && point.getTimestamp().isBefore(last)) {
                stale++;
                continue;
            }
            point.setPlayerId(stored.getId());
            points.add(point);
        }
        return new ResolvedBatch(sequence, games, rebound, openings, points, duplicatesSkipped, stale);
    }
}
