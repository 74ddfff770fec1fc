package com.chess.ingest.pipeline;

/**
 * Counter increments for one opening implied by one batch.
 */
public record OpeningUpsert(
        String ecoCode,
        String openingName,
        boolean created,
        long games,
        long whiteWins,
        long blackWins,
        long draws,
        long whiteRatingSum,
        long blackRatingSum
) {
}
