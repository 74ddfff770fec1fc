package com.chess.ingest.store;

/**
 * Document counts per collection.
 */
public record StoreStatus(
        long players,
        long games,
        long openings,
        long ratingHistory
) {
}
