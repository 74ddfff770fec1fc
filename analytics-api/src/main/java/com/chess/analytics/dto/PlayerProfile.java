package com.chess.analytics.dto;

import com.chess.analytics.model.readonly.PlayerDocument;

import java.time.Instant;

public record PlayerProfile(
        String playerId,
        String name,
        String title,
        Integer currentRating,
        Integer peakRating,
        int gamesPlayed,
        long ratingPoints,
        Instant firstSeenAt,
        Instant lastRatingAt
) {
    public static PlayerProfile from(PlayerDocument player, long ratingPoints) {
        return new PlayerProfile(
                player.getId(),
                player.getDisplayName(),
                player.getTitle(),
                player.getCurrentRating(),
                player.getPeakRating(),
                player.getGamesPlayed(),
                ratingPoints,
                player.getFirstSeenAt(),
                player.getLastRatingAt()
        );
    }
}
