package com.chess.analytics.model.readonly;

import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Read-only model for players from the ingest service.
 * This service cannot write to this collection.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "players")
public class PlayerDocument {

    @Id
    private String id;

    private String nameKey;
    private String displayName;
    private String title;
    private Integer currentRating;
    private Integer peakRating;
    private int gamesPlayed;
    private Instant firstSeenAt;
    private Instant lastRatingAt;
    private Instant updatedAt;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getNameKey() { return nameKey; }
    public String getDisplayName() { return displayName; }
    public String getTitle() { return title; }
    public Integer getCurrentRating() { return currentRating; }
    public Integer getPeakRating() { return peakRating; }
    public int getGamesPlayed() { return gamesPlayed; }
    public Instant getFirstSeenAt() { return firstSeenAt; }
    public Instant getLastRatingAt() { return lastRatingAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
