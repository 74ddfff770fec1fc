package com.chess.ingest.model;

import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Stores player identity and running rating state
 */
@Document(collection = "players")
public class PlayerDocument extends BaseDocument {

    /**
     * Natural key: normalized name, see {@link com.chess.ingest.pgn.PlayerNames#naturalKey}
     */
    @Indexed(unique = true)
    private String nameKey;

    private String displayName;

    @Indexed(sparse = true)
    private String title;

    @Indexed(direction = IndexDirection.DESCENDING)
    private Integer currentRating;

    private Integer peakRating;
    private int gamesPlayed;
    private Instant firstSeenAt;

    /**
     * Timestamp of the game that set currentRating; also the newest rating history point
     */
    private Instant lastRatingAt;

    public PlayerDocument() {
        super();
    }

    public String getNameKey() {
        return nameKey;
    }

    public void setNameKey(String nameKey) {
        this.nameKey = nameKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getCurrentRating() {
        return currentRating;
    }

    public void setCurrentRating(Integer currentRating) {
        this.currentRating = currentRating;
    }

    public Integer getPeakRating() {
        return peakRating;
    }

    public void setPeakRating(Integer peakRating) {
        this.peakRating = peakRating;
    }

    public int getGamesPlayed() {
        return gamesPlayed;
    }

    public void setGamesPlayed(int gamesPlayed) {
        this.gamesPlayed = gamesPlayed;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setFirstSeenAt(Instant firstSeenAt) {
        this.firstSeenAt = firstSeenAt;
    }

    public Instant getLastRatingAt() {
        return lastRatingAt;
    }

    public void setLastRatingAt(Instant lastRatingAt) {
        this.lastRatingAt = lastRatingAt;
    }
}
