package com.chess.analytics.model.readonly;

import org.springframework.data.annotation.Id;

/**
 * Read-only model for openings and their result counters.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "openings")
public class OpeningDocument {

    @Id
    private String id;

    private String ecoCode;
    private String openingName;
    private long totalGames;
    private long whiteWins;
    private long blackWins;
    private long draws;
    private long totalWhiteRating;
    private long totalBlackRating;

    public OpeningDocument() {
    }

    // Getters only (read-only)
    public String getId() { return id; }
    public String getEcoCode() { return ecoCode; }
    public String getOpeningName() { return openingName; }
    public long getTotalGames() { return totalGames; }
    public long getWhiteWins() { return whiteWins; }
    public long getBlackWins() { return blackWins; }
    public long getDraws() { return draws; }
    public long getTotalWhiteRating() { return totalWhiteRating; }
    public long getTotalBlackRating() { return totalBlackRating; }
}
