package com.chess.ingest.model;

import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Stores an opening (keyed by ECO code) with its running result counters.
 * Counters only ever move by $inc inside the commit that inserts the games.
 */
@Document(collection = "openings")
public class OpeningDocument extends BaseDocument {

    private String ecoCode;
    private String openingName;

    @Indexed(direction = IndexDirection.DESCENDING)
    private long totalGames;

    private long whiteWins;
    private long blackWins;
    private long draws;
    private long totalWhiteRating;
    private long totalBlackRating;

    public OpeningDocument() {
        super();
    }

    public String getEcoCode() {
        return ecoCode;
    }

    public void setEcoCode(String ecoCode) {
        this.ecoCode = ecoCode;
    }

    public String getOpeningName() {
        return openingName;
    }

    public void setOpeningName(String openingName) {
        this.openingName = openingName;
    }

    public long getTotalGames() {
        return totalGames;
    }

    public void setTotalGames(long totalGames) {
        this.totalGames = totalGames;
    }

    public long getWhiteWins() {
        return whiteWins;
    }

    public void setWhiteWins(long whiteWins) {
        this.whiteWins = whiteWins;
    }

    public long getBlackWins() {
        return blackWins;
    }

    public void setBlackWins(long blackWins) {
        this.blackWins = blackWins;
    }

    public long getDraws() {
        return draws;
    }

    public void setDraws(long draws) {
        this.draws = draws;
    }

    public long getTotalWhiteRating() {
        return totalWhiteRating;
    }

    public void setTotalWhiteRating(long totalWhiteRating) {
        this.totalWhiteRating = totalWhiteRating;
    }

    public long getTotalBlackRating() {
        return totalBlackRating;
    }

    public void setTotalBlackRating(long totalBlackRating) {
        this.totalBlackRating = totalBlackRating;
    }
}
