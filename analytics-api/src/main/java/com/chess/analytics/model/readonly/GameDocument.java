package com.chess.analytics.model.readonly;

import com.chess.analytics.model.TimeControlClass;
import org.springframework.data.annotation.Id;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Read-only model for games. Moves are left out; nothing here reads them.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "games")
public class GameDocument {

    @Id
    private String id;

    private String whitePlayerId;
    private String whiteName;
    private int whiteRating;
    private String blackPlayerId;
    private String blackName;
    private int blackRating;
    private String result;
    private LocalDate date;
    private Instant playedAt;
    private String ecoCode;
    private String openingName;
    private TimeControlClass timeControl;
    private String event;
    private int plyCount;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getWhitePlayerId() { return whitePlayerId; }
    public String getWhiteName() { return whiteName; }
    public int getWhiteRating() { return whiteRating; }
    public String getBlackPlayerId() { return blackPlayerId; }
    public String getBlackName() { return blackName; }
    public int getBlackRating() { return blackRating; }
    public String getResult() { return result; }
    public LocalDate getDate() { return date; }
    public Instant getPlayedAt() { return playedAt; }
    public String getEcoCode() { return ecoCode; }
    public String getOpeningName() { return openingName; }
    public TimeControlClass getTimeControl() { return timeControl; }
    public String getEvent() { return event; }
    public int getPlyCount() { return plyCount; }
}
