package com.chess.analytics.model.readonly;

import com.chess.analytics.model.TimeControlClass;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Read-only model for rating history points.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "rating_history")
public class RatingHistoryDocument {

    @Id
    private String id;

    private String playerId;
    private Instant timestamp;
    private int rating;
    private TimeControlClass timeControl;
    private String gameKey;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getPlayerId() { return playerId; }
    public Instant getTimestamp() { return timestamp; }
    public int getRating() { return rating; }
    public TimeControlClass getTimeControl() { return timeControl; }
    public String getGameKey() { return gameKey; }
}
