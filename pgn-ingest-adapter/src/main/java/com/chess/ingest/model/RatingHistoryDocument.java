package com.chess.ingest.model;

import com.chess.ingest.pgn.TimeControlClass;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One rating observation for one player, taken from one game.
 * Append-only: points are inserted with the game and never updated.
 */
@Document(collection = "rating_history")
@CompoundIndex(name = "player_timestamp_idx", def = "{'playerId': 1, 'timestamp': 1}")
public class RatingHistoryDocument {

    @Id
    private String id;

    private String playerId;
    private Instant timestamp;
    private int rating;

    @Indexed
    private TimeControlClass timeControl;

    private String gameKey;

    public RatingHistoryDocument() {}

    // ============ BUILDER PATTERN ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final RatingHistoryDocument point = new RatingHistoryDocument();

        public Builder id(String id) { point.id = id; return this; }
        public Builder playerId(String playerId) { point.playerId = playerId; return this; }
        public Builder timestamp(Instant timestamp) { point.timestamp = timestamp; return this; }
        public Builder rating(int rating) { point.rating = rating; return this; }
        public Builder timeControl(TimeControlClass timeControl) { point.timeControl = timeControl; return this; }
        public Builder gameKey(String gameKey) { point.gameKey = gameKey; return this; }

        public RatingHistoryDocument build() { return point; }
    }

    // ============ GETTERS AND SETTERS ============

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getPlayerId() { return playerId; }
    public void setPlayerId(String playerId) { this.playerId = playerId; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public int getRating() { return rating; }
    public void setRating(int rating) { this.rating = rating; }

    public TimeControlClass getTimeControl() { return timeControl; }
    public void setTimeControl(TimeControlClass timeControl) { this.timeControl = timeControl; }

    public String getGameKey() { return gameKey; }
    public void setGameKey(String gameKey) { this.gameKey = gameKey; }
}
