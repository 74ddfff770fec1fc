package com.chess.ingest.model;

import com.chess.ingest.pgn.GameResult;
import com.chess.ingest.pgn.TimeControlClass;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores one committed game. The id is the game's natural key, so a game can
 * only ever be stored once.
 */
@Document(collection = "games")
@CompoundIndexes({
        @CompoundIndex(name = "eco_date_idx", def = "{'ecoCode': 1, 'date': -1}"),
        @CompoundIndex(name = "white_date_idx", def = "{'whitePlayerId': 1, 'date': -1}"),
        @CompoundIndex(name = "black_date_idx", def = "{'blackPlayerId': 1, 'date': -1}")
})
public class GameDocument extends BaseDocument {

    private String whitePlayerId;
    private String whiteName;
    private int whiteRating;

    private String blackPlayerId;
    private String blackName;
    private int blackRating;

    @Indexed
    private GameResult result;

    @Indexed
    private LocalDate date;
    private Instant playedAt;

    private String ecoCode;
    private String openingName;

    @Indexed
    private TimeControlClass timeControl;
    private String rawTimeControl;

    private String event;
    private String site;

    private List<String> moves = new ArrayList<>();
    private int plyCount;

    public GameDocument() {
        super();
    }

    public String getWhitePlayerId() {
        return whitePlayerId;
    }

    public void setWhitePlayerId(String whitePlayerId) {
        this.whitePlayerId = whitePlayerId;
    }

    public String getWhiteName() {
        return whiteName;
    }

    public void setWhiteName(String whiteName) {
        this.whiteName = whiteName;
    }

    public int getWhiteRating() {
        return whiteRating;
    }

    public void setWhiteRating(int whiteRating) {
        this.whiteRating = whiteRating;
    }

    public String getBlackPlayerId() {
        return blackPlayerId;
    }

    public void setBlackPlayerId(String blackPlayerId) {
        this.blackPlayerId = blackPlayerId;
    }

    public String getBlackName() {
        return blackName;
    }

    public void setBlackName(String blackName) {
        this.blackName = blackName;
    }

    public int getBlackRating() {
        return blackRating;
    }

    public void setBlackRating(int blackRating) {
        this.blackRating = blackRating;
    }

    public GameResult getResult() {
        return result;
    }

    public void setResult(GameResult result) {
        this.result = result;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public Instant getPlayedAt() {
        return playedAt;
    }

    public void setPlayedAt(Instant playedAt) {
        this.playedAt = playedAt;
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

    public TimeControlClass getTimeControl() {
        return timeControl;
    }

    public void setTimeControl(TimeControlClass timeControl) {
        this.timeControl = timeControl;
    }

    public String getRawTimeControl() {
        return rawTimeControl;
    }

    public void setRawTimeControl(String rawTimeControl) {
        this.rawTimeControl = rawTimeControl;
    }

    public String getEvent() {
        return event;
    }

    public void setEvent(String event) {
        this.event = event;
    }

    public String getSite() {
        return site;
    }

    public void setSite(String site) {
        this.site = site;
    }

    public List<String> getMoves() {
        return moves;
    }

    public void setMoves(List<String> moves) {
        this.moves = moves;
        this.plyCount = moves == null ? 0 : moves.size();
    }

    public int getPlyCount() {
        return plyCount;
    }

    public void setPlyCount(int plyCount) {
        this.plyCount = plyCount;
    }
}
