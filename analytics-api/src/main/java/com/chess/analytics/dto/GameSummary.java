package com.chess.analytics.dto;

import com.chess.analytics.model.TimeControlClass;
import com.chess.analytics.model.readonly.GameDocument;

import java.time.LocalDate;

public record GameSummary(
        String gameKey,
        LocalDate date,
        String white,
        int whiteRating,
        String black,
        int blackRating,
        String result,
        String ecoCode,
        String openingName,
        TimeControlClass timeControl
) {
    public static GameSummary from(GameDocument game) {
        return new GameSummary(
                game.getId(),
                game.getDate(),
                game.getWhiteName(),
                game.getWhiteRating(),
                game.getBlackName(),
                game.getBlackRating(),
                game.getResult(),
                game.getEcoCode(),
                game.getOpeningName(),
                game.getTimeControl()
        );
    }
}
