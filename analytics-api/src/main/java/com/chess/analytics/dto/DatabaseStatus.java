package com.chess.analytics.dto;

import com.chess.analytics.model.readonly.ImportRunDocument;

import java.util.List;

public record DatabaseStatus(
        long players,
        long games,
        long openings,
        long ratingHistory,
        List<ImportRunDocument> recentRuns
) {
}
