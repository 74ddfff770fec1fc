package com.chess.analytics.dto;

import com.chess.analytics.model.TimeControlClass;

import java.time.Instant;

public record RatingPoint(Instant timestamp, int rating, TimeControlClass timeControl, String gameKey) {
}
