package com.chess.analytics.exception;

import java.time.Duration;

/**
 * A query ran past its time budget and was stopped by the server. No partial result exists.
 */
public class AnalyticsTimeoutException extends RuntimeException {

    private final Duration budget;

    public AnalyticsTimeoutException(String query, Duration budget, Throwable cause) {
        super(String.format("%s exceeded its time budget of %d ms", query, budget.toMillis()), cause);
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }
}
