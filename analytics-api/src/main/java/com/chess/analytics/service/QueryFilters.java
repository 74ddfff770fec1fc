package com.chess.analytics.service;

import com.chess.analytics.model.TimeControlClass;

import java.time.Duration;

/**
 * Filters and budget shared by all analytics queries.
 *
 * @param minSampleSize minimum games (or rating points) a group needs to be reported; null for no minimum
 * @param timeControl   restrict to one time-control class; null for all
 * @param timeout       server-side time budget; null for the configured default
 */
public record QueryFilters(Integer minSampleSize, TimeControlClass timeControl, Duration timeout) {

    public QueryFilters {
        if (minSampleSize != null && minSampleSize < 0) {
            throw new IllegalArgumentException("Minimum sample size must not be negative: " + minSampleSize);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
    }

    public static QueryFilters none() {
        return new QueryFilters(null, null, null);
    }

    /**
     * No filters, only a time budget.
     *
     * @param timeoutMs budget in milliseconds; null for the configured default
     */
    public static QueryFilters budgetOnly(Long timeoutMs) {
        return new QueryFilters(null, null, timeoutMs != null ? Duration.ofMillis(timeoutMs) : null);
    }

    public static QueryFilters of(Integer minSampleSize, TimeControlClass timeControl) {
        return new QueryFilters(minSampleSize, timeControl, null);
    }

    /**
     * @return the minimum, or {@code fallback} when none was given
     */
    public int minSampleOr(int fallback) {
        return minSampleSize != null ? minSampleSize : fallback;
    }

    public boolean hasMinSample() {
        return minSampleSize != null && minSampleSize > 0;
    }

    public QueryFilters withTimeout(Duration budget) {
        return new QueryFilters(minSampleSize, timeControl, budget);
    }
}
