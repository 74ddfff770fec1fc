package com.chess.analytics.service;

import com.chess.analytics.config.AnalyticsProperties;
import com.chess.analytics.exception.AnalyticsTimeoutException;
import com.mongodb.MongoExecutionTimeoutException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Resolves the time budget of a request and turns a server-side time-out into
 * {@link AnalyticsTimeoutException}.
 * <p>
 * A request that runs several queries shares one {@link Deadline}: each query
 * is sent with whatever is left of the budget as its {@code maxTimeMS}.
 */
@Component
public class QueryBudget {

    private final AnalyticsProperties properties;
    private final LongSupplier nanoClock;

    public QueryBudget(AnalyticsProperties properties) {
        this(properties, System::nanoTime);
    }

    QueryBudget(AnalyticsProperties properties, LongSupplier nanoClock) {
        this.properties = properties;
        this.nanoClock = nanoClock;
    }

    /**
     * The requested budget, capped by the configured maximum, or the default when none was requested.
     */
    public Duration resolve(QueryFilters filters) {
        Duration requested = filters.timeout();
        if (requested == null) {
            return properties.getDefaultTimeout();
        }
        return requested.compareTo(properties.getMaxTimeout()) > 0 ? properties.getMaxTimeout() : requested;
    }

    /**
     * Starts the clock for one request.
     */
    public Deadline start(QueryFilters filters) {
        return new Deadline(resolve(filters), nanoClock);
    }

    /**
     * Runs one query with the time left on {@code deadline}.
     */
    public <T> T run(String query, Deadline deadline, Function<Duration, T> action) {
        Duration remaining = deadline.remaining(query);
        try {
            return action.apply(remaining);
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                throw new AnalyticsTimeoutException(query, deadline.budget(), e);
            }
            throw e;
        }
    }

    static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof MongoExecutionTimeoutException || t instanceof QueryTimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * The overall budget of one request and the moment it started.
     */
    public static final class Deadline {

        private final Duration budget;
        private final LongSupplier nanoClock;
        private final long startedAt;

        Deadline(Duration budget, LongSupplier nanoClock) {
            this.budget = budget;
            this.nanoClock = nanoClock;
            this.startedAt = nanoClock.getAsLong();
        }

        public Duration budget() {
            return budget;
        }

        /**
         * Time left, rounded down to whole milliseconds.
         *
         * @throws AnalyticsTimeoutException when less than a millisecond is left
         */
        public Duration remaining(String query) {
            long leftMillis = budget.minusNanos(nanoClock.getAsLong() - startedAt).toMillis();
            if (leftMillis < 1) {
                throw new AnalyticsTimeoutException(query, budget, null);
            }
            return Duration.ofMillis(leftMillis);
        }
    }
}
