package com.chess.analytics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "chess.analytics")
public class AnalyticsProperties {

    /** Server-side time limit for one query, unless the request sets its own */
    private Duration defaultTimeout = Duration.ofSeconds(30);

    /** Upper bound for a timeout requested by a caller */
    private Duration maxTimeout = Duration.ofMinutes(5);

    private int openingLimit = 50;
    private int volatilityLimit = 100;

    /** Rating points shown in a player report */
    private int reportTrendPoints = 20;

    private int recentRuns = 10;

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getMaxTimeout() {
        return maxTimeout;
    }

    public void setMaxTimeout(Duration maxTimeout) {
        this.maxTimeout = maxTimeout;
    }

    public int getOpeningLimit() {
        return openingLimit;
    }

    public void setOpeningLimit(int openingLimit) {
        this.openingLimit = openingLimit;
    }

    public int getVolatilityLimit() {
        return volatilityLimit;
    }

    public void setVolatilityLimit(int volatilityLimit) {
        this.volatilityLimit = volatilityLimit;
    }

    public int getReportTrendPoints() {
        return reportTrendPoints;
    }

    public void setReportTrendPoints(int reportTrendPoints) {
        this.reportTrendPoints = reportTrendPoints;
    }

    public int getRecentRuns() {
        return recentRuns;
    }

    public void setRecentRuns(int recentRuns) {
        this.recentRuns = recentRuns;
    }
}
