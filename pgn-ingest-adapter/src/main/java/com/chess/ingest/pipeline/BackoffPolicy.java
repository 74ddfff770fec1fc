package com.chess.ingest.pipeline;

import java.time.Duration;

/**
 * Exponential backoff: {@code initialDelay * multiplier^(attempt-1)}, capped at {@code maxDelay}.
 */
public record BackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay) {

    public BackoffPolicy {
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
    }

    public static BackoffPolicy none() {
        return new BackoffPolicy(Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * @param attempt the attempt that just failed, 1-based
     */
    public Duration delayAfter(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
