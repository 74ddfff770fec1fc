package com.chess.ingest.pipeline;

import java.time.Duration;

/**
 * Pause between commit attempts. Swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
