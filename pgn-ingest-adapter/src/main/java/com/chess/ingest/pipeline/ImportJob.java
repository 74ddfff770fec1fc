package com.chess.ingest.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on an asynchronous import run.
 */
public class ImportJob {

    private final String id;
    private final ImportProgress progress;
    private final CompletableFuture<ImportSummary> result;
    private volatile Instant finishedAt;

    public ImportJob(String id, ImportProgress progress, CompletableFuture<ImportSummary> result) {
        this.id = id;
        this.progress = progress;
        // the end time is set before anyone waiting on the result sees it complete
        this.result = result.whenComplete((summary, failure) -> finishedAt = Instant.now());
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return progress.getSource();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * @return when the run ended, null while it is running
     */
    public Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * @return true once the run has been over for longer than {@code retention}
     */
    public boolean isExpired(Instant now, Duration retention) {
        Instant ended = finishedAt;
        return ended != null && !ended.plus(retention).isAfter(now);
    }

    /**
     * Final summary once the run has ended, otherwise a RUNNING snapshot.
     */
    public ImportSummary getSummary() {
        if (result.isDone() && !result.isCompletedExceptionally()) {
            return result.join();
        }
        if (result.isCompletedExceptionally()) {
            return progress.snapshot(ImportStatus.FAILED, "INTERNAL_ERROR", "Import ended unexpectedly");
        }
        return progress.snapshot(ImportStatus.RUNNING, null, "Import in progress");
    }

    /**
     * @return false when the run had already ended
     */
    public boolean cancel() {
        if (result.isDone()) {
            return false;
        }
        progress.requestCancel();
        return true;
    }

    public CompletableFuture<ImportSummary> getResult() {
        return result;
    }
}
