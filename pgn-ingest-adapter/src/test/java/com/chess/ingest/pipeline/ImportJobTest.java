package com.chess.ingest.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ImportJobTest {

    private final ImportProgress progress = new ImportProgress("games.pgn", 10);
    private final CompletableFuture<ImportSummary> result = new CompletableFuture<>();
    private final ImportJob job = new ImportJob("job-1", progress, result);

    @Test
    void runningJobReportsLiveCounters() {
        progress.recordAccepted();
        progress.recordAccepted();

        ImportSummary summary = job.getSummary();

        assertThat(job.isDone()).isFalse();
        assertThat(summary.status()).isEqualTo(ImportStatus.RUNNING);
        assertThat(summary.accepted()).isEqualTo(2);
        assertThat(summary.finishedAt()).isNull();
        assertThat(job.getSource()).isEqualTo("games.pgn");
    }

    @Test
    void finishedJobReportsItsFinalSummary() {
        ImportSummary done = progress.snapshot(ImportStatus.COMPLETED, null, "done");
        result.complete(done);

        assertThat(job.isDone()).isTrue();
        assertThat(job.getSummary()).isSameAs(done);
        assertThat(job.cancel()).isFalse();
        assertThat(progress.isCancelRequested()).isFalse();
    }

    @Test
    void cancelRequestsStopWhileRunning() {
        assertThat(job.cancel()).isTrue();
        assertThat(progress.isCancelRequested()).isTrue();
    }

    @Test
    void unexpectedFailureIsReportedAsFailed() {
        result.completeExceptionally(new IllegalStateException("boom"));

        ImportSummary summary = job.getSummary();

        assertThat(summary.status()).isEqualTo(ImportStatus.FAILED);
        assertThat(summary.errorType()).isEqualTo("INTERNAL_ERROR");
    }

    @Test
    void finishedJobExpiresAfterTheRetention() {
        Duration retention = Duration.ofMinutes(30);
        assertThat(job.isExpired(Instant.now().plus(Duration.ofDays(1)), retention)).isFalse();

        result.complete(progress.snapshot(ImportStatus.COMPLETED, null, "done"));
        Instant finishedAt = job.getFinishedAt();

        assertThat(finishedAt).isNotNull();
        assertThat(job.isExpired(finishedAt.plus(Duration.ofMinutes(29)), retention)).isFalse();
        assertThat(job.isExpired(finishedAt.plus(retention), retention)).isTrue();
    }
}
