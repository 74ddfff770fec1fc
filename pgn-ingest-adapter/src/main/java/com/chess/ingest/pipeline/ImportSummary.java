package com.chess.ingest.pipeline;

import com.chess.ingest.pgn.Rejection;
import com.chess.ingest.pgn.RejectionReason;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Counters and outcome of one import run. Taken as a snapshot while the run
 * is going (status RUNNING) and once more when it ends.
 *
 * @param processed          blocks read, accepted + rejected
 * @param committed          games written to the store
 * @param duplicates         accepted games skipped because they were already stored
 * @param rejectionSamples   the first rejections of the run, capped
 * @param failedBatches      batches that could not be committed, with the spool file holding their records
 */
public record ImportSummary(
        String source,
        ImportStatus status,
        String errorType,
        String message,
        long processed,
        long accepted,
        long rejected,
        long committed,
        long duplicates,
        long staleRatingPoints,
        long batchesCommitted,
        long batchesFailed,
        long peakBufferBytes,
        Map<RejectionReason, Long> rejectedByReason,
        List<Rejection> rejectionSamples,
        List<FailedBatch> failedBatches,
        Instant startedAt,
        Instant finishedAt
) {

    public ImportSummary {
        rejectedByReason = Map.copyOf(rejectedByReason);
        rejectionSamples = List.copyOf(rejectionSamples);
        failedBatches = List.copyOf(failedBatches);
    }
}
