package com.chess.ingest.pipeline;

/**
 * What happened to one batch.
 *
 * @param failure null when the batch was committed
 */
public record BatchOutcome(
        long sequence,
        int attempts,
        int gamesCommitted,
        int duplicatesSkipped,
        FailedBatch failure
) {

    static BatchOutcome committed(long sequence, int attempts, ResolvedBatch resolved) {
        return new BatchOutcome(sequence, attempts, resolved.games().size(), resolved.duplicatesSkipped(), null);
    }

    static BatchOutcome failed(FailedBatch failure) {
        return new BatchOutcome(failure.sequence(), failure.attempts(), 0, 0, failure);
    }

    public boolean isCommitted() {
        return failure == null;
    }
}
