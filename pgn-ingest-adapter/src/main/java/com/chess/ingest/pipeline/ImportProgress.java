package com.chess.ingest.pipeline;

import com.chess.ingest.pgn.Rejection;
import com.chess.ingest.pgn.RejectionReason;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters of one import run. Written by the parsing thread and the
 * commit thread, read by status requests.
 */
public class ImportProgress {

    private final String source;
    private final int rejectionSampleSize;
    private final Instant startedAt = Instant.now();

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong committed = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong staleRatingPoints = new AtomicLong();
    private final AtomicLong batchesCommitted = new AtomicLong();
    private final AtomicLong batchesFailed = new AtomicLong();
    private final AtomicLong peakBufferBytes = new AtomicLong();

    private final Map<RejectionReason, Long> rejectedByReason = new EnumMap<>(RejectionReason.class);
    private final List<Rejection> rejectionSamples = new ArrayList<>();
    private final List<FailedBatch> failedBatches = new CopyOnWriteArrayList<>();

    private volatile boolean cancelRequested;

    public ImportProgress(String source, int rejectionSampleSize) {
        this.source = source;
        this.rejectionSampleSize = rejectionSampleSize;
    }

    public void recordAccepted() {
        accepted.incrementAndGet();
    }

    public synchronized void recordRejected(Rejection rejection) {
        rejected.incrementAndGet();
        rejectedByReason.merge(rejection.reason(), 1L, Long::sum);
        if (rejectionSamples.size() < rejectionSampleSize) {
            rejectionSamples.add(rejection);
        }
    }

    void recordCommitted(ResolvedBatch batch) {
        committed.addAndGet(batch.games().size());
        duplicates.addAndGet(batch.duplicatesSkipped());
        staleRatingPoints.addAndGet(batch.staleRatingPoints());
        batchesCommitted.incrementAndGet();
    }

    void recordFailed(FailedBatch batch) {
        failedBatches.add(batch);
        batchesFailed.incrementAndGet();
    }

    void recordBufferPeak(long bytes) {
        peakBufferBytes.accumulateAndGet(bytes, Math::max);
    }

    /**
     * Ask the run to stop reading. Already buffered records are still committed.
     */
    public void requestCancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public String getSource() {
        return source;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getProcessed() {
        return accepted.get() + rejected.get();
    }

    public long getAccepted() {
        return accepted.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    public long getCommitted() {
        return committed.get();
    }

    public long getDuplicates() {
        return duplicates.get();
    }

    public long getBatchesCommitted() {
        return batchesCommitted.get();
    }

    public long getBatchesFailed() {
        return batchesFailed.get();
    }

    public long getBatches() {
        return batchesCommitted.get() + batchesFailed.get();
    }

    public List<FailedBatch> getFailedBatches() {
        return List.copyOf(failedBatches);
    }

    public synchronized ImportSummary snapshot(ImportStatus status, String errorType, String message) {
        return new ImportSummary(
                source,
                status,
                errorType,
                message,
                getProcessed(),
                accepted.get(),
                rejected.get(),
                committed.get(),
                duplicates.get(),
                staleRatingPoints.get(),
                batchesCommitted.get(),
                batchesFailed.get(),
                peakBufferBytes.get(),
                rejectedByReason,
                rejectionSamples,
                failedBatches,
                startedAt,
                status == ImportStatus.RUNNING ? null : Instant.now()
        );
    }
}
