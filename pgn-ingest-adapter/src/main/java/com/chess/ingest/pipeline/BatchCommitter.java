package com.chess.ingest.pipeline;

import com.chess.ingest.store.GameStore;
import com.chess.ingest.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves and commits one batch, retrying with backoff.
 * <p>
 * A batch that still fails after the last attempt is spooled to a PGN file,
 * recorded as failed, and the run goes on, unless the store is unreachable: then
 * {@link StoreUnavailableException} ends the run. Either way the store holds
 * the batch completely or not at all.
 * <p>
 * Resolution and commit run under the commit lane. Committers that share one
 * lane never resolve against a store another of them is halfway through writing.
 */
public class BatchCommitter {

    private static final Logger log = LoggerFactory.getLogger(BatchCommitter.class);

    private final EntityResolver resolver;
    private final GameStore store;
    private final int maxAttempts;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final int progressIntervalBatches;
    private final FailedBatchSpool failedBatchSpool;
    private final Lock commitLane;

    public BatchCommitter(EntityResolver resolver, GameStore store, int maxAttempts, BackoffPolicy backoff,
                          Sleeper sleeper, int progressIntervalBatches, FailedBatchSpool failedBatchSpool) {
        this(resolver, store, maxAttempts, backoff, sleeper, progressIntervalBatches, failedBatchSpool,
                new ReentrantLock());
    }

    public BatchCommitter(EntityResolver resolver, GameStore store, int maxAttempts, BackoffPolicy backoff,
                          Sleeper sleeper, int progressIntervalBatches, FailedBatchSpool failedBatchSpool,
                          Lock commitLane) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.resolver = resolver;
        this.store = store;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.progressIntervalBatches = Math.max(1, progressIntervalBatches);
        this.failedBatchSpool = failedBatchSpool;
        this.commitLane = commitLane;
    }

    public BatchOutcome commit(Batch batch, ImportProgress progress) {
        RuntimeException lastFailure = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                ResolvedBatch resolved = resolveAndCommit(batch);
                progress.recordCommitted(resolved);
                log.debug("Batch {} committed on attempt {}: {} games, {} duplicates",
                        batch.sequence(), attempt, resolved.games().size(), resolved.duplicatesSkipped());
                logProgress(progress);
                return BatchOutcome.committed(batch.sequence(), attempt, resolved);
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Batch {} attempt {}/{} failed: {}", batch.sequence(), attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts && !pause(backoff.delayAfter(attempt))) {
                break;
            }
        }

        if (lastFailure instanceof StoreUnavailableException) {
            log.error("Store unavailable, giving up on batch {} after {} attempts", batch.sequence(), attempt);
            throw (StoreUnavailableException) lastFailure;
        }

        String spoolFile = spool(batch);
        FailedBatch failed = new FailedBatch(batch.sequence(), attempt, String.valueOf(lastFailure.getMessage()),
                batch.size(), spoolFile);
        progress.recordFailed(failed);
        log.error("Batch {} failed after {} attempts, {} records spooled to {}",
                batch.sequence(), attempt, batch.size(), spoolFile, lastFailure);
        logProgress(progress);
        return BatchOutcome.failed(failed);
    }

    private String spool(Batch batch) {
        try {
            Path file = failedBatchSpool.write(batch.sequence(), batch.records());
            return file.toString();
        } catch (IOException e) {
            log.error("Could not spool the {} records of failed batch {} to {}",
                    batch.size(), batch.sequence(), failedBatchSpool.getDirectory(), e);
            return null;
        }
    }

    private ResolvedBatch resolveAndCommit(Batch batch) {
        commitLane.lock();
        try {
            return store.commit(resolver.resolve(batch));
        } finally {
            commitLane.unlock();
        }
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off, no further attempts");
            return false;
        }
    }

    private void logProgress(ImportProgress progress) {
        long batches = progress.getBatches();
        if (batches % progressIntervalBatches != 0) {
            return;
        }
        log.info("import.progress source={} batches={} processed={} accepted={} rejected={} committed={} duplicates={} failedBatches={}",
                progress.getSource(),
                batches,
                progress.getProcessed(),
                progress.getAccepted(),
                progress.getRejected(),
                progress.getCommitted(),
                progress.getDuplicates(),
                progress.getBatchesFailed());
    }
}
