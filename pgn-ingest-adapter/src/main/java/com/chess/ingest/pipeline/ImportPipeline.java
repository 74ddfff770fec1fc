package com.chess.ingest.pipeline;

import com.chess.ingest.pgn.ParseOutcome;
import com.chess.ingest.pgn.PgnRecordParser;
import com.chess.ingest.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * One import run: read, parse, buffer and commit.
 * <p>
 * Parsing runs on the calling thread while the previous batch commits on a
 * dedicated commit thread. The next batch is only handed over once the one in
 * flight has finished, so batches commit one at a time and in input order.
 * A pipeline runs once.
 */
public class ImportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ImportPipeline.class);

    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    public static final String INPUT_UNREADABLE = "INPUT_UNREADABLE";

    private final PgnRecordParser parser;
    private final BatchCommitter committer;
    private final ImportProgress progress;
    private final int batchSize;
    private final long maxBufferBytes;
    private final AtomicBoolean started = new AtomicBoolean();

    private ExecutorService commitExecutor;
    private Future<BatchOutcome> inFlight;

    public ImportPipeline(PgnRecordParser parser, BatchCommitter committer, ImportProgress progress,
                          int batchSize, long maxBufferBytes) {
        this.parser = parser;
        this.committer = committer;
        this.progress = progress;
        this.batchSize = batchSize;
        this.maxBufferBytes = maxBufferBytes;
    }

    /**
     * @param maxGames stop after this many accepted records; 0 or less means no limit
     * @return the final summary; fatal conditions are reported as status FAILED, not thrown
     */
    public ImportSummary run(BufferedReader input, long maxGames) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already ran for " + progress.getSource());
        }
        log.info("Import started: source={} batchSize={} maxBufferBytes={} maxGames={}",
                progress.getSource(), batchSize, maxBufferBytes, maxGames > 0 ? maxGames : "unlimited");

        commitExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "commit-" + progress.getSource());
            thread.setDaemon(true);
            return thread;
        });
        IngestionBuffer buffer = new IngestionBuffer(batchSize, maxBufferBytes, this::dispatch);

        ImportSummary summary;
        try (Stream<ParseOutcome> parsed = parser.parse(input)) {
            Iterator<ParseOutcome> outcomes = parsed.iterator();
            while (!progress.isCancelRequested() && !limitReached(maxGames) && outcomes.hasNext()) {
                ParseOutcome outcome = outcomes.next();
                if (outcome.isAccepted()) {
                    progress.recordAccepted();
                    buffer.add(outcome.record());
                    progress.recordBufferPeak(buffer.getPeakBytes());
                } else {
                    progress.recordRejected(outcome.rejection());
                }
            }
            buffer.flush();
            awaitInFlight();
            summary = finish(progress.isCancelRequested() ? ImportStatus.CANCELLED : completedStatus(), null, null);
        } catch (StoreUnavailableException e) {
            log.error("Import {} stopped: store unavailable", progress.getSource(), e);
            summary = finish(ImportStatus.FAILED, STORE_UNAVAILABLE, "Store unavailable: " + e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("Import {} stopped: input unreadable", progress.getSource(), e);
            awaitQuietly();
            summary = finish(ImportStatus.FAILED, INPUT_UNREADABLE, "Input unreadable: " + e.getCause().getMessage());
        } finally {
            commitExecutor.shutdown();
        }
        return summary;
    }

    public ImportProgress getProgress() {
        return progress;
    }

    private boolean limitReached(long maxGames) {
        return maxGames > 0 && progress.getAccepted() >= maxGames;
    }

    private ImportStatus completedStatus() {
        return progress.getBatchesFailed() > 0 ? ImportStatus.COMPLETED_WITH_FAILURES : ImportStatus.COMPLETED;
    }

    private ImportSummary finish(ImportStatus status, String errorType, String message) {
        String text = message != null ? message : String.format("%s: %d processed, %d committed, %d duplicates, %d rejected, %d failed batches",
                status, progress.getProcessed(), progress.getCommitted(), progress.getDuplicates(),
                progress.getRejected(), progress.getBatchesFailed());
        ImportSummary summary = progress.snapshot(status, errorType, text);
        log.info("Import finished: source={} status={} processed={} accepted={} rejected={} committed={} duplicates={} failedBatches={}",
                summary.source(), summary.status(), summary.processed(), summary.accepted(), summary.rejected(),
                summary.committed(), summary.duplicates(), summary.batchesFailed());
        return summary;
    }

    private void dispatch(Batch batch) {
        awaitInFlight();
        inFlight = commitExecutor.submit(() -> committer.commit(batch, progress));
    }

    /**
     * Block until the in-flight commit ends. An interrupt while waiting becomes
     * a cancel request; the commit itself is never interrupted.
     */
    private void awaitInFlight() {
        Future<BatchOutcome> pending = inFlight;
        if (pending == null) {
            return;
        }
        inFlight = null;
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    pending.get();
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                    progress.requestCancel();
                    log.info("Import {} interrupted, finishing the in-flight batch", progress.getSource());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw new IllegalStateException("Commit failed", cause);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void awaitQuietly() {
        try {
            awaitInFlight();
        } catch (StoreUnavailableException e) {
            log.warn("In-flight batch also failed: {}", e.getMessage());
        }
    }
}
