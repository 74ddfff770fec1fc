package com.chess.ingest.service;

import com.chess.ingest.config.IngestProperties;
import com.chess.ingest.dto.IngestStatusResponse;
import com.chess.ingest.dto.JobResponse;
import com.chess.ingest.exception.InputUnreadableException;
import com.chess.ingest.exception.ResourceNotFoundException;
import com.chess.ingest.model.ImportRunDocument;
import com.chess.ingest.model.IngestionResult;
import com.chess.ingest.pgn.PgnRecordParser;
import com.chess.ingest.pipeline.BatchCommitter;
import com.chess.ingest.pipeline.EntityResolver;
import com.chess.ingest.pipeline.FailedBatchSpool;
import com.chess.ingest.pipeline.ImportJob;
import com.chess.ingest.pipeline.ImportPipeline;
import com.chess.ingest.pipeline.ImportProgress;
import com.chess.ingest.pipeline.ImportSummary;
import com.chess.ingest.pipeline.Sleeper;
import com.chess.ingest.repository.ImportRunRepository;
import com.chess.ingest.store.GameStore;
import com.chess.ingest.store.StoreUnavailableException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs PGN imports into MongoDB, synchronously or as background jobs, and
 * records every finished run in import_runs.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    /**
     * How long shutdown waits for running imports to commit their last batch
     */
    private static final int SHUTDOWN_GRACE_SECONDS = 60;

    private final GameStore gameStore;
    private final ImportRunRepository importRunRepository;
    private final IngestProperties properties;
    private final Sleeper sleeper;
    private final ExecutorService jobExecutor;
    /** Running jobs, and finished ones until the job retention has passed */
    private final Map<String, ImportJob> jobs = new ConcurrentHashMap<>();

    /**
     * Shared by every import, sync or async, so one batch at a time is resolved and committed
     */
    private final Lock commitLane = new ReentrantLock(true);

    @Autowired
    public IngestionService(
            GameStore gameStore,
            ImportRunRepository importRunRepository,
            IngestProperties properties
    ) {
        this(gameStore, importRunRepository, properties, Sleeper.THREAD);
    }

    IngestionService(
            GameStore gameStore,
            ImportRunRepository importRunRepository,
            IngestProperties properties,
            Sleeper sleeper
    ) {
        this.gameStore = gameStore;
        this.importRunRepository = importRunRepository;
        this.properties = properties;
        this.sleeper = sleeper;
        AtomicInteger threadCount = new AtomicInteger();
        this.jobExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentImports()), runnable -> {
            Thread thread = new Thread(runnable, "import-job-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Create collections and indexes
     */
    public IngestionResult setup() {
        log.info("Setting up collections and indexes...");
        try {
            gameStore.ensureSchema();
            return IngestionResult.success(0, "Collections and indexes are in place");
        } catch (StoreUnavailableException e) {
            log.error("Setup failed: {}", e.getMessage());
            return IngestionResult.failure("Setup failed: " + e.getMessage(), ImportPipeline.STORE_UNAVAILABLE);
        }
    }

    /**
     * Import a PGN file on the calling thread.
     *
     * @throws InputUnreadableException if the file cannot be opened
     */
    public IngestionResult importFile(String path, long maxGames) {
        BufferedReader input = openInput(path);
        ImportPipeline pipeline = newPipeline(path);
        return IngestionResult.fromSummary(runAndRecord(pipeline, input, maxGames));
    }

    /**
     * Start importing a PGN file in the background. The file is opened before
     * this returns, so an unreadable path fails the request itself.
     */
    public ImportJob startImport(String path, long maxGames) {
        return submit(path, openInput(path), maxGames, null);
    }

    /**
     * Import an uploaded file on the calling thread. The upload is spooled to
     * disk first and removed after the run.
     */
    public IngestionResult importUpload(MultipartFile file, long maxGames) {
        Path spooled = storeUpload(file);
        try {
            BufferedReader input = openInput(spooled.toString());
            return IngestionResult.fromSummary(runAndRecord(newPipeline(uploadName(file, spooled)), input, maxGames));
        } finally {
            deleteQuietly(spooled);
        }
    }

    public ImportJob startUploadImport(MultipartFile file, long maxGames) {
        Path spooled = storeUpload(file);
        BufferedReader input;
        try {
            input = openInput(spooled.toString());
        } catch (InputUnreadableException e) {
            deleteQuietly(spooled);
            throw e;
        }
        return submit(uploadName(file, spooled), input, maxGames, spooled);
    }

    public Optional<ImportJob> findJob(String jobId) {
        evictExpiredJobs();
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Request cancellation. The job stops reading, commits what it already buffered, then ends.
     */
    public ImportJob cancelJob(String jobId) {
        ImportJob job = findJob(jobId).orElseThrow(() -> new ResourceNotFoundException("Import job", jobId));
        if (job.cancel()) {
            log.info("Cancellation requested for import job {} ({})", jobId, job.getSource());
        }
        return job;
    }

    public IngestStatusResponse status() {
        evictExpiredJobs();
        List<JobResponse> active = jobs.values().stream()
                .filter(job -> !job.isDone())
                .map(JobResponse::from)
                .toList();
        return new IngestStatusResponse(gameStore.status(), importRunRepository.findTop10ByOrderByStartedAtDesc(), active);
    }

    Path storeUpload(MultipartFile file) {
        try {
            Path directory = Path.of(properties.getUploadDirectory());
            Files.createDirectories(directory);
            Path target = Files.createTempFile(directory, "pgn-upload-", ".pgn");
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Spooled upload {} ({} bytes) to {}", file.getOriginalFilename(), file.getSize(), target);
            return target;
        } catch (IOException e) {
            throw new InputUnreadableException("Could not store upload " + file.getOriginalFilename() + ": " + e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        jobs.values().forEach(ImportJob::cancel);
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Import jobs still running after {}s, shutting down anyway", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ImportJob submit(String source, BufferedReader input, long maxGames, Path cleanup) {
        String jobId = UUID.randomUUID().toString();
        ImportPipeline pipeline = newPipeline(source);
        CompletableFuture<ImportSummary> result = CompletableFuture.supplyAsync(() -> {
            try {
                return runAndRecord(pipeline, input, maxGames);
            } finally {
                if (cleanup != null) {
                    deleteQuietly(cleanup);
                }
            }
        }, jobExecutor);
        ImportJob job = new ImportJob(jobId, pipeline.getProgress(), result);
        evictExpiredJobs();
        jobs.put(jobId, job);
        log.info("Import job {} queued for {}", jobId, source);
        return job;
    }

    /**
     * Drop finished jobs once they are older than the retention. Their outcome stays in import_runs.
     */
    void evictExpiredJobs() {
        Instant now = Instant.now();
        jobs.values().removeIf(job -> {
            if (job.isExpired(now, properties.getJobRetention())) {
                log.debug("Evicting finished import job {} ({})", job.getId(), job.getSource());
                return true;
            }
            return false;
        });
    }

    private ImportPipeline newPipeline(String source) {
        ImportProgress progress = new ImportProgress(source, properties.getRejectionSampleSize());
        BatchCommitter committer = new BatchCommitter(
                new EntityResolver(gameStore),
                gameStore,
                properties.getMaxAttempts(),
                properties.toBackoffPolicy(),
                sleeper,
                properties.getProgressIntervalBatches(),
                new FailedBatchSpool(Path.of(properties.getFailedBatchDirectory())),
                commitLane
        );
        return new ImportPipeline(
                new PgnRecordParser(properties.toValidationRules()),
                committer,
                progress,
                properties.getBatchSize(),
                properties.getMaxBufferBytes()
        );
    }

    private ImportSummary runAndRecord(ImportPipeline pipeline, BufferedReader input, long maxGames) {
        // the pipeline closes the reader with its block stream
        ImportSummary summary = pipeline.run(input, maxGames);
        recordRun(summary);
        return summary;
    }

    private void recordRun(ImportSummary summary) {
        ImportRunDocument run = new ImportRunDocument();
        run.setSource(summary.source());
        run.setStatus(summary.status().name());
        run.setStartedAt(summary.startedAt());
        run.setFinishedAt(summary.finishedAt());
        run.setProcessed(summary.processed());
        run.setAccepted(summary.accepted());
        run.setRejected(summary.rejected());
        run.setCommitted(summary.committed());
        run.setDuplicates(summary.duplicates());
        run.setBatchesCommitted((int) summary.batchesCommitted());
        run.setBatchesFailed((int) summary.batchesFailed());
        run.setMessage(summary.message());
        try {
            importRunRepository.save(run);
        } catch (DataAccessException e) {
            log.warn("Could not record import run for {}: {}", summary.source(), e.getMessage());
        }
    }

    private BufferedReader openInput(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("An input path is required");
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new InputUnreadableException("Input file not found or not readable: " + path, null);
        }
        try {
            return Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputUnreadableException("Could not open " + path + ": " + e.getMessage(), e);
        }
    }

    private static String uploadName(MultipartFile file, Path spooled) {
        String name = file.getOriginalFilename();
        return name != null && !name.isBlank() ? name : spooled.getFileName().toString();
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete spooled upload {}: {}", file, e.getMessage());
        }
    }
}
