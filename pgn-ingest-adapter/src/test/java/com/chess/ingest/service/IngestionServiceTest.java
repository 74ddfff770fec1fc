package com.chess.ingest.service;

import com.chess.ingest.config.IngestProperties;
import com.chess.ingest.dto.IngestStatusResponse;
import com.chess.ingest.exception.InputUnreadableException;
import com.chess.ingest.exception.ResourceNotFoundException;
import com.chess.ingest.model.ImportRunDocument;
import com.chess.ingest.model.IngestionResult;
import com.chess.ingest.pgn.PgnFixtures;
import com.chess.ingest.pipeline.ImportJob;
import com.chess.ingest.pipeline.ImportPipeline;
import com.chess.ingest.pipeline.ImportStatus;
import com.chess.ingest.pipeline.ImportSummary;
import com.chess.ingest.repository.ImportRunRepository;
import com.chess.ingest.store.InMemoryGameStore;
import com.chess.ingest.store.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock
    private ImportRunRepository importRunRepository;

    @TempDir
    Path tempDir;

    private InMemoryGameStore store;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryGameStore();
        IngestProperties properties = new IngestProperties();
        properties.setBatchSize(5);
        properties.setUploadDirectory(tempDir.resolve("uploads").toString());
        properties.setFailedBatchDirectory(tempDir.resolve("failed").toString());
        service = new IngestionService(store, importRunRepository, properties, delay -> { });
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private Path writePgn(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void setupEnsuresSchema() {
        IngestionResult result = service.setup();

        assertThat(result.isSuccess()).isTrue();
        assertThat(store.getSchemaCalls()).isEqualTo(1);
    }

    @Test
    void importFileCommitsGamesAndRecordsTheRun() throws IOException {
        Path file = writePgn("games.pgn", PgnFixtures.games(12));

        IngestionResult result = service.importFile(file.toString(), 0);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCount()).isEqualTo(12);
        assertThat(result.getSummary().status()).isEqualTo(ImportStatus.COMPLETED);
        assertThat(store.games()).hasSize(12);

        ArgumentCaptor<ImportRunDocument> run = ArgumentCaptor.forClass(ImportRunDocument.class);
        verify(importRunRepository).save(run.capture());
        assertThat(run.getValue().getSource()).isEqualTo(file.toString());
        assertThat(run.getValue().getStatus()).isEqualTo("COMPLETED");
        assertThat(run.getValue().getCommitted()).isEqualTo(12);
        assertThat(run.getValue().getBatchesCommitted()).isEqualTo(3);
    }

    @Test
    void missingFileIsUnreadable() {
        String missing = tempDir.resolve("nope.pgn").toString();

        assertThatThrownBy(() -> service.importFile(missing, 0))
                .isInstanceOf(InputUnreadableException.class)
                .hasMessageContaining("nope.pgn");
        assertThatThrownBy(() -> service.importFile(" ", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unavailableStoreFailsTheImport() throws IOException {
        store.failAllCommits(new StoreUnavailableException("connection refused", null));
        Path file = writePgn("games.pgn", PgnFixtures.games(3));

        IngestionResult result = service.importFile(file.toString(), 0);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo(ImportPipeline.STORE_UNAVAILABLE);
        assertThat(result.getSummary().status()).isEqualTo(ImportStatus.FAILED);
    }

    @Test
    void runHistoryFailureDoesNotFailTheImport() throws IOException {
        when(importRunRepository.save(any(ImportRunDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("import_runs unavailable"));
        Path file = writePgn("games.pgn", PgnFixtures.games(3));

        IngestionResult result = service.importFile(file.toString(), 0);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCount()).isEqualTo(3);
    }

    @Test
    void backgroundImportRunsToCompletion() throws Exception {
        when(importRunRepository.findTop10ByOrderByStartedAtDesc()).thenReturn(List.of());
        Path file = writePgn("games.pgn", PgnFixtures.games(20));

        ImportJob job = service.startImport(file.toString(), 0);
        ImportSummary summary = job.getResult().get(10, TimeUnit.SECONDS);

        assertThat(summary.status()).isEqualTo(ImportStatus.COMPLETED);
        assertThat(summary.committed()).isEqualTo(20);
        assertThat(service.findJob(job.getId())).containsSame(job);

        IngestStatusResponse status = service.status();
        assertThat(status.collections().games()).isEqualTo(20);
        assertThat(status.activeJobs()).isEmpty();
    }

    @Test
    void cancellingARunningJobKeepsWhatWasCommitted() throws Exception {
        CountDownLatch committing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store.beforeCommit(batch -> {
            committing.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Path file = writePgn("games.pgn", PgnFixtures.games(200));

        ImportJob job = service.startImport(file.toString(), 0);
        assertThat(committing.await(5, TimeUnit.SECONDS)).isTrue();
        service.cancelJob(job.getId());
        release.countDown();
        ImportSummary summary = job.getResult().get(10, TimeUnit.SECONDS);

        assertThat(summary.status()).isEqualTo(ImportStatus.CANCELLED);
        assertThat(summary.committed()).isLessThan(200);
        assertThat(store.games()).hasSize((int) summary.committed());
    }

    @Test
    void cancellingAnUnknownJobIsNotFound() {
        assertThatThrownBy(() -> service.cancelJob("missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void uploadIsImportedAndSpoolFileRemoved() throws IOException {
        MockMultipartFile upload = new MockMultipartFile("file", "upload.pgn", "application/x-chess-pgn",
                PgnFixtures.games(3).getBytes(StandardCharsets.UTF_8));

        IngestionResult result = service.importUpload(upload, 0);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCount()).isEqualTo(3);
        assertThat(result.getSummary().source()).isEqualTo("upload.pgn");
        try (Stream<Path> spooled = Files.list(tempDir.resolve("uploads"))) {
            assertThat(spooled).isEmpty();
        }
    }

    @Test
    void finishedJobsAreEvictedAfterTheRetention() throws Exception {
        IngestProperties properties = new IngestProperties();
        properties.setFailedBatchDirectory(tempDir.resolve("failed").toString());
        properties.setJobRetention(Duration.ZERO);
        IngestionService shortLived = new IngestionService(store, importRunRepository, properties, delay -> { });
        try {
            ImportJob job = shortLived.startImport(writePgn("games.pgn", PgnFixtures.games(5)).toString(), 0);
            job.getResult().get(10, TimeUnit.SECONDS);

            assertThat(shortLived.findJob(job.getId())).isEmpty();
            assertThatThrownBy(() -> shortLived.cancelJob(job.getId())).isInstanceOf(ResourceNotFoundException.class);
        } finally {
            shortLived.shutdown();
        }
    }

    @Test
    void finishedJobsStayWithinTheRetention() throws Exception {
        ImportJob job = service.startImport(writePgn("games.pgn", PgnFixtures.games(5)).toString(), 0);
        job.getResult().get(10, TimeUnit.SECONDS);

        service.evictExpiredJobs();

        assertThat(service.findJob(job.getId())).containsSame(job);
    }
}
