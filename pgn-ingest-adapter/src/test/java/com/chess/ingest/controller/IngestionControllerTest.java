package com.chess.ingest.controller;

import com.chess.ingest.dto.JobResponse;
import com.chess.ingest.exception.ResourceNotFoundException;
import com.chess.ingest.model.IngestionResult;
import com.chess.ingest.pipeline.ImportJob;
import com.chess.ingest.pipeline.ImportPipeline;
import com.chess.ingest.pipeline.ImportProgress;
import com.chess.ingest.pipeline.ImportStatus;
import com.chess.ingest.pipeline.ImportSummary;
import com.chess.ingest.service.IngestionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionControllerTest {

    @Mock
    private IngestionService ingestionService;

    @InjectMocks
    private IngestionController controller;

    private static ImportSummary summary(ImportStatus status, String errorType) {
        ImportProgress progress = new ImportProgress("games.pgn", 10);
        progress.recordAccepted();
        return progress.snapshot(status, errorType, status.name());
    }

    @Test
    @SuppressWarnings("unchecked")
    void completedImportIsOk() {
        when(ingestionService.importFile("/data/games.pgn", 0))
                .thenReturn(IngestionResult.fromSummary(summary(ImportStatus.COMPLETED, null)));

        ResponseEntity<?> response = controller.importFile("/data/games.pgn", 0, false);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = (Map<String, Object>) response.getBody();
        assertThat(body).containsEntry("success", true).containsKey("summary").doesNotContainKey("errorType");
    }

    @Test
    @SuppressWarnings("unchecked")
    void partialSuccessIsStillOk() {
        when(ingestionService.importFile("/data/games.pgn", 0))
                .thenReturn(IngestionResult.fromSummary(summary(ImportStatus.COMPLETED_WITH_FAILURES, null)));

        ResponseEntity<?> response = controller.importFile("/data/games.pgn", 0, false);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((Map<String, Object>) response.getBody()).containsEntry("errorType", "PARTIAL_SUCCESS");
    }

    @Test
    void unavailableStoreIsServiceUnavailable() {
        when(ingestionService.importFile("/data/games.pgn", 0)).thenReturn(IngestionResult.fromSummary(
                summary(ImportStatus.FAILED, ImportPipeline.STORE_UNAVAILABLE)));

        ResponseEntity<?> response = controller.importFile("/data/games.pgn", 0, false);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void unreadableInputIsBadRequest() {
        when(ingestionService.importFile("/data/games.pgn", 0)).thenReturn(IngestionResult.fromSummary(
                summary(ImportStatus.FAILED, ImportPipeline.INPUT_UNREADABLE)));

        ResponseEntity<?> response = controller.importFile("/data/games.pgn", 0, false);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void asyncImportReturnsAcceptedJob() {
        ImportJob job = new ImportJob("job-1", new ImportProgress("/data/games.pgn", 10), new CompletableFuture<>());
        when(ingestionService.startImport("/data/games.pgn", 100)).thenReturn(job);

        ResponseEntity<?> response = controller.importFile("/data/games.pgn", 100, true);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        JobResponse body = (JobResponse) response.getBody();
        assertThat(body.jobId()).isEqualTo("job-1");
        assertThat(body.done()).isFalse();
        assertThat(body.summary().status()).isEqualTo(ImportStatus.RUNNING);
    }

    @Test
    void unknownJobIsNotFound() {
        when(ingestionService.findJob("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.getJob("missing")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void emptyUploadIsRejected() {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.pgn", "application/x-chess-pgn", new byte[0]);

        assertThatThrownBy(() -> controller.importUpload(empty, 0, false))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(ingestionService);
    }
}
