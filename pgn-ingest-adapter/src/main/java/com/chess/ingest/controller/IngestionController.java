package com.chess.ingest.controller;

import com.chess.ingest.dto.IngestStatusResponse;
import com.chess.ingest.dto.JobResponse;
import com.chess.ingest.exception.ResourceNotFoundException;
import com.chess.ingest.model.IngestionResult;
import com.chess.ingest.pipeline.ImportJob;
import com.chess.ingest.pipeline.ImportPipeline;
import com.chess.ingest.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoints to import PGN files into MongoDB.
 */
@RestController
@RequestMapping("/api/ingest")
@Tag(name = "Ingestion", description = "Endpoints to import PGN game collections and follow import jobs")
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/setup")
    @Operation(summary = "Create collections and indexes", description = "Safe to run repeatedly; existing indexes are left as they are")
    public ResponseEntity<Map<String, Object>> setup() {
        return buildResponse(ingestionService.setup());
    }

    @PostMapping("/import")
    @Operation(summary = "Import a PGN file",
               description = "Import a PGN file readable by the server. Use async=true to run it as a background job " +
                       "and poll /api/ingest/jobs/{jobId}")
    public ResponseEntity<?> importFile(
            @Parameter(description = "Path of the PGN file on the server", example = "/data/lichess_2023-01.pgn")
            @RequestParam String path,
            @Parameter(description = "Stop after this many accepted games (0 = no limit)")
            @RequestParam(defaultValue = "0") long maxGames,
            @Parameter(description = "Run in the background and return a job id")
            @RequestParam(defaultValue = "false") boolean async
    ) {
        if (async) {
            ImportJob job = ingestionService.startImport(path, maxGames);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
        }
        return buildResponse(ingestionService.importFile(path, maxGames));
    }

    @PostMapping(value = "/import/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Import an uploaded PGN file", description = "Same as /import, for a file sent with the request")
    public ResponseEntity<?> importUpload(
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Stop after this many accepted games (0 = no limit)")
            @RequestParam(defaultValue = "0") long maxGames,
            @Parameter(description = "Run in the background and return a job id")
            @RequestParam(defaultValue = "false") boolean async
    ) {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        if (async) {
            ImportJob job = ingestionService.startUploadImport(file, maxGames);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
        }
        return buildResponse(ingestionService.importUpload(file, maxGames));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Import job status", description = "Live counters while running, the final summary once done")
    public JobResponse getJob(@PathVariable String jobId) {
        return ingestionService.findJob(jobId)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Import job", jobId));
    }

    @DeleteMapping("/jobs/{jobId}")
    @Operation(summary = "Cancel an import job",
               description = "Stops reading input; games already buffered are still committed before the job ends")
    public JobResponse cancelJob(@PathVariable String jobId) {
        return JobResponse.from(ingestionService.cancelJob(jobId));
    }

    @GetMapping("/status")
    @Operation(summary = "Database status", description = "Collection counts, recent import runs and running jobs")
    public IngestStatusResponse status() {
        return ingestionService.status();
    }

    /**
     * Build a consistent response from an IngestionResult
     */
    private ResponseEntity<Map<String, Object>> buildResponse(IngestionResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", result.isSuccess());
        response.put("message", result.getMessage());
        response.put("count", result.getCount());

        if (result.getErrorType() != null) {
            response.put("errorType", result.getErrorType());
        }
        if (result.getSummary() != null) {
            response.put("summary", result.getSummary());
        }

        // Rejected records and failed batches stay 200; the two fatal conditions do not
        if (ImportPipeline.STORE_UNAVAILABLE.equals(result.getErrorType())) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        if (ImportPipeline.INPUT_UNREADABLE.equals(result.getErrorType())) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
