package com.chess.ingest.model;

import com.chess.ingest.pipeline.ImportSummary;

/**
 * Result object for ingestion operations.
 * Encapsulates success/failure state with error details, and the run summary for imports.
 */
public class IngestionResult {

    private final boolean success;
    private final long count;
    private final String message;
    private final String errorType;
    private final ImportSummary summary;

    private IngestionResult(boolean success, long count, String message, String errorType, ImportSummary summary) {
        this.success = success;
        this.count = count;
        this.message = message;
        this.errorType = errorType;
        this.summary = summary;
    }

    public static IngestionResult success(long count, String message) {
        return new IngestionResult(true, count, message, null, null);
    }

    public static IngestionResult failure(String message, String errorType) {
        return new IngestionResult(false, 0, message, errorType, null);
    }

    /**
     * Map a finished run to a result. Failed batches make it a partial success;
     * a run that ended on a fatal error is a failure, with its summary still attached.
     */
    public static IngestionResult fromSummary(ImportSummary summary) {
        return switch (summary.status()) {
            case RUNNING, COMPLETED, CANCELLED -> new IngestionResult(true, summary.committed(), summary.message(), null, summary);
            case COMPLETED_WITH_FAILURES ->
                    new IngestionResult(true, summary.committed(), summary.message(), "PARTIAL_SUCCESS", summary);
            case FAILED -> new IngestionResult(false, summary.committed(), summary.message(), summary.errorType(), summary);
        };
    }

    public boolean isSuccess() {
        return success;
    }

    public long getCount() {
        return count;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorType() {
        return errorType;
    }

    public ImportSummary getSummary() {
        return summary;
    }
}
