package com.chess.ingest.pipeline;

public enum ImportStatus {
    RUNNING,
    COMPLETED,
    /** Finished, but one or more batches could not be committed */
    COMPLETED_WITH_FAILURES,
    CANCELLED,
    FAILED
}
