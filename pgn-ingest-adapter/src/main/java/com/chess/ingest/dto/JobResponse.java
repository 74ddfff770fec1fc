package com.chess.ingest.dto;

import com.chess.ingest.pipeline.ImportJob;
import com.chess.ingest.pipeline.ImportSummary;

/**
 * State of an asynchronous import, as returned by the job endpoints.
 */
public record JobResponse(
        String jobId,
        String source,
        boolean done,
        ImportSummary summary
) {
    public static JobResponse from(ImportJob job) {
        return new JobResponse(job.getId(), job.getSource(), job.isDone(), job.getSummary());
    }
}
