package com.chess.ingest.dto;

import com.chess.ingest.model.ImportRunDocument;
import com.chess.ingest.store.StoreStatus;

import java.util.List;

public record IngestStatusResponse(
        StoreStatus collections,
        List<ImportRunDocument> recentRuns,
        List<JobResponse> activeJobs
) {
}
