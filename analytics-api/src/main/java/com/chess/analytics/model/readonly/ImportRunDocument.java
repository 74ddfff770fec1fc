package com.chess.analytics.model.readonly;

import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Read-only model for import run metadata.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "import_runs")
public class ImportRunDocument {

    @Id
    private String id;

    private String source;
    private String status;
    private Instant startedAt;
    private Instant finishedAt;
    private long processed;
    private long accepted;
    private long rejected;
    private long committed;
    private long duplicates;
    private int batchesFailed;
    private String message;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getSource() { return source; }
    public String getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public long getProcessed() { return processed; }
    public long getAccepted() { return accepted; }
    public long getRejected() { return rejected; }
    public long getCommitted() { return committed; }
    public long getDuplicates() { return duplicates; }
    public int getBatchesFailed() { return batchesFailed; }
    public String getMessage() { return message; }
}
