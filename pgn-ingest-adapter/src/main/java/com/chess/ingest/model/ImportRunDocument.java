package com.chess.ingest.model;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Metadata for one import run, written when the run ends.
 */
@Document(collection = "import_runs")
public class ImportRunDocument extends BaseDocument {

    private String source;
    private String status;

    @Indexed
    private Instant startedAt;
    private Instant finishedAt;

    private long processed;
    private long accepted;
    private long rejected;
    private long committed;
    private long duplicates;
    private int batchesCommitted;
    private int batchesFailed;
    private String message;

    public ImportRunDocument() {
        super();
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public long getProcessed() {
        return processed;
    }

    public void setProcessed(long processed) {
        this.processed = processed;
    }

    public long getAccepted() {
        return accepted;
    }

    public void setAccepted(long accepted) {
        this.accepted = accepted;
    }

    public long getRejected() {
        return rejected;
    }

    public void setRejected(long rejected) {
        this.rejected = rejected;
    }

    public long getCommitted() {
        return committed;
    }

    public void setCommitted(long committed) {
        this.committed = committed;
    }

    public long getDuplicates() {
        return duplicates;
    }

    public void setDuplicates(long duplicates) {
        this.duplicates = duplicates;
    }

    public int getBatchesCommitted() {
        return batchesCommitted;
    }

    public void setBatchesCommitted(int batchesCommitted) {
        this.batchesCommitted = batchesCommitted;
    }

    public int getBatchesFailed() {
        return batchesFailed;
    }

    public void setBatchesFailed(int batchesFailed) {
        this.batchesFailed = batchesFailed;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
