package com.chess.ingest.pipeline;

import com.chess.ingest.pgn.GameRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Accumulates validated records and hands them on in batches.
 * <p>
 * A flush happens when the record count reaches {@code maxRecords} or the
 * estimated footprint reaches {@code maxBytes}. A record that would take the
 * footprint past {@code maxBytes} flushes the current contents first, so the
 * footprint never exceeds the ceiling. The buffer is emptied before the flush
 * handler runs. Not thread-safe: one producer per buffer.
 */
public class IngestionBuffer {

    private final int maxRecords;
    private final long maxBytes;
    private final Consumer<Batch> flushHandler;

    private List<GameRecord> records = new ArrayList<>();
    private long estimatedBytes;
    private long peakBytes;
    private long nextSequence = 1;

    public IngestionBuffer(int maxRecords, long maxBytes, Consumer<Batch> flushHandler) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be positive: " + maxRecords);
        }
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.maxRecords = maxRecords;
        this.maxBytes = maxBytes;
        this.flushHandler = flushHandler;
    }

    /**
     * @throws IllegalArgumentException if the record alone is larger than the ceiling
     */
    public void add(GameRecord record) {
        long size = record.estimatedBytes();
        if (size > maxBytes) {
            throw new IllegalArgumentException(
                    String.format("Record of %d bytes can never fit a %d byte buffer", size, maxBytes));
        }
        if (!records.isEmpty() && estimatedBytes + size > maxBytes) {
            flush();
        }

        records.add(record);
        estimatedBytes += size;
        peakBytes = Math.max(peakBytes, estimatedBytes);

        if (records.size() >= maxRecords || estimatedBytes >= maxBytes) {
            flush();
        }
    }

    /**
     * Drain whatever is buffered, even below the thresholds. No-op when empty.
     */
    public void flush() {
        if (records.isEmpty()) {
            return;
        }
        Batch batch = new Batch(nextSequence++, Collections.unmodifiableList(records), estimatedBytes);
        records = new ArrayList<>();
        estimatedBytes = 0;
        flushHandler.accept(batch);
    }

    public int size() {
        return records.size();
    }

    public long getEstimatedBytes() {
        return estimatedBytes;
    }

    public long getPeakBytes() {
        return peakBytes;
    }
}
