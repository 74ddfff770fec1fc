package com.chess.ingest.pipeline;

import com.chess.ingest.pgn.GameRecord;

import java.util.List;

/**
 * Records drained from the buffer in one flush. Lives only until it is committed.
 *
 * @param sequence       1-based flush number within the run
 * @param records        the records, in input order
 * @param estimatedBytes buffer footprint at the time of the flush
 */
public record Batch(long sequence, List<GameRecord> records, long estimatedBytes) {

    public int size() {
        return records.size();
    }
}
