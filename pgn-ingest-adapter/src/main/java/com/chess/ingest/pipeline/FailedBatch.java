package com.chess.ingest.pipeline;

/**
 * A batch that was still failing after the last attempt. Its records are
 * written to a PGN spool file that can be imported again once the cause is fixed.
 *
 * @param size      records in the batch
 * @param spoolFile the PGN file holding the records; null if it could not be written
 */
public record FailedBatch(
        long sequence,
        int attempts,
        String cause,
        int size,
        String spoolFile
) {
}
