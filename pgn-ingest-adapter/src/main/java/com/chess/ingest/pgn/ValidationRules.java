package com.chess.ingest.pgn;

/**
 * Bounds applied to every parsed record.
 *
 * @param minRating      lowest plausible rating, inclusive
 * @param maxRating      highest plausible rating, inclusive
 * @param minPlies       fewest main-line half moves, inclusive
 * @param maxPlies       most main-line half moves, inclusive
 * @param maxRecordBytes largest estimated record footprint; a record must fit the buffer alone
 */
public record ValidationRules(
        int minRating,
        int maxRating,
        int minPlies,
        int maxPlies,
        long maxRecordBytes
) {

    public static ValidationRules defaults() {
        return new ValidationRules(1, 3500, 2, 500, Long.MAX_VALUE);
    }

    /**
     * Longest raw block, in characters, worth reading into memory. A block's
     * text alone past this would already exceed the record ceiling.
     */
    public long maxBlockChars() {
        return maxRecordBytes == Long.MAX_VALUE ? PgnBlockReader.UNBOUNDED : Math.max(1, maxRecordBytes / 2);
    }

    public ValidationRules {
        if (minRating < 1 || maxRating < minRating) {
            throw new IllegalArgumentException("Invalid rating range " + minRating + ".." + maxRating);
        }
        if (minPlies < 0 || maxPlies < minPlies) {
            throw new IllegalArgumentException("Invalid ply range " + minPlies + ".." + maxPlies);
        }
    }
}
