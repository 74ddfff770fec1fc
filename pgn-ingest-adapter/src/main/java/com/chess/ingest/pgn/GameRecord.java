package com.chess.ingest.pgn;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * A validated game, immutable from the moment the parser accepts it.
 */
public record GameRecord(
        String white,
        String black,
        int whiteRating,
        int blackRating,
        String whiteTitle,
        String blackTitle,
        GameResult result,
        LocalDate date,
        Instant playedAt,
        String ecoCode,
        String openingName,
        TimeControlClass timeControl,
        String rawTimeControl,
        String event,
        String site,
        List<String> moves
) {

    private static final int OBJECT_OVERHEAD_BYTES = 256;
    private static final int STRING_OVERHEAD_BYTES = 40;

    public GameRecord {
        Objects.requireNonNull(white, "white");
        Objects.requireNonNull(black, "black");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(playedAt, "playedAt");
        Objects.requireNonNull(ecoCode, "ecoCode");
        moves = List.copyOf(moves);
    }

    public String whiteKey() {
        return PlayerNames.naturalKey(white);
    }

    public String blackKey() {
        return PlayerNames.naturalKey(black);
    }

    public int plyCount() {
        return moves.size();
    }

    /**
     * Stable per-game natural key: players, date and the full move list.
     * Re-importing the same game always yields the same key.
     */
    public String gameKey() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(whiteKey().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '|');
            digest.update(blackKey().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '|');
            digest.update(date.toString().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '|');
            digest.update(Integer.toString(moves.size()).getBytes(StandardCharsets.UTF_8));
            for (String move : moves) {
                digest.update((byte) ' ');
                digest.update(move.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Rough heap footprint of this record, used by the ingestion buffer.
     */
    public long estimatedBytes() {
        long bytes = OBJECT_OVERHEAD_BYTES;
        bytes += sizeOf(white) + sizeOf(black) + sizeOf(whiteTitle) + sizeOf(blackTitle);
        bytes += sizeOf(ecoCode) + sizeOf(openingName) + sizeOf(rawTimeControl);
        bytes += sizeOf(event) + sizeOf(site);
        for (String move : moves) {
            bytes += sizeOf(move) + 8;
        }
        return bytes;
    }

    private static long sizeOf(String value) {
        return value == null ? 0 : STRING_OVERHEAD_BYTES + 2L * value.length();
    }
}
