package com.chess.ingest.pgn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Turns raw PGN blocks into validated {@link GameRecord}s.
 * <p>
 * Every block yields exactly one {@link ParseOutcome}; a bad block is reported
 * as a rejection and parsing moves on to the next one.
 */
public class PgnRecordParser {

    private static final Logger log = LoggerFactory.getLogger(PgnRecordParser.class);

    static final List<String> REQUIRED_TAGS = List.of("White", "Black", "Result", "Date", "ECO", "WhiteElo", "BlackElo");

    private static final Pattern ECO_CODE = Pattern.compile("^[A-E]\\d{2}$");

    private final ValidationRules rules;
    private final ParseStatistics statistics = new ParseStatistics();

    public PgnRecordParser(ValidationRules rules) {
        this.rules = rules;
    }

    /**
     * Lazily map blocks to outcomes. Nothing is read until the returned stream is consumed.
     */
    public Stream<ParseOutcome> parse(Stream<RawGameBlock> blocks) {
        return blocks.map(this::parseBlock);
    }

    /**
     * Read and parse a PGN stream. Blocks longer than the record ceiling are cut
     * off while reading. Closing the returned stream closes the reader.
     */
    public Stream<ParseOutcome> parse(BufferedReader input) {
        return parse(PgnBlockReader.blocks(input, rules.maxBlockChars()));
    }

    public ParseOutcome parseBlock(RawGameBlock block) {
        ParseOutcome outcome = evaluate(block);
        if (outcome.isAccepted()) {
            statistics.recordAccepted();
        } else {
            Rejection rejection = outcome.rejection();
            statistics.recordRejected(rejection.reason());
            log.debug("Rejected block at line {}: {} ({})", block.startLine(), rejection.reason(), rejection.message());
        }
        return outcome;
    }

    public ParseStatistics getStatistics() {
        return statistics;
    }

    private ParseOutcome evaluate(RawGameBlock block) {
        if (block.isTruncated()) {
            return reject(block, RejectionReason.RECORD_TOO_LARGE,
                    String.format("Block spans %d characters, over the %d character limit", block.skippedChars(),
                            rules.maxBlockChars()));
        }
        if (!block.malformedTags().isEmpty()) {
            return reject(block, RejectionReason.MALFORMED_TAG, "Malformed tag line: " + block.malformedTags().get(0));
        }
        for (String tag : REQUIRED_TAGS) {
            String value = block.tag(tag);
            if (value == null || value.isBlank()) {
                return reject(block, RejectionReason.MISSING_TAG, "Missing required tag: " + tag);
            }
        }

        GameResult result = GameResult.fromNotation(block.tag("Result")).orElse(null);
        if (result == null) {
            return reject(block, RejectionReason.INVALID_RESULT, "Unsupported result: " + block.tag("Result"));
        }

        Integer whiteRating = parseRating(block.tag("WhiteElo"));
        Integer blackRating = parseRating(block.tag("BlackElo"));
        if (whiteRating == null || blackRating == null) {
            return reject(block, RejectionReason.INVALID_RATING,
                    String.format("Ratings out of range %d..%d: white=%s black=%s",
                            rules.minRating(), rules.maxRating(), block.tag("WhiteElo"), block.tag("BlackElo")));
        }

        LocalDate date = parseDate(block.tag("Date"));
        if (date == null) {
            return reject(block, RejectionReason.INVALID_DATE, "Unusable date: " + block.tag("Date"));
        }

        String ecoCode = block.tag("ECO").trim().toUpperCase(Locale.ROOT);
        if (!ECO_CODE.matcher(ecoCode).matches()) {
            return reject(block, RejectionReason.INVALID_OPENING_CODE, "Invalid ECO code: " + block.tag("ECO"));
        }

        String white = PlayerNames.displayName(block.tag("White"));
        String black = PlayerNames.displayName(block.tag("Black"));
        if (PlayerNames.naturalKey(white).equals(PlayerNames.naturalKey(black))) {
            return reject(block, RejectionReason.SAME_PLAYER, "White and black are the same player: " + white);
        }

        MoveTextTokenizer.MoveText moveText;
        try {
            moveText = MoveTextTokenizer.tokenize(block.moveText());
        } catch (MalformedMoveTextException e) {
            return reject(block, RejectionReason.MALFORMED_MOVETEXT, e.getMessage());
        }

        int plies = moveText.moves().size();
        if (plies < rules.minPlies() || plies > rules.maxPlies()) {
            return reject(block, RejectionReason.MOVE_COUNT_OUT_OF_RANGE,
                    String.format("%d plies outside %d..%d", plies, rules.minPlies(), rules.maxPlies()));
        }

        String marker = moveText.terminationMarker();
        if (marker != null && !marker.equals(result.getNotation())) {
            return reject(block, RejectionReason.RESULT_MISMATCH,
                    "Result tag " + result.getNotation() + " but move text ends with " + marker);
        }

        String timeControl = block.tag("TimeControl");
        GameRecord record = new GameRecord(
                white,
                black,
                whiteRating,
                blackRating,
                PlayerNames.title(block.tag("WhiteTitle"), white).orElse(null),
                PlayerNames.title(block.tag("BlackTitle"), black).orElse(null),
                result,
                date,
                playedAt(date, block.tag("UTCDate"), block.tag("UTCTime")),
                ecoCode,
                blankToDefault(block.tag("Opening"), "Unknown"),
                TimeControlClass.categorize(timeControl),
                timeControl,
                block.tag("Event"),
                block.tag("Site"),
                moveText.moves()
        );

        if (record.estimatedBytes() > rules.maxRecordBytes()) {
            return reject(block, RejectionReason.RECORD_TOO_LARGE,
                    String.format("Estimated %d bytes exceeds %d", record.estimatedBytes(), rules.maxRecordBytes()));
        }

        return ParseOutcome.accepted(record);
    }

    private Integer parseRating(String value) {
        try {
            int rating = Integer.parseInt(value.trim());
            if (rating < rules.minRating() || rating > rules.maxRating()) {
                return null;
            }
            return rating;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * PGN dates are yyyy.MM.dd; unknown month or day default to 01, an unknown year is unusable.
     */
    static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        String[] parts = value.trim().split("\\.");
        if (parts.length != 3 || parts[0].contains("?")) {
            return null;
        }
        try {
            int year = Integer.parseInt(parts[0]);
            int month = parts[1].contains("?") ? 1 : Integer.parseInt(parts[1]);
            int day = parts[2].contains("?") ? 1 : Integer.parseInt(parts[2]);
            return LocalDate.of(year, month, day);
        } catch (NumberFormatException | DateTimeException e) {
            return null;
        }
    }

    private static Instant playedAt(LocalDate date, String utcDate, String utcTime) {
        LocalDate day = date;
        LocalDate parsedUtcDate = parseDate(utcDate);
        if (parsedUtcDate != null) {
            day = parsedUtcDate;
        }
        LocalTime time = LocalTime.MIDNIGHT;
        if (utcTime != null && !utcTime.isBlank()) {
            try {
                time = LocalTime.parse(utcTime.trim());
            } catch (DateTimeException e) {
                log.debug("Ignoring unparsable UTCTime {}", utcTime);
            }
        }
        return day.atTime(time).toInstant(ZoneOffset.UTC);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static ParseOutcome reject(RawGameBlock block, RejectionReason reason, String message) {
        return ParseOutcome.rejected(new Rejection(reason, message, block.rawText(), block.startLine()));
    }
}
