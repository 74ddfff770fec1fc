package com.chess.ingest.pgn;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PgnRecordParserTest {

    private PgnRecordParser parser;

    @BeforeEach
    void setUp() {
        parser = new PgnRecordParser(ValidationRules.defaults());
    }

    private List<ParseOutcome> parse(String pgn) {
        return parser.parse(PgnBlockReader.blocks(new BufferedReader(new StringReader(pgn))))
                .collect(Collectors.toList());
    }

    private Rejection rejectionOf(String pgn) {
        ParseOutcome outcome = parse(pgn).get(0);
        assertThat(outcome.isAccepted()).isFalse();
        return outcome.rejection();
    }

    @Test
    void acceptsValidGame() {
        ParseOutcome outcome = parse(PgnFixtures.game("Alice", "Bob", "1-0", "2023.05.17", "c60", 1500, 1480)).get(0);

        assertThat(outcome.isAccepted()).isTrue();
        GameRecord record = outcome.record();
        assertThat(record.white()).isEqualTo("Alice");
        assertThat(record.whiteRating()).isEqualTo(1500);
        assertThat(record.result()).isEqualTo(GameResult.WHITE_WIN);
        assertThat(record.date()).isEqualTo(LocalDate.of(2023, 5, 17));
        assertThat(record.playedAt()).isEqualTo(Instant.parse("2023-05-17T00:00:00Z"));
        assertThat(record.ecoCode()).isEqualTo("C60");
        assertThat(record.openingName()).isEqualTo("Ruy Lopez");
        assertThat(record.timeControl()).isEqualTo(TimeControlClass.BLITZ);
        assertThat(record.plyCount()).isEqualTo(6);
    }

    @Test
    void threeValidAndOneMalformedBlock() {
        String pgn = PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 1500, 1500)
                + PgnFixtures.game("c", "d", "0-1", "2023.01.02", "B01", 1500, 1500)
                + PgnFixtures.game("e", "f", "1-0", "2023.01.03", "C60", 1500, 1500, "180+2", "1. e4 {broken e5 1-0")
                + PgnFixtures.game("g", "h", "1/2-1/2", "2023.01.04", "A00", 1500, 1500);

        List<ParseOutcome> outcomes = parse(pgn);

        assertThat(outcomes).hasSize(4);
        assertThat(outcomes).filteredOn(ParseOutcome::isAccepted).hasSize(3);
        assertThat(outcomes.get(2).rejection().reason()).isEqualTo(RejectionReason.MALFORMED_MOVETEXT);
        assertThat(outcomes.get(2).rejection().kind()).isEqualTo(RejectionReason.Kind.PARSE);
        assertThat(outcomes.get(2).rejection().rawBlock()).contains("[White \"e\"]");
        assertThat(parser.getStatistics().getAccepted()).isEqualTo(3);
        assertThat(parser.getStatistics().getRejected()).isEqualTo(1);
    }

    @Test
    void acceptedPlusRejectedEqualsBlocksSeen() {
        String pgn = PgnFixtures.games(20)
                + PgnFixtures.game("x", "y", "2-0", "2023.01.01", "C60", 1500, 1500)
                + PgnFixtures.game("x", "x", "1-0", "2023.01.01", "C60", 1500, 1500)
                + PgnFixtures.game("x", "y", "1-0", "2023.01.01", "Z99", 1500, 1500);

        List<ParseOutcome> outcomes = parse(pgn);

        ParseStatistics stats = parser.getStatistics();
        assertThat(stats.getTotal()).isEqualTo(outcomes.size()).isEqualTo(23);
        assertThat(stats.getAccepted() + stats.getRejected()).isEqualTo(stats.getTotal());
        assertThat(stats.getRejectedByReason())
                .containsEntry(RejectionReason.INVALID_RESULT, 1L)
                .containsEntry(RejectionReason.SAME_PLAYER, 1L)
                .containsEntry(RejectionReason.INVALID_OPENING_CODE, 1L);
    }

    @Test
    void missingRequiredTag() {
        String pgn = "[White \"a\"]\n[Black \"b\"]\n[Result \"1-0\"]\n[Date \"2023.01.01\"]\n"
                + "[WhiteElo \"1500\"]\n[BlackElo \"1500\"]\n\n1. e4 e5 1-0\n";

        Rejection rejection = rejectionOf(pgn);

        assertThat(rejection.reason()).isEqualTo(RejectionReason.MISSING_TAG);
        assertThat(rejection.message()).contains("ECO");
    }

    @Test
    void malformedTagLine() {
        String pgn = "[White \"a\"]\n[Black b]\n\n1. e4 e5 1-0\n";

        assertThat(rejectionOf(pgn).reason()).isEqualTo(RejectionReason.MALFORMED_TAG);
    }

    @Test
    void ratingsOutsidePlausibleRange() {
        assertThat(rejectionOf(PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 0, 1500)).reason())
                .isEqualTo(RejectionReason.INVALID_RATING);
        assertThat(rejectionOf(PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 1500, 4000)).reason())
                .isEqualTo(RejectionReason.INVALID_RATING);
        assertThat(rejectionOf(PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 1500, 1500)
                .replace("[BlackElo \"1500\"]", "[BlackElo \"?\"]")).reason())
                .isEqualTo(RejectionReason.INVALID_RATING);
    }

    @Test
    void partiallyUnknownDateDefaultsToFirstOfMonth() {
        assertThat(PgnRecordParser.parseDate("2023.??.??")).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(PgnRecordParser.parseDate("2023.07.??")).isEqualTo(LocalDate.of(2023, 7, 1));
        assertThat(PgnRecordParser.parseDate("????.??.??")).isNull();
        assertThat(PgnRecordParser.parseDate("2023.13.01")).isNull();
    }

    @Test
    void unknownYearIsRejected() {
        assertThat(rejectionOf(PgnFixtures.game("a", "b", "1-0", "????.??.??", "C60", 1500, 1500)).reason())
                .isEqualTo(RejectionReason.INVALID_DATE);
    }

    @Test
    void terminationMarkerMustMatchResultTag() {
        String pgn = PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 1500, 1500, "180+2",
                PgnFixtures.OPENING_MOVES + " 0-1");

        Rejection rejection = rejectionOf(pgn);

        assertThat(rejection.reason()).isEqualTo(RejectionReason.RESULT_MISMATCH);
        assertThat(rejection.kind()).isEqualTo(RejectionReason.Kind.VALIDATION);
    }

    @Test
    void tooFewPlies() {
        String pgn = PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 1500, 1500, "180+2", "1. e4 1-0");

        assertThat(rejectionOf(pgn).reason()).isEqualTo(RejectionReason.MOVE_COUNT_OUT_OF_RANGE);
    }

    @Test
    void sameNameInDifferentCaseIsSamePlayer() {
        assertThat(rejectionOf(PgnFixtures.game("Alice", " alice ", "1-0", "2023.01.01", "C60", 1500, 1500)).reason())
                .isEqualTo(RejectionReason.SAME_PLAYER);
    }

    @Test
    void recordLargerThanBufferCeilingIsRejected() {
        parser = new PgnRecordParser(new ValidationRules(1, 3500, 2, 500, 300));

        assertThat(rejectionOf(PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 1500, 1500)).reason())
                .isEqualTo(RejectionReason.RECORD_TOO_LARGE);
    }

    @Test
    void utcTagsGivePreciseTimestampAndTitlesAreExtracted() {
        String pgn = PgnFixtures.game("GM_Magnus", "bob", "1-0", "2023.01.01", "C60", 2800, 2500)
                .replace("[ECO", "[UTCDate \"2023.01.02\"]\n[UTCTime \"13:45:10\"]\n[BlackTitle \"IM\"]\n[ECO");

        GameRecord record = parse(pgn).get(0).record();

        assertThat(record.playedAt()).isEqualTo(Instant.parse("2023-01-02T13:45:10Z"));
        assertThat(record.whiteTitle()).isEqualTo("GM");
        assertThat(record.blackTitle()).isEqualTo("IM");
    }

    @Test
    void parsingIsLazy() {
        BufferedReader reader = new BufferedReader(new StringReader(PgnFixtures.games(100)));

        List<ParseOutcome> firstTwo = parser.parse(PgnBlockReader.blocks(reader)).limit(2).collect(Collectors.toList());

        assertThat(firstTwo).hasSize(2);
        assertThat(parser.getStatistics().getTotal()).isEqualTo(2);
    }

    @Test
    void blockOverTheCeilingIsRejectedWhileReading() {
        parser = new PgnRecordParser(new ValidationRules(1, 3500, 2, 500, 4000));
        String pgn = PgnFixtures.game("a", "b", "1-0", "2023.01.01", "C60", 1500, 1500, "180+2",
                "1. e4 e5\n".repeat(50_000) + "1-0")
                + PgnFixtures.game("c", "d", "0-1", "2023.01.02", "B01", 1500, 1500);

        List<ParseOutcome> outcomes = parser.parse(new BufferedReader(new StringReader(pgn))).collect(Collectors.toList());

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes.get(0).rejection().reason()).isEqualTo(RejectionReason.RECORD_TOO_LARGE);
        assertThat(outcomes.get(0).rejection().message()).contains("character limit");
        assertThat(outcomes.get(1).isAccepted()).isTrue();
        assertThat(parser.getStatistics().getRejected()).isEqualTo(1);
    }
}
