package com.chess.ingest.pgn;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes accepted records back out as PGN. Parsing the output again yields
 * records with the same game key.
 */
public final class PgnWriter {

    private static final DateTimeFormatter PGN_DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd");
    private static final DateTimeFormatter PGN_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final int LINE_WIDTH = 80;

    private final Writer out;

    public PgnWriter(Writer out) {
        this.out = out;
    }

    public void write(GameRecord record) throws IOException {
        tag("Event", record.event());
        tag("Site", record.site());
        tag("Date", PGN_DATE.format(record.date()));
        tag("White", record.white());
        tag("Black", record.black());
        tag("Result", record.result().getNotation());
        tag("WhiteElo", String.valueOf(record.whiteRating()));
        tag("BlackElo", String.valueOf(record.blackRating()));
        tag("WhiteTitle", record.whiteTitle());
        tag("BlackTitle", record.blackTitle());
        tag("ECO", record.ecoCode());
        tag("Opening", record.openingName());
        tag("TimeControl", record.rawTimeControl());
        LocalDateTime playedAt = LocalDateTime.ofInstant(record.playedAt(), ZoneOffset.UTC);
        tag("UTCDate", PGN_DATE.format(playedAt));
        tag("UTCTime", PGN_TIME.format(playedAt));
        out.write('\n');
        moveText(record);
        out.write("\n\n");
    }

    /**
     * @return the record as one PGN game, tags and move text
     */
    public static String format(GameRecord record) {
        StringWriter text = new StringWriter();
        try {
            new PgnWriter(text).write(record);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return text.toString();
    }

    private void tag(String name, String value) throws IOException {
        if (value == null) {
            return;
        }
        out.write('[');
        out.write(name);
        out.write(" \"");
        out.write(value.replace("\\", "\\\\").replace("\"", "\\\""));
        out.write("\"]\n");
    }

    private void moveText(GameRecord record) throws IOException {
        int column = 0;
        for (int ply = 0; ply < record.moves().size(); ply++) {
            String token = ply % 2 == 0
                    ? (ply / 2 + 1) + ". " + record.moves().get(ply)
                    : record.moves().get(ply);
            column = append(token, column);
        }
        append(record.result().getNotation(), column);
    }

    private int append(String token, int column) throws IOException {
        if (column > 0 && column + 1 + token.length() > LINE_WIDTH) {
            out.write('\n');
            column = 0;
        } else if (column > 0) {
            out.write(' ');
            column++;
        }
        out.write(token);
        return column + token.length();
    }
}
