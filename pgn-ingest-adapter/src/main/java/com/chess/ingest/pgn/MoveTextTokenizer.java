package com.chess.ingest.pgn;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts the main-line SAN moves from PGN move text.
 * Comments, variations, NAGs and move numbers are dropped; every remaining
 * token must be a SAN move or the single termination marker at the end.
 */
public final class MoveTextTokenizer {

    private static final Pattern SAN = Pattern.compile(
            "^(?:O-O(?:-O)?|0-0(?:-0)?"
                    + "|[KQRBN][a-h]?[1-8]?x?[a-h][1-8]"
                    + "|[a-h](?:x[a-h])?[1-8](?:=?[QRBN])?)"
                    + "[+#]?(?:[!?]{1,2})?$");

    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+");

    private static final Set<String> TERMINATION_MARKERS = Set.of("1-0", "0-1", "1/2-1/2", "*");

    private MoveTextTokenizer() {
    }

    /**
     * @param moves             main-line moves in order
     * @param terminationMarker the trailing result token, or null when absent
     */
    public record MoveText(List<String> moves, String terminationMarker) {
    }

    public static MoveText tokenize(String text) {
        List<String> moves = new ArrayList<>();
        String termination = null;

        for (String token : rawTokens(text)) {
            if (termination != null) {
                throw new MalformedMoveTextException("Move text continues after result marker: " + token);
            }
            if (TERMINATION_MARKERS.contains(token)) {
                termination = token;
                continue;
            }

            String move = MOVE_NUMBER.matcher(token).replaceFirst("");
            if (move.isEmpty()) {
                continue;
            }
            if (!SAN.matcher(move).matches()) {
                throw new MalformedMoveTextException("Not a SAN move: " + token);
            }
            moves.add(move);
        }

        return new MoveText(moves, termination);
    }

    private static List<String> rawTokens(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        int depth = 0;
        int i = 0;
        int n = text.length();

        while (i < n) {
            char c = text.charAt(i);

            if (c == '{') {
                int close = text.indexOf('}', i + 1);
                if (close < 0) {
                    throw new MalformedMoveTextException("Unterminated comment");
                }
                flush(token, tokens, depth);
                i = close + 1;
                continue;
            }
            if (c == '}') {
                throw new MalformedMoveTextException("Unbalanced '}'");
            }
            if (c == ';') {
                int eol = text.indexOf('\n', i + 1);
                flush(token, tokens, depth);
                i = eol < 0 ? n : eol + 1;
                continue;
            }
            if (c == '(') {
                flush(token, tokens, depth);
                depth++;
                i++;
                continue;
            }
            if (c == ')') {
                if (depth == 0) {
                    throw new MalformedMoveTextException("Unbalanced ')'");
                }
                flush(token, tokens, depth);
                depth--;
                i++;
                continue;
            }
            if (c == '$') {
                flush(token, tokens, depth);
                i++;
                while (i < n && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                continue;
            }
            if (Character.isWhitespace(c)) {
                flush(token, tokens, depth);
                i++;
                continue;
            }

            token.append(c);
            i++;
        }

        if (depth != 0) {
            throw new MalformedMoveTextException("Unterminated variation");
        }
        flush(token, tokens, depth);
        return tokens;
    }

    private static void flush(StringBuilder token, List<String> tokens, int depth) {
        // tokens inside variations are not part of the main line
        if (token.length() > 0 && depth == 0) {
            tokens.add(token.toString());
        }
        token.setLength(0);
    }
}
