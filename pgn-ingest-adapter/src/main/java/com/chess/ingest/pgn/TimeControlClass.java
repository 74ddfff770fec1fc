package com.chess.ingest.pgn;

/**
 * Speed class of a game, derived from the PGN TimeControl tag.
 * Estimated duration is base seconds plus 40 moves worth of increment.
 */
public enum TimeControlClass {

    BULLET,
    BLITZ,
    RAPID,
    CLASSICAL,
    UNKNOWN;

    private static final int ESTIMATED_MOVES = 40;

    public static TimeControlClass categorize(String timeControl) {
        if (timeControl == null || timeControl.isBlank() || timeControl.trim().equals("-")) {
            return UNKNOWN;
        }
        try {
            String tc = timeControl.trim();
            long totalSeconds;
            int plus = tc.indexOf('+');
            if (plus >= 0) {
                long base = Long.parseLong(tc.substring(0, plus));
                long increment = Long.parseLong(tc.substring(plus + 1));
                totalSeconds = base + ESTIMATED_MOVES * increment;
            } else {
                totalSeconds = Long.parseLong(tc);
            }

            if (totalSeconds < 180) {
                return BULLET;
            } else if (totalSeconds < 600) {
                return BLITZ;
            } else if (totalSeconds < 1500) {
                return RAPID;
            }
            return CLASSICAL;
        } catch (NumberFormatException e) {
            return UNKNOWN;
        }
    }
}
