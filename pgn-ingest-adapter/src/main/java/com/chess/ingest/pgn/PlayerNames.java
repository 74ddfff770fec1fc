package com.chess.ingest.pgn;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Natural-key and title helpers for player names.
 */
public final class PlayerNames {

    private static final List<String> TITLES = List.of("GM", "IM", "FM", "CM", "WGM", "WIM", "WFM", "WCM");

    private PlayerNames() {
    }

    /**
     * Display form: trimmed with internal whitespace runs collapsed to one space.
     */
    public static String displayName(String name) {
        return name.trim().replaceAll("\\s+", " ");
    }

    /**
     * Natural key used to decide whether two names denote the same player.
     * Case and whitespace variants of a name share one key.
     */
    public static String naturalKey(String name) {
        return displayName(name).toLowerCase(Locale.ROOT);
    }

    /**
     * Title from an explicit PGN title tag, falling back to a "GM_" / "_GM" style
     * marker in the username.
     */
    public static Optional<String> title(String titleTag, String username) {
        if (titleTag != null && !titleTag.isBlank() && !titleTag.trim().equals("-")) {
            return Optional.of(titleTag.trim().toUpperCase(Locale.ROOT));
        }
        String upper = username.toUpperCase(Locale.ROOT);
        // longest first so WGM is not reported as GM
        return TITLES.stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .filter(t -> upper.startsWith(t + "_") || upper.startsWith(t + "-")
                        || upper.endsWith("_" + t) || upper.endsWith("-" + t))
                .findFirst();
    }
}
