package com.chess.analytics.model;

import java.util.Locale;

/**
 * Time-control classes as stored on games and rating history points.
 */
public enum TimeControlClass {
    BULLET,
    BLITZ,
    RAPID,
    CLASSICAL,
    UNKNOWN;

    /**
     * Case-insensitive lookup for request parameters.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static TimeControlClass fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown time control: " + name
                    + " (expected bullet, blitz, rapid, classical or unknown)");
        }
    }
}
