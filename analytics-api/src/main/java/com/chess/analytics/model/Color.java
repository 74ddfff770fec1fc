package com.chess.analytics.model;

import java.util.Locale;

public enum Color {
    WHITE("whitePlayerId", "WHITE_WIN", "BLACK_WIN"),
    BLACK("blackPlayerId", "BLACK_WIN", "WHITE_WIN");

    private final String playerField;
    private final String winResult;
    private final String lossResult;

    Color(String playerField, String winResult, String lossResult) {
        this.playerField = playerField;
        this.winResult = winResult;
        this.lossResult = lossResult;
    }

    /** Game field holding the id of the player on this side */
    public String getPlayerField() {
        return playerField;
    }

    public String getWinResult() {
        return winResult;
    }

    public String getLossResult() {
        return lossResult;
    }

    public static Color fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown color: " + name + " (expected white or black)");
        }
    }
}
