package com.chess.ingest.pgn;

/**
 * A block the parser refused, with the raw text kept for inspection.
 */
public record Rejection(
        RejectionReason reason,
        String message,
        String rawBlock,
        long startLine
) {

    public RejectionReason.Kind kind() {
        return reason.getKind();
    }
}
