package com.chess.ingest.pgn;

/**
 * Why a game block was rejected. Parse errors mean the block is malformed;
 * validation errors mean it is well formed but semantically unusable.
 */
public enum RejectionReason {

    MISSING_TAG(Kind.PARSE),
    MALFORMED_TAG(Kind.PARSE),
    MALFORMED_MOVETEXT(Kind.PARSE),
    INVALID_RESULT(Kind.VALIDATION),
    INVALID_RATING(Kind.VALIDATION),
    INVALID_DATE(Kind.VALIDATION),
    INVALID_OPENING_CODE(Kind.VALIDATION),
    MOVE_COUNT_OUT_OF_RANGE(Kind.VALIDATION),
    RESULT_MISMATCH(Kind.VALIDATION),
    SAME_PLAYER(Kind.VALIDATION),
    RECORD_TOO_LARGE(Kind.VALIDATION);

    public enum Kind { PARSE, VALIDATION }

    private final Kind kind;

    RejectionReason(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
