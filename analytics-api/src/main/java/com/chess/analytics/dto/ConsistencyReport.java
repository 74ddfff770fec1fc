package com.chess.analytics.dto;

import java.util.List;

public record ConsistencyReport(
        int openingsChecked,
        boolean consistent,
        List<OpeningMismatch> mismatches
) {
}
