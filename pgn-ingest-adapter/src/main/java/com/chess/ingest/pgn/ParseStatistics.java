package com.chess.ingest.pgn;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running accepted/rejected counts for one parse run.
 */
public class ParseStatistics {

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final Map<RejectionReason, AtomicLong> byReason = new ConcurrentHashMap<>();

    void recordAccepted() {
        accepted.incrementAndGet();
    }

    void recordRejected(RejectionReason reason) {
        rejected.incrementAndGet();
        byReason.computeIfAbsent(reason, r -> new AtomicLong()).incrementAndGet();
    }

    public long getAccepted() {
        return accepted.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    public long getTotal() {
        return accepted.get() + rejected.get();
    }

    public Map<RejectionReason, Long> getRejectedByReason() {
        Map<RejectionReason, Long> snapshot = new EnumMap<>(RejectionReason.class);
        byReason.forEach((reason, count) -> snapshot.put(reason, count.get()));
        return snapshot;
    }
}
