package com.chess.ingest.pipeline;

import com.chess.ingest.pgn.GameRecord;
import com.chess.ingest.pgn.GameResult;
import com.chess.ingest.pgn.PgnFixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionBufferTest {

    private final List<Batch> flushed = new ArrayList<>();

    private static GameRecord record(int i) {
        return PgnFixtures.record("white" + i, "black" + i, 1500, 1500, GameResult.DRAW, "C60",
                Instant.parse("2023-01-01T00:00:00Z").plusSeconds(i));
    }

    @Test
    void flushesWhenRecordCountIsReached() {
        IngestionBuffer buffer = new IngestionBuffer(3, Long.MAX_VALUE, flushed::add);

        for (int i = 0; i < 7; i++) {
            buffer.add(record(i));
        }

        assertThat(flushed).extracting(Batch::size).containsExactly(3, 3);
        assertThat(flushed).extracting(Batch::sequence).containsExactly(1L, 2L);
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    void footprintNeverExceedsCeiling() {
        long recordBytes = record(0).estimatedBytes();
        long ceiling = recordBytes * 5 + recordBytes / 2;
        IngestionBuffer buffer = new IngestionBuffer(1000, ceiling, flushed::add);

        for (int i = 0; i < 10_000; i++) {
            buffer.add(record(i));
            assertThat(buffer.getEstimatedBytes()).isLessThanOrEqualTo(ceiling);
        }
        buffer.flush();

        assertThat(buffer.getPeakBytes()).isLessThanOrEqualTo(ceiling);
        assertThat(flushed).allSatisfy(batch -> assertThat(batch.estimatedBytes()).isLessThanOrEqualTo(ceiling));
        assertThat(flushed.stream().mapToInt(Batch::size).sum()).isEqualTo(10_000);
    }

    @Test
    void recordThatWouldOverflowFlushesFirst() {
        long recordBytes = record(0).estimatedBytes();
        IngestionBuffer buffer = new IngestionBuffer(1000, recordBytes * 2 + 1, flushed::add);

        buffer.add(record(0));
        buffer.add(record(1));
        assertThat(flushed).isEmpty();

        buffer.add(record(2));

        assertThat(flushed).hasSize(1);
        assertThat(flushed.get(0).records()).extracting(GameRecord::white).containsExactly("white0", "white1");
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    void bufferIsEmptyWhenHandlerRuns() {
        List<Integer> sizesSeenByHandler = new ArrayList<>();
        IngestionBuffer[] holder = new IngestionBuffer[1];
        holder[0] = new IngestionBuffer(2, Long.MAX_VALUE, batch -> sizesSeenByHandler.add(holder[0].size()));

        holder[0].add(record(0));
        holder[0].add(record(1));

        assertThat(sizesSeenByHandler).containsExactly(0);
        assertThat(holder[0].getEstimatedBytes()).isZero();
    }

    @Test
    void explicitFlushDrainsPartialBatchAndIsNoOpWhenEmpty() {
        IngestionBuffer buffer = new IngestionBuffer(100, Long.MAX_VALUE, flushed::add);
        buffer.flush();
        assertThat(flushed).isEmpty();

        buffer.add(record(0));
        buffer.flush();
        buffer.flush();

        assertThat(flushed).hasSize(1);
        assertThat(flushed.get(0).size()).isEqualTo(1);
    }

    @Test
    void recordLargerThanCeilingIsRefused() {
        IngestionBuffer buffer = new IngestionBuffer(10, 100, flushed::add);

        assertThatThrownBy(() -> buffer.add(record(0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("can never fit");
    }
}
