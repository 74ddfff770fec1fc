package com.chess.ingest.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void growsExponentiallyUpToTheCap() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), 2.0, Duration.ofSeconds(1));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.delayAfter(5)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(50)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void noneNeverWaits() {
        assertThat(BackoffPolicy.none().delayAfter(3)).isZero();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofMillis(100), 0.5, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
