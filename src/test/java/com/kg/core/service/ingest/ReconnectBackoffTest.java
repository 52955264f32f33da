package com.kg.core.service.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectBackoffTest {

    @Test
    @DisplayName("Delay doubles per attempt up to the cap")
    void exponentialWithCap() {
        ReconnectBackoff backoff = new ReconnectBackoff(1000, 30_000, () -> 0L);

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayFor(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoff.delayFor(64)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Jitter is added on top of the capped delay")
    void jitterAdded() {
        ReconnectBackoff backoff = new ReconnectBackoff(1000, 30_000, () -> 999L);

        assertThat(backoff.delayFor(10)).isEqualTo(Duration.ofMillis(30_999));
    }

    @Test
    @DisplayName("Random jitter never exceeds the configured maximum")
    void randomJitterBounded() {
        ReconnectBackoff backoff = new ReconnectBackoff(1000, 30_000, 1000);

        for (int attempt = 1; attempt <= 40; attempt++) {
            long expectedBase = Math.min(1000L << Math.min(attempt, 20), 30_000);
            assertThat(backoff.delayFor(attempt).toMillis())
                    .isGreaterThanOrEqualTo(expectedBase)
                    .isLessThan(expectedBase + 1000);
        }
    }
}
