package com.kg.core.service.ingest;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Exponential reconnect delay with a cap and random jitter.
 *
 * The delay for attempt {@code n} is {@code min(unit * 2^n, max) + jitter}.
 */
public class ReconnectBackoff {

    private final long unitMs;
    private final long maxMs;
    private final LongSupplier jitterMs;

    public ReconnectBackoff(long unitMs, long maxMs, long maxJitterMs) {
        this(unitMs, maxMs, () -> maxJitterMs > 0 ? ThreadLocalRandom.current().nextLong(maxJitterMs) : 0);
    }

    ReconnectBackoff(long unitMs, long maxMs, LongSupplier jitterMs) {
        this.unitMs = unitMs;
        this.maxMs = maxMs;
        this.jitterMs = jitterMs;
    }

    /**
     * @param attempt consecutive failures so far, starting at 1
     */
    public Duration delayFor(int attempt) {
        long base = maxMs;
        if (attempt < 31) {
            base = Math.min(unitMs * (1L << Math.max(attempt, 0)), maxMs);
        }
        return Duration.ofMillis(base + jitterMs.getAsLong());
    }
}
