package com.kg.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the knowledge graph service.
 *
 * Provides custom metrics for update publishing, subscription and batch commits.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter updatesPublished;
    private final Counter publishFailures;
    private final Counter updatesReceived;
    private final Counter updatesDropped;
    private final Counter updatesApplied;
    private final Counter updatesRejected;
    private final Counter batchesRolledBack;
    private final Counter reconnects;

    // Timers
    private final Timer batchCommitTimer;
    private final Timer publishTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.updatesPublished = Counter.builder("kg.updates.published.count")
                .description("Number of updates published to the event bus")
                .register(registry);

        this.publishFailures = Counter.builder("kg.updates.publish.failures")
                .description("Number of updates the event bus refused")
                .register(registry);

        this.updatesReceived = Counter.builder("kg.updates.received.count")
                .description("Number of update events received from the event bus")
                .register(registry);

        this.updatesDropped = Counter.builder("kg.updates.dropped.count")
                .description("Number of updates dropped as undecodable or unbackupable")
                .register(registry);

        this.updatesApplied = Counter.builder("kg.updates.applied.count")
                .description("Number of updates committed to the durable cache")
                .register(registry);

        this.updatesRejected = Counter.builder("kg.updates.rejected.count")
                .description("Number of updates rejected by validation or deduplication")
                .register(registry);

        this.batchesRolledBack = Counter.builder("kg.batch.rollback.count")
                .description("Number of batches rolled back after a failed pipeline")
                .register(registry);

        this.reconnects = Counter.builder("kg.subscriber.reconnect.count")
                .description("Number of event bus reconnect attempts")
                .register(registry);

        this.batchCommitTimer = Timer.builder("kg.batch.commit.duration")
                .description("Time taken to commit an update batch")
                .register(registry);

        this.publishTimer = Timer.builder("kg.updates.publish.duration")
                .description("Time taken to publish an update")
                .register(registry);
    }

    /**
     * Registers a gauge for buffer depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerBufferGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
