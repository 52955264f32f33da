package com.kg.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the update ingestion pipeline.
 *
 * Controls the update buffer, batch commit thresholds, the event bus subscription
 * and how long processed markers and cache backups are retained.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "kg.ingest")
public class IngestionConfig {

    /**
     * Update buffer configuration.
     */
    private BufferConfig buffer = new BufferConfig();

    /**
     * Batch commit configuration.
     */
    private BatchConfig batch = new BatchConfig();

    /**
     * Event bus subscription configuration.
     */
    private SubscriberConfig subscriber = new SubscriberConfig();

    /**
     * Retention of processed markers and cache backups.
     */
    private RetentionConfig retention = new RetentionConfig();

    @Getter
    @Setter
    public static class BufferConfig {

        /**
         * Maximum number of decoded updates waiting for the committer.
         */
        private int capacity = 100;

        /**
         * Buffer utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;

        /**
         * Slice used when a producer waits for free space, in milliseconds.
         */
        private long offerSliceMs = 100;
    }

    @Getter
    @Setter
    public static class BatchConfig {

        /**
         * Number of accumulated updates that triggers a flush.
         */
        private int size = 100;

        /**
         * Maximum time between flushes in milliseconds.
         */
        private long flushIntervalMs = 5000;

        /**
         * Buffer poll timeout in milliseconds.
         */
        private long pollMs = 100;

        /**
         * Whether the committer flushes its partial batch when stopped.
         */
        private boolean flushOnShutdown = true;
    }

    @Getter
    @Setter
    public static class SubscriberConfig {

        /**
         * Topics the subscriber listens to.
         */
        private List<String> topics = new ArrayList<>(List.of("knowledge_graph.update"));

        /**
         * Consumer group shared by all workers.
         */
        private String consumerGroup = "kg-hooks-workers";

        /**
         * Base unit of the exponential reconnect delay in milliseconds.
         */
        private long backoffUnitMs = 1000;

        /**
         * Upper bound of the exponential part of the reconnect delay in milliseconds.
         */
        private long maxBackoffMs = 30000;

        /**
         * Upper bound of the random jitter added to each reconnect delay in milliseconds.
         */
        private long maxJitterMs = 1000;

        /**
         * Consumer poll timeout in milliseconds.
         */
        private long pollTimeoutMs = 500;
    }

    @Getter
    @Setter
    public static class RetentionConfig {

        /**
         * Lifetime of processed-update markers in hours.
         */
        private long processedTtlHours = 24;

        /**
         * Lifetime of pre-batch cache backups in hours.
         */
        private long backupTtlHours = 24;
    }
}
