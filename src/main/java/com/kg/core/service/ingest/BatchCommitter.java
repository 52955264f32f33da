package com.kg.core.service.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.kg.core.service.bus.CancellationSignal;
import com.kg.core.service.cache.BackupSnapshot;
import com.kg.core.service.cache.CacheBackupManager;
import com.kg.core.service.cache.CacheCommand;
import com.kg.core.service.cache.CacheKeys;
import com.kg.core.service.cache.CacheUnavailableException;
import com.kg.core.service.cache.DurableCache;
import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.config.MetricsConfig;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drains the update buffer and commits updates to the durable cache in batches.
 *
 * A batch is flushed when it reaches the configured size or when the flush
 * interval elapses. Each flush takes a cache backup, validates and stages every
 * record into one pipeline, and restores the backup if the pipeline fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchCommitter {

    private final UpdateBuffer buffer;
    private final DurableCache cache;
    private final CacheBackupManager backupManager;
    private final IngestionConfig ingestionConfig;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock batchLock = new ReentrantLock();
    private final List<UpdateRecord> pending = new ArrayList<>();
    private final AtomicReference<CommitterState> state = new AtomicReference<>(CommitterState.IDLE);
    private final AtomicLong lastKeySuffix = new AtomicLong();

    // ==================== Processing Loop ====================

    /**
     * Runs the drain loop on the calling thread until cancelled.
     */
    public void run(CancellationSignal cancellation) {
        var batchConfig = ingestionConfig.getBatch();
        long intervalNanos = Duration.ofMillis(batchConfig.getFlushIntervalMs()).toNanos();
        long nextFlushAt = System.nanoTime() + intervalNanos;
        log.info("Batch committer started, size={}, interval={}ms", batchConfig.getSize(), batchConfig.getFlushIntervalMs());

        while (!cancellation.isCancelled()) {
            try {
                long remainingMs = Math.max(1, Duration.ofNanos(nextFlushAt - System.nanoTime()).toMillis());
                Optional<UpdateRecord> next = buffer.poll(Math.min(batchConfig.getPollMs(), remainingMs));
                boolean full = next.isPresent() && accumulate(next.get()) >= batchConfig.getSize();
                if (full || System.nanoTime() - nextFlushAt >= 0) {
                    flush();
                    nextFlushAt = System.nanoTime() + intervalNanos;
                }
            } catch (RuntimeException e) {
                log.error("Error in batch committer loop", e);
            }
        }

        if (batchConfig.isFlushOnShutdown()) {
            drainBuffer();
            flush();
        }
        state.set(CommitterState.IDLE);
        log.info("Batch committer stopped");
    }

    private int accumulate(UpdateRecord record) {
        batchLock.lock();
        try {
            pending.add(record);
            state.set(CommitterState.ACCUMULATING);
            return pending.size();
        } finally {
            batchLock.unlock();
        }
    }

    private void drainBuffer() {
        Optional<UpdateRecord> next;
        while ((next = buffer.poll(0)).isPresent()) {
            accumulate(next.get());
        }
    }

    /**
     * Commits whatever has accumulated. Does nothing when the batch is empty.
     */
    public BatchResult flush() {
        batchLock.lock();
        try {
            if (pending.isEmpty()) {
                return BatchResult.empty();
            }
            List<UpdateRecord> batch = new ArrayList<>(pending);
            pending.clear();
            state.set(CommitterState.FLUSHING);
            try {
                return commit(batch);
            } finally {
                state.set(CommitterState.IDLE);
            }
        } finally {
            batchLock.unlock();
        }
    }

    public CommitterState getState() {
        return state.get();
    }

    public int getPendingCount() {
        batchLock.lock();
        try {
            return pending.size();
        } finally {
            batchLock.unlock();
        }
    }

    // ==================== Batch Commit ====================

    /**
     * Applies one batch to the durable cache with backup and rollback.
     *
     * @param batch records to commit
     * @return what happened to the batch
     */
    public BatchResult commit(List<UpdateRecord> batch) {
        if (batch.isEmpty()) {
            return BatchResult.empty();
        }
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        try {
            return doCommit(batch);
        } finally {
            sample.stop(metricsConfig.getBatchCommitTimer());
        }
    }

    private BatchResult doCommit(List<UpdateRecord> batch) {
        BackupSnapshot snapshot;
        try {
            snapshot = backupManager.snapshot();
        } catch (RuntimeException e) {
            metricsConfig.getUpdatesDropped().increment(batch.size());
            log.error("Failed to create backup, dropping batch of {} updates", batch.size(), e);
            return BatchResult.dropped(batch.size());
        }

        List<CacheCommand> pipeline = new ArrayList<>();
        List<String> processedKeys = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int rejected = 0;

        for (UpdateRecord record : batch) {
            try {
                validate(record, seenIds);
                stage(record, pipeline);
                processedKeys.add(CacheKeys.processed(record.id()));
            } catch (IngestionException e) {
                rejected++;
                logRejection(record, e);
            }
        }
        metricsConfig.getUpdatesRejected().increment(rejected);

        int applied = processedKeys.size();
        if (applied == 0) {
            log.info("No valid updates in batch of {}", batch.size());
            return new BatchResult(batch.size(), 0, rejected, false, snapshot.backupKey());
        }

        try {
            cache.execute(pipeline);
        } catch (CacheUnavailableException e) {
            log.error("Failed to execute update pipeline, rolling back to {}", snapshot.backupKey(), e);
            rollback(snapshot, processedKeys);
            return new BatchResult(batch.size(), 0, rejected, true, snapshot.backupKey());
        }

        metricsConfig.getUpdatesApplied().increment(applied);
        log.info("Committed update batch: received={}, applied={}, rejected={}", batch.size(), applied, rejected);
        return new BatchResult(batch.size(), applied, rejected, false, snapshot.backupKey());
    }

    private void rollback(BackupSnapshot snapshot, List<String> processedKeys) {
        metricsConfig.getBatchesRolledBack().increment();
        try {
            backupManager.rollback(snapshot, processedKeys);
        } catch (RuntimeException e) {
            log.error("Failed to roll back to backup {}", snapshot.backupKey(), e);
        }
    }

    private void validate(UpdateRecord record, Set<String> seenIds) {
        if (record.id() == null || record.id().isBlank()) {
            throw new IngestionException("Update id is required", null, IngestionException.VALIDATION_ERROR);
        }
        if (record.serviceId() == null || record.serviceId().isBlank()) {
            throw new IngestionException("Service id is required", record.id(), IngestionException.VALIDATION_ERROR);
        }
        if (record.type() == null) {
            throw new IngestionException("Update type is required", record.id(), IngestionException.VALIDATION_ERROR);
        }
        if (!seenIds.add(record.id())) {
            throw new IngestionException("Update repeated within batch", record.id(),
                    IngestionException.DUPLICATE_UPDATE);
        }
        boolean processed;
        try {
            processed = cache.exists(CacheKeys.processed(record.id()));
        } catch (CacheUnavailableException e) {
            throw new IngestionException("Failed to check processed marker: " + e.getMessage(), record.id(),
                    IngestionException.VALIDATION_ERROR, e);
        }
        if (processed) {
            throw new IngestionException("Update already processed", record.id(),
                    IngestionException.DUPLICATE_UPDATE);
        }
    }

    private void stage(UpdateRecord record, List<CacheCommand> pipeline) {
        String key = switch (record.type()) {
            case SERVICE_REGISTRATION -> CacheKeys.service(record.serviceId());
            case SCHEMA_UPDATE -> CacheKeys.schema(record.serviceId());
            case PATTERN_DETECTION -> CacheKeys.pattern(record.serviceId(), nextKeySuffix());
            case RELATION_UPDATE -> CacheKeys.relation(record.serviceId(), nextKeySuffix());
        };
        String value;
        try {
            value = objectMapper.writeValueAsString(record.payload() == null ? NullNode.getInstance() : record.payload());
        } catch (JsonProcessingException e) {
            throw new IngestionException("Failed to encode payload", record.id(), IngestionException.ENCODE_ERROR, e);
        }
        pipeline.add(new CacheCommand.Put(key, value));
        pipeline.add(new CacheCommand.Put(CacheKeys.processed(record.id()), "1",
                Duration.ofHours(ingestionConfig.getRetention().getProcessedTtlHours())));
    }

    /**
     * Nanosecond timestamp for pattern and relation keys, unique within this process.
     */
    private long nextKeySuffix() {
        Instant now = clock.instant();
        long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        return lastKeySuffix.updateAndGet(previous -> Math.max(previous + 1, nanos));
    }

    private void logRejection(UpdateRecord record, IngestionException e) {
        log.warn("Update rejected: id={}, type={}, reason={} [{}]",
                record.id(), record.type(), e.getMessage(), e.getErrorCode());
    }
}
