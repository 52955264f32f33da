package com.kg.core.service.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kg.core.service.bus.BusException;
import com.kg.core.service.bus.CancellationSignal;
import com.kg.core.service.bus.EventBus;
import com.kg.core.service.bus.EventEnvelope;
import com.kg.core.service.cache.CacheUnavailableException;
import com.kg.core.service.cache.DurableCache;
import com.kg.core.service.config.KnowledgeGraphConfig;
import com.kg.core.service.config.MetricsConfig;
import com.kg.core.service.graph.GraphStore;
import com.kg.core.service.graph.GraphStoreException;
import com.kg.core.service.ingest.BatchCommitter;
import com.kg.core.service.ingest.EventSubscriber;
import com.kg.core.service.ingest.IngestionException;
import com.kg.core.service.ingest.UpdateRecord;
import com.kg.core.service.ingest.UpdateType;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sequences startup and shutdown of the ingestion pipeline and guards update publishing.
 *
 * Start never fails: an unreachable durable cache or a pipeline that cannot be
 * started leaves the coordinator DEGRADED. While DEGRADED every publish is refused
 * without contacting the event bus, until {@link #recover()} succeeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphCoordinator {

    public static final String UPDATE_EVENT_TYPE = "knowledge_graph.update";
    static final String UPDATE_VERSION = "1.0";

    private final GraphStore graphStore;
    private final DurableCache cache;
    private final EventBus eventBus;
    private final EventSubscriber subscriber;
    private final BatchCommitter committer;
    private final KnowledgeGraphConfig config;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<CoordinatorState> state = new AtomicReference<>(CoordinatorState.STOPPED);
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final Object lifecycleMonitor = new Object();

    private ExecutorService pipelineExecutor;
    private CancellationSignal cancellation;

    // ==================== Lifecycle ====================

    @EventListener(ApplicationReadyEvent.class)
    void onApplicationReady() {
        if (config.getLifecycle().isAutoStart()) {
            start();
        } else {
            log.info("Auto-start disabled, coordinator remains {}", state.get());
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    /**
     * Checks the durable cache, starts the subscriber and committer and saves the graph.
     *
     * @return RUNNING, or DEGRADED when a dependency or the pipeline failed
     */
    public CoordinatorState start() {
        synchronized (lifecycleMonitor) {
            if (state.get() != CoordinatorState.STOPPED) {
                log.warn("Coordinator already started, state={}", state.get());
                return state.get();
            }
            state.set(CoordinatorState.STARTING);

            boolean cacheAvailable = checkCache();
            boolean pipelineStarted = startPipeline();
            var target = cacheAvailable && pipelineStarted ? CoordinatorState.RUNNING : CoordinatorState.DEGRADED;
            state.set(target);
            if (target == CoordinatorState.DEGRADED) {
                log.warn("Knowledge graph coordinator started in degraded mode");
            } else {
                log.info("Knowledge graph coordinator started");
            }

            saveGraph();
            return target;
        }
    }

    /**
     * Stops the subscriber and committer, then saves the graph.
     */
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (state.get() == CoordinatorState.STOPPED) {
                return;
            }
            stopPipeline();
            saveGraph();
            state.set(CoordinatorState.STOPPED);
            log.info("Knowledge graph coordinator stopped");
        }
    }

    /**
     * Leaves degraded mode once the durable cache answers again, restarting the pipeline.
     *
     * @return the state after the attempt
     * @throws CacheUnavailableException when the durable cache is still unreachable
     */
    public CoordinatorState recover() {
        synchronized (lifecycleMonitor) {
            if (state.get() != CoordinatorState.DEGRADED) {
                log.info("Recovery requested while {}, nothing to do", state.get());
                return state.get();
            }
            cache.ping();
            stopPipeline();
            if (!startPipeline()) {
                throw new IngestionException("Failed to restart ingestion pipeline", null,
                        IngestionException.RECOVERY_FAILED);
            }
            state.set(CoordinatorState.RUNNING);
            log.info("Recovered from degraded mode");
            return CoordinatorState.RUNNING;
        }
    }

    public CoordinatorState getState() {
        return state.get();
    }

    public boolean isDegraded() {
        return state.get() == CoordinatorState.DEGRADED;
    }

    private boolean checkCache() {
        try {
            cache.ping();
            return true;
        } catch (CacheUnavailableException e) {
            log.error("Durable cache unavailable: {}", e.getMessage());
            return false;
        }
    }

    private boolean startPipeline() {
        try {
            cancellation = new CancellationSignal();
            pipelineExecutor = Executors.newFixedThreadPool(2, this::createPipelineThread);
            var signal = cancellation;
            pipelineExecutor.submit(() -> subscriber.run(signal));
            pipelineExecutor.submit(() -> committer.run(signal));
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to start ingestion pipeline", e);
            return false;
        }
    }

    private Thread createPipelineThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("kg-pipeline-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    private void stopPipeline() {
        if (cancellation != null) {
            cancellation.cancel();
        }
        if (pipelineExecutor == null) {
            return;
        }
        pipelineExecutor.shutdown();
        try {
            long timeout = config.getLifecycle().getShutdownTimeoutSeconds();
            if (!pipelineExecutor.awaitTermination(timeout, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of ingestion pipeline");
                pipelineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipelineExecutor.shutdownNow();
        }
        pipelineExecutor = null;
    }

    // ==================== Publishing ====================

    /**
     * Publishes an update with the configured default timeout.
     */
    public String publishUpdate(UpdateRecord record) {
        return publishUpdate(record, Duration.ofMillis(config.getLifecycle().getPublishTimeoutMs()));
    }

    /**
     * Validates and publishes an update to the event bus.
     * A bus failure switches the coordinator to DEGRADED.
     *
     * @param record  the update, stamped with the current time when it has none
     * @param timeout maximum time to wait for the bus
     * @return event id assigned by the bus
     * @throws ServiceDegradedException when degraded, without contacting the bus
     * @throws IngestionException       {@code VALIDATION_ERROR} or {@code PUBLISH_FAILED}
     */
    public String publishUpdate(UpdateRecord record, Duration timeout) {
        if (isDegraded()) {
            log.warn("Attempted to publish update while in degraded mode: id={}, type={}", record.id(), record.type());
            throw new ServiceDegradedException(record.id());
        }
        validate(record);

        var stamped = record.timestamp() == null ? record.withTimestamp(clock.instant()) : record;
        JsonNode payload = objectMapper.valueToTree(stamped);
        var envelope = new EventEnvelope(stamped.id(), UPDATE_EVENT_TYPE, stamped.timestamp().getEpochSecond(), payload);

        long startNanos = System.nanoTime();
        try {
            String eventId = eventBus.emit(envelope, timeout);
            metricsConfig.getUpdatesPublished().increment();
            log.debug("Published update {} as {}", stamped.id(), eventId);
            return eventId;
        } catch (BusException e) {
            state.set(CoordinatorState.DEGRADED);
            metricsConfig.getPublishFailures().increment();
            log.error("Failed to publish update {}, entering degraded mode", stamped.id(), e);
            throw new IngestionException("Failed to publish update: " + e.getMessage(), stamped.id(),
                    IngestionException.PUBLISH_FAILED, e);
        } finally {
            metricsConfig.getPublishTimer().record(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private void validate(UpdateRecord record) {
        if (record.id() == null || record.id().isBlank()) {
            throw new IngestionException("Update id is required", null, IngestionException.VALIDATION_ERROR);
        }
        if (record.serviceId() == null || record.serviceId().isBlank()) {
            throw new IngestionException("Service id is required", record.id(), IngestionException.VALIDATION_ERROR);
        }
        if (record.type() == null) {
            throw new IngestionException("Update type is required", record.id(), IngestionException.VALIDATION_ERROR);
        }
    }

    // ==================== Convenience Updates ====================

    public String registerService(String serviceId, List<String> capabilities, JsonNode schema) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("capabilities", objectMapper.valueToTree(capabilities == null ? List.of() : capabilities));
        payload.set("schema", schema);
        return publishUpdate(newUpdate("reg", UpdateType.SERVICE_REGISTRATION, serviceId, payload));
    }

    public String updateSchema(String serviceId, JsonNode schema) {
        return publishUpdate(newUpdate("schema", UpdateType.SCHEMA_UPDATE, serviceId, schema));
    }

    /**
     * Publishes a relation update, then saves and backs up the graph.
     */
    public String updateRelation(String serviceId, JsonNode relation) {
        String eventId = publishUpdate(newUpdate("rel", UpdateType.RELATION_UPDATE, serviceId, relation));
        persistAndBackup("UpdateRelation: " + serviceId);
        return eventId;
    }

    private UpdateRecord newUpdate(String prefix, UpdateType type, String serviceId, JsonNode payload) {
        String id = prefix + "_" + serviceId + "_" + clock.millis();
        return new UpdateRecord(id, type, serviceId, payload, clock.instant(), UPDATE_VERSION);
    }

    // ==================== Persistence ====================

    private void persistAndBackup(String reason) {
        if (!saveGraph()) {
            return;
        }
        try {
            graphStore.backup("Auto-backup: " + reason);
        } catch (GraphStoreException e) {
            log.error("Failed to back up knowledge graph after {}: {} [{}]", reason, e.getMessage(), e.getErrorCode());
        }
    }

    private boolean saveGraph() {
        try {
            graphStore.save(Path.of(config.getStore().getPath()));
            return true;
        } catch (GraphStoreException e) {
            log.error("Failed to save knowledge graph: {} [{}]", e.getMessage(), e.getErrorCode());
            return false;
        }
    }
}
