package com.kg.core.service.ingest;

import com.kg.core.service.bus.CancellationSignal;
import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Update buffer backed by a bounded BlockingQueue.
 *
 * A full buffer makes the subscriber wait, which in turn stops it from polling
 * the event bus until the committer catches up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BoundedUpdateBuffer implements UpdateBuffer {

    private final IngestionConfig config;
    private final MetricsConfig metricsConfig;

    private BlockingQueue<UpdateRecord> queue;
    private int capacity;

    @PostConstruct
    void init() {
        this.capacity = config.getBuffer().getCapacity();
        this.queue = new LinkedBlockingQueue<>(capacity);

        metricsConfig.registerBufferGauge(
                "kg.ingest.buffer.size",
                "Current update buffer size",
                this::size
        );
        metricsConfig.registerBufferGauge(
                "kg.ingest.buffer.utilization",
                "Update buffer utilization percentage",
                this::getUtilizationPercent
        );

        log.info("UpdateBuffer initialized with capacity: {}", capacity);
    }

    @Override
    public boolean put(UpdateRecord record, CancellationSignal cancellation) {
        long sliceMs = config.getBuffer().getOfferSliceMs();
        boolean warned = false;
        try {
            while (!cancellation.isCancelled()) {
                if (queue.offer(record, sliceMs, TimeUnit.MILLISECONDS)) {
                    log.debug("Buffered update: {}", record.id());
                    return true;
                }
                if (!warned) {
                    log.warn("Update buffer full, applying backpressure on update: {}", record.id());
                    warned = true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while buffering update: {}", record.id(), e);
        }
        return false;
    }

    @Override
    public Optional<UpdateRecord> poll(long timeoutMs) {
        try {
            return Optional.ofNullable(queue.poll(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while polling update buffer");
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }
}
