package com.kg.core.service.ingest;

import com.kg.core.service.bus.BusException;
import com.kg.core.service.bus.CancellationSignal;
import com.kg.core.service.bus.EventBus;
import com.kg.core.service.bus.EventEnvelope;
import com.kg.core.service.bus.SubscriptionHandler;
import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.config.MetricsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps a subscription to the update topics open and feeds decoded updates into the buffer.
 *
 * Undecodable events are logged and dropped. A broken or ended subscription is
 * retried with {@link ReconnectBackoff} until the run is cancelled; the attempt
 * counter resets once a subscription is established.
 */
@Slf4j
@Component
public class EventSubscriber {

    private final EventBus eventBus;
    private final UpdateRecordDecoder decoder;
    private final UpdateBuffer buffer;
    private final IngestionConfig.SubscriberConfig config;
    private final MetricsConfig metricsConfig;
    private final ReconnectBackoff backoff;

    private final AtomicReference<SubscriberState> state = new AtomicReference<>(SubscriberState.DISCONNECTED);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    @Autowired
    public EventSubscriber(EventBus eventBus, UpdateRecordDecoder decoder, UpdateBuffer buffer,
                           IngestionConfig ingestionConfig, MetricsConfig metricsConfig) {
        this(eventBus, decoder, buffer, ingestionConfig, metricsConfig, new ReconnectBackoff(
                ingestionConfig.getSubscriber().getBackoffUnitMs(),
                ingestionConfig.getSubscriber().getMaxBackoffMs(),
                ingestionConfig.getSubscriber().getMaxJitterMs()));
    }

    EventSubscriber(EventBus eventBus, UpdateRecordDecoder decoder, UpdateBuffer buffer,
                    IngestionConfig ingestionConfig, MetricsConfig metricsConfig, ReconnectBackoff backoff) {
        this.eventBus = eventBus;
        this.decoder = decoder;
        this.buffer = buffer;
        this.config = ingestionConfig.getSubscriber();
        this.metricsConfig = metricsConfig;
        this.backoff = backoff;
    }

    /**
     * Runs the subscription loop on the calling thread until cancelled.
     */
    public void run(CancellationSignal cancellation) {
        List<String> topics = config.getTopics();
        reconnectAttempts.set(0);
        log.info("Event subscriber starting on {} as {}", topics, config.getConsumerGroup());

        while (!cancellation.isCancelled()) {
            state.set(SubscriberState.CONNECTING);
            try {
                eventBus.subscribe(topics, config.getConsumerGroup(), new BufferingHandler(cancellation), cancellation);
                if (cancellation.isCancelled()) {
                    break;
                }
                log.warn("Subscription to {} ended, reconnecting", topics);
            } catch (BusException e) {
                if (cancellation.isCancelled()) {
                    break;
                }
                log.error("Subscription to {} failed: {}", topics, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error in event subscriber", e);
            }

            state.set(SubscriberState.DISCONNECTED);
            int attempt = reconnectAttempts.incrementAndGet();
            Duration delay = backoff.delayFor(attempt);
            metricsConfig.getReconnects().increment();
            log.info("Reconnecting to event bus in {} ms (attempt {})", delay.toMillis(), attempt);
            if (cancellation.await(delay)) {
                break;
            }
        }

        state.set(SubscriberState.DISCONNECTED);
        log.info("Event subscriber stopped");
    }

    public SubscriberState getState() {
        return state.get();
    }

    /**
     * Consecutive failed attempts since the last established subscription.
     */
    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    private class BufferingHandler implements SubscriptionHandler {

        private final CancellationSignal cancellation;

        BufferingHandler(CancellationSignal cancellation) {
            this.cancellation = cancellation;
        }

        @Override
        public void onSubscribed() {
            reconnectAttempts.set(0);
            state.set(SubscriberState.CONNECTED);
            log.info("Subscribed to {}", config.getTopics());
        }

        @Override
        public void onEnvelope(EventEnvelope envelope) {
            metricsConfig.getUpdatesReceived().increment();
            UpdateRecord record;
            try {
                record = decoder.decode(envelope);
            } catch (IngestionException e) {
                metricsConfig.getUpdatesDropped().increment();
                log.error("Dropping event {}: {} [{}]", envelope.id(), e.getMessage(), e.getErrorCode());
                return;
            }
            if (!buffer.put(record, cancellation)) {
                log.warn("Update {} not buffered, subscriber is stopping", record.id());
            }
        }
    }
}
