package com.kg.core.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kg.core.service.bus.BusException;
import com.kg.core.service.bus.CancellationSignal;
import com.kg.core.service.bus.EventBus;
import com.kg.core.service.bus.EventEnvelope;
import com.kg.core.service.bus.SubscriptionHandler;
import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.config.MetricsConfig;
import com.kg.core.service.support.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class EventSubscriberTest {

    private final ObjectMapper objectMapper = TestObjects.objectMapper();

    private IngestionConfig config;
    private MetricsConfig metrics;
    private BoundedUpdateBuffer buffer;
    private CancellationSignal cancellation;

    @BeforeEach
    void setUp() {
        config = TestObjects.fastIngestionConfig();
        metrics = TestObjects.metrics();
        buffer = new BoundedUpdateBuffer(config, metrics);
        buffer.init();
        cancellation = new CancellationSignal();
    }

    /**
     * Fails the first subscriptions, then delivers the scripted envelopes and
     * holds the subscription open until cancelled.
     */
    private class ScriptedBus implements EventBus {

        private final int failures;
        private final List<EventEnvelope> deliveries;
        private final AtomicInteger subscribeCalls = new AtomicInteger();

        ScriptedBus(int failures, List<EventEnvelope> deliveries) {
            this.failures = failures;
            this.deliveries = deliveries;
        }

        @Override
        public void subscribe(List<String> topics, String consumerGroup, SubscriptionHandler handler,
                              CancellationSignal signal) {
            if (subscribeCalls.incrementAndGet() <= failures) {
                throw new BusException("broker unreachable");
            }
            handler.onSubscribed();
            deliveries.forEach(handler::onEnvelope);
            while (!signal.await(Duration.ofMillis(10))) {
                // hold the subscription open
            }
        }

        @Override
        public String emit(EventEnvelope envelope, Duration timeout) {
            throw new UnsupportedOperationException();
        }
    }

    private EventEnvelope envelope(String id, String json) throws Exception {
        return new EventEnvelope(id, "knowledge_graph.update", 0, objectMapper.readTree(json));
    }

    @Test
    @DisplayName("Reconnects after failures and buffers decodable updates")
    void reconnectsAndBuffers() throws Exception {
        ScriptedBus bus = new ScriptedBus(3, List.of(
                envelope("e1", "{\"id\":\"u1\",\"type\":\"schema_update\",\"service_id\":\"svc\",\"payload\":{}}"),
                envelope("e2", "{\"id\":\"u2\",\"type\":\"unknown\"}"),
                envelope("e3", "{\"id\":\"u3\",\"type\":\"relation_update\",\"service_id\":\"svc\",\"payload\":{}}")));
        EventSubscriber subscriber = new EventSubscriber(bus, new UpdateRecordDecoder(objectMapper), buffer,
                config, metrics, new ReconnectBackoff(1, 5, () -> 0L));

        CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> subscriber.run(cancellation));

        await().atMost(2, TimeUnit.SECONDS).until(() -> buffer.size() == 2);
        assertThat(subscriber.getState()).isEqualTo(SubscriberState.CONNECTED);
        assertThat(bus.subscribeCalls.get()).isEqualTo(4);
        assertThat(subscriber.getReconnectAttempts()).isZero();
        assertThat(metrics.getReconnects().count()).isEqualTo(3.0);
        assertThat(metrics.getUpdatesReceived().count()).isEqualTo(3.0);
        assertThat(metrics.getUpdatesDropped().count()).isEqualTo(1.0);
        assertThat(buffer.poll(10).orElseThrow().id()).isEqualTo("u1");
        assertThat(buffer.poll(10).orElseThrow().id()).isEqualTo("u3");

        cancellation.cancel();
        await().atMost(2, TimeUnit.SECONDS).until(loop::isDone);
        assertThat(subscriber.getState()).isEqualTo(SubscriberState.DISCONNECTED);
    }

    @Test
    @DisplayName("Cancellation interrupts the reconnect wait")
    void cancelDuringBackoff() {
        ScriptedBus bus = new ScriptedBus(Integer.MAX_VALUE, List.of());
        EventSubscriber subscriber = new EventSubscriber(bus, new UpdateRecordDecoder(objectMapper), buffer,
                config, metrics, new ReconnectBackoff(60_000, 60_000, () -> 0L));

        CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> subscriber.run(cancellation));
        await().atMost(2, TimeUnit.SECONDS).until(() -> subscriber.getReconnectAttempts() == 1);

        cancellation.cancel();

        await().atMost(2, TimeUnit.SECONDS).until(loop::isDone);
        assertThat(bus.subscribeCalls.get()).isEqualTo(1);
    }
}
