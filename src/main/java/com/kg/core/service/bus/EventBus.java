package com.kg.core.service.bus;

import java.time.Duration;
import java.util.List;

/**
 * Platform event bus used to publish and receive knowledge graph updates.
 */
public interface EventBus {

    /**
     * Subscribes and delivers events to the handler until cancelled.
     * Returns normally on cancellation or when the bus ends the subscription.
     *
     * @param topics        topics to listen to
     * @param consumerGroup group sharing the deliveries
     * @param handler       subscription callbacks
     * @param cancellation  stop request
     * @throws BusException when the subscription cannot be established or breaks
     */
    void subscribe(List<String> topics, String consumerGroup, SubscriptionHandler handler,
                   CancellationSignal cancellation);

    /**
     * Publishes an envelope to the topic named by its type.
     *
     * @param envelope event to publish
     * @param timeout  maximum time to wait for the acknowledgement
     * @return identifier assigned by the bus
     * @throws BusException when the event is refused or not acknowledged in time
     */
    String emit(EventEnvelope envelope, Duration timeout);
}
