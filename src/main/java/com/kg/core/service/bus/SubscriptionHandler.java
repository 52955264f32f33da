package com.kg.core.service.bus;

/**
 * Callbacks of an event bus subscription.
 */
public interface SubscriptionHandler {

    /**
     * Called once the subscription is established.
     */
    void onSubscribed();

    /**
     * Called for each delivered envelope, on the subscribing thread. May block.
     */
    void onEnvelope(EventEnvelope envelope);
}
