package com.kg.core.service.api.dto;

import com.kg.core.service.ingest.CommitterState;
import com.kg.core.service.ingest.SubscriberState;
import com.kg.core.service.lifecycle.CoordinatorState;
import lombok.Builder;
import lombok.Data;

/**
 * Current state of the coordinator and the ingestion pipeline it supervises.
 */
@Data
@Builder
public class LifecycleStatusResponse {

    private CoordinatorState state;
    private boolean degraded;
    private SubscriberState subscriberState;
    private int reconnectAttempts;
    private CommitterState committerState;
    private int pendingUpdates;
    private int bufferSize;
    private int bufferCapacity;
}
