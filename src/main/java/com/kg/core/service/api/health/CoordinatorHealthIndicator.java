package com.kg.core.service.api.health;

import com.kg.core.service.ingest.EventSubscriber;
import com.kg.core.service.lifecycle.KnowledgeGraphCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the lifecycle coordinator.
 *
 * DEGRADED is reported as its own status: reads keep working while publishing is refused.
 */
@Component
@RequiredArgsConstructor
public class CoordinatorHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Publishing refused until recovery");

    private final KnowledgeGraphCoordinator coordinator;
    private final EventSubscriber subscriber;

    @Override
    public Health health() {
        var state = coordinator.getState();
        Health.Builder builder = switch (state) {
            case RUNNING -> Health.up();
            case DEGRADED -> Health.status(DEGRADED);
            case STARTING -> Health.unknown();
            case STOPPED -> Health.down();
        };
        return builder
                .withDetail("state", state)
                .withDetail("subscriberState", subscriber.getState())
                .withDetail("reconnectAttempts", subscriber.getReconnectAttempts())
                .build();
    }
}
