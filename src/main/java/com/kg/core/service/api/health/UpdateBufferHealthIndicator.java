package com.kg.core.service.api.health;

import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.ingest.UpdateBuffer;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the update buffer.
 *
 * Reports buffer depth and utilization for monitoring.
 */
@Component
@RequiredArgsConstructor
public class UpdateBufferHealthIndicator implements HealthIndicator {

    private final UpdateBuffer buffer;
    private final IngestionConfig config;

    @Override
    public Health health() {
        int utilization = buffer.getUtilizationPercent();
        int threshold = config.getBuffer().getBackpressureThreshold();

        Health.Builder builder = utilization >= threshold
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("bufferSize", buffer.size())
                .withDetail("bufferCapacity", buffer.getCapacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .withDetail("isFull", buffer.isFull())
                .build();
    }
}
