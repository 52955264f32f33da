package com.kg.core.service.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.config.MetricsConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Factories for collaborators shared by unit tests.
 */
public final class TestObjects {

    private TestObjects() {
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static MetricsConfig metrics() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    /**
     * Ingestion settings with short timings so loops react within milliseconds.
     */
    public static IngestionConfig fastIngestionConfig() {
        IngestionConfig config = new IngestionConfig();
        config.getBuffer().setCapacity(10);
        config.getBuffer().setOfferSliceMs(10);
        config.getBatch().setSize(3);
        config.getBatch().setFlushIntervalMs(200);
        config.getBatch().setPollMs(10);
        config.getSubscriber().setBackoffUnitMs(1);
        config.getSubscriber().setMaxBackoffMs(20);
        config.getSubscriber().setMaxJitterMs(0);
        return config;
    }
}
