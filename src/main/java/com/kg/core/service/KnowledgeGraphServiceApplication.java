package com.kg.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Knowledge Graph Service Application - Entry point for the Spring Boot application.
 *
 * Holds the platform's knowledge graph document and runs the real-time update pipeline:
 * - Publishes updates from other services onto the event bus
 * - Subscribes to the bus and buffers decoded updates
 * - Commits buffered updates to Redis in batches with backup and rollback
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.kg.core.service.config")
public class KnowledgeGraphServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeGraphServiceApplication.class, args);
    }
}
