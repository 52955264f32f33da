package com.kg.core.service.graph;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named top-level sections of the knowledge graph document.
 */
public enum GraphSection {

    SYSTEM_COMPONENTS("system_components"),
    REPOSITORY_STRUCTURE("repository_structure"),
    SERVICES("services"),
    NEXUS("nexus"),
    PATTERNS("patterns"),
    DATABASE_PRACTICES("database_practices"),
    REDIS_PRACTICES("redis_practices"),
    AMADEUS_INTEGRATION("amadeus_integration");

    private final String key;

    GraphSection(String key) {
        this.key = key;
    }

    /**
     * JSON key of the section in the persisted document.
     */
    public String getKey() {
        return key;
    }

    public static Optional<GraphSection> fromKey(String key) {
        return Arrays.stream(values())
                .filter(section -> section.key.equals(key))
                .findFirst();
    }
}
