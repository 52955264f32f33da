package com.kg.core.service.cache;

import java.util.List;

/**
 * Key layout of the durable cache.
 */
public final class CacheKeys {

    public static final String SERVICE_PREFIX = "kg:service:";
    public static final String SCHEMA_PREFIX = "kg:schema:";
    public static final String PATTERN_PREFIX = "kg:pattern:";
    public static final String RELATION_PREFIX = "kg:relation:";
    public static final String PROCESSED_PREFIX = "kg:processed:";
    public static final String BACKUP_PREFIX = "kg:backup:";

    /**
     * Namespaces captured by a pre-batch backup and cleared by a rollback.
     */
    public static final List<String> SNAPSHOT_PATTERNS = List.of(
            SERVICE_PREFIX + "*",
            SCHEMA_PREFIX + "*",
            PATTERN_PREFIX + "*",
            RELATION_PREFIX + "*");

    private CacheKeys() {
    }

    public static String service(String serviceId) {
        return SERVICE_PREFIX + serviceId;
    }

    public static String schema(String serviceId) {
        return SCHEMA_PREFIX + serviceId;
    }

    public static String pattern(String serviceId, long suffix) {
        return PATTERN_PREFIX + serviceId + ":" + suffix;
    }

    public static String relation(String serviceId, long suffix) {
        return RELATION_PREFIX + serviceId + ":" + suffix;
    }

    public static String processed(String updateId) {
        return PROCESSED_PREFIX + updateId;
    }

    public static String backup(long epochSeconds) {
        return BACKUP_PREFIX + epochSeconds;
    }
}
