package com.kg.core.service.cache;

import java.time.Instant;
import java.util.Map;

/**
 * Cache contents captured before a batch is applied.
 *
 * @param backupKey key under which the snapshot was stored in the cache
 * @param createdAt when the snapshot was taken
 * @param entries   captured key/value pairs of the graph namespaces
 */
public record BackupSnapshot(String backupKey, Instant createdAt, Map<String, String> entries) {
}
