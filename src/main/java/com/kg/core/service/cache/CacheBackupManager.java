package com.kg.core.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kg.core.service.config.IngestionConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Captures and restores the graph namespaces of the durable cache around a batch.
 *
 * Rollback is compensation, not an atomic commit: it deletes the current keys and
 * rewrites the captured pairs in one pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheBackupManager {

    private final DurableCache cache;
    private final ObjectMapper objectMapper;
    private final IngestionConfig ingestionConfig;
    private final Clock clock;

    /**
     * Reads every key of the graph namespaces and stores the copy under
     * {@code kg:backup:<unix seconds>}.
     *
     * @return the captured snapshot
     * @throws CacheUnavailableException when the cache cannot be read or written
     */
    public BackupSnapshot snapshot() {
        Map<String, String> entries = new LinkedHashMap<>();
        for (String pattern : CacheKeys.SNAPSHOT_PATTERNS) {
            for (String key : new TreeSet<>(cache.scanKeys(pattern))) {
                cache.get(key).ifPresent(value -> entries.put(key, value));
            }
        }

        Instant createdAt = clock.instant();
        String backupKey = CacheKeys.backup(createdAt.getEpochSecond());
        cache.put(backupKey, encode(entries), Duration.ofHours(ingestionConfig.getRetention().getBackupTtlHours()));
        log.debug("Captured cache backup {} with {} keys", backupKey, entries.size());
        return new BackupSnapshot(backupKey, createdAt, entries);
    }

    /**
     * Restores the graph namespaces to the snapshot.
     *
     * @param snapshot  state to restore
     * @param extraKeys further keys written by the failed batch, deleted as well
     */
    public void rollback(BackupSnapshot snapshot, Collection<String> extraKeys) {
        Set<String> toDelete = new LinkedHashSet<>(extraKeys);
        for (String pattern : CacheKeys.SNAPSHOT_PATTERNS) {
            toDelete.addAll(cache.scanKeys(pattern));
        }

        List<CacheCommand> commands = new ArrayList<>();
        if (!toDelete.isEmpty()) {
            commands.add(new CacheCommand.Delete(toDelete));
        }
        snapshot.entries().forEach((key, value) -> commands.add(new CacheCommand.Put(key, value)));
        cache.execute(commands);
        log.info("Rolled back cache to backup {} ({} keys restored)", snapshot.backupKey(), snapshot.entries().size());
    }

    private String encode(Map<String, String> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode cache backup", e);
        }
    }
}
