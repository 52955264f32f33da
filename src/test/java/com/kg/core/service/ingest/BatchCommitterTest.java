package com.kg.core.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kg.core.service.bus.CancellationSignal;
import com.kg.core.service.cache.CacheBackupManager;
import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.config.MetricsConfig;
import com.kg.core.service.support.InMemoryDurableCache;
import com.kg.core.service.support.MutableClock;
import com.kg.core.service.support.TestObjects;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class BatchCommitterTest {

    private final ObjectMapper objectMapper = TestObjects.objectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-04-30T05:16:19Z"));

    private IngestionConfig config;
    private MetricsConfig metrics;
    private InMemoryDurableCache cache;
    private BoundedUpdateBuffer buffer;
    private BatchCommitter committer;
    private CancellationSignal cancellation;

    @BeforeEach
    void setUp() {
        config = TestObjects.fastIngestionConfig();
        metrics = TestObjects.metrics();
        cache = new InMemoryDurableCache();
        buffer = new BoundedUpdateBuffer(config, metrics);
        buffer.init();
        committer = new BatchCommitter(buffer, cache, new CacheBackupManager(cache, objectMapper, config, clock),
                config, metrics, objectMapper, clock);
        cancellation = new CancellationSignal();
    }

    @AfterEach
    void tearDown() {
        cancellation.cancel();
    }

    private UpdateRecord update(String id, UpdateType type, String serviceId, String field) {
        ObjectNode payload = objectMapper.createObjectNode().put("field", field);
        return new UpdateRecord(id, type, serviceId, payload, clock.instant(), "1.0");
    }

    @Nested
    @DisplayName("Commit")
    class CommitTests {

        @Test
        @DisplayName("Writes each update type under its key with a processed marker")
        void writesKeyLayout() {
            BatchResult result = committer.commit(List.of(
                    update("u1", UpdateType.SERVICE_REGISTRATION, "user", "a"),
                    update("u2", UpdateType.SCHEMA_UPDATE, "user", "b"),
                    update("u3", UpdateType.PATTERN_DETECTION, "user", "c"),
                    update("u4", UpdateType.RELATION_UPDATE, "user", "d")));

            assertThat(result.applied()).isEqualTo(4);
            assertThat(result.rolledBack()).isFalse();
            assertThat(result.backupKey()).isEqualTo("kg:backup:" + clock.instant().getEpochSecond());

            Map<String, String> contents = cache.contents();
            assertThat(contents).containsEntry("kg:service:user", "{\"field\":\"a\"}")
                    .containsEntry("kg:schema:user", "{\"field\":\"b\"}")
                    .containsKey("kg:backup:" + clock.instant().getEpochSecond());
            assertThat(contents.keySet()).anyMatch(key -> key.matches("kg:pattern:user:\\d+"))
                    .anyMatch(key -> key.matches("kg:relation:user:\\d+"));
            assertThat(cache.ttl("kg:processed:u1")).contains(Duration.ofHours(24));
            assertThat(cache.ttl("kg:service:user")).isEmpty();
            assertThat(cache.ttl("kg:backup:" + clock.instant().getEpochSecond())).contains(Duration.ofHours(24));
        }

        @Test
        @DisplayName("Pattern and relation updates never overwrite each other")
        void uniquePatternKeys() {
            committer.commit(List.of(
                    update("p1", UpdateType.PATTERN_DETECTION, "svc", "a"),
                    update("p2", UpdateType.PATTERN_DETECTION, "svc", "b")));

            assertThat(cache.scanKeys("kg:pattern:svc:*")).hasSize(2);
        }

        @Test
        @DisplayName("An update id is applied at most once")
        void idempotent() {
            committer.commit(List.of(update("u1", UpdateType.SERVICE_REGISTRATION, "user", "first")));
            BatchResult again = committer.commit(List.of(update("u1", UpdateType.SERVICE_REGISTRATION, "user", "second")));

            assertThat(again.applied()).isZero();
            assertThat(again.rejected()).isEqualTo(1);
            assertThat(cache.contents()).containsEntry("kg:service:user", "{\"field\":\"first\"}");
        }

        @Test
        @DisplayName("Invalid records are rejected while the rest of the batch applies")
        void rejectsInvalid() {
            BatchResult result = committer.commit(List.of(
                    update("", UpdateType.SERVICE_REGISTRATION, "user", "a"),
                    update("u2", UpdateType.SERVICE_REGISTRATION, " ", "b"),
                    update("u3", null, "user", "c"),
                    update("u4", UpdateType.SCHEMA_UPDATE, "user", "d"),
                    update("u4", UpdateType.SCHEMA_UPDATE, "user", "e")));

            assertThat(result.received()).isEqualTo(5);
            assertThat(result.applied()).isEqualTo(1);
            assertThat(result.rejected()).isEqualTo(4);
            assertThat(cache.contents()).containsEntry("kg:schema:user", "{\"field\":\"d\"}")
                    .doesNotContainKey("kg:service:user");
            assertThat(metrics.getUpdatesRejected().count()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("A failed pipeline restores the graph namespaces and leaves no processed markers")
        void rollback() {
            committer.commit(List.of(update("u1", UpdateType.SERVICE_REGISTRATION, "user", "old")));
            Map<String, String> before = cache.graphNamespaces();

            cache.failNextPipelineAfter(3);
            BatchResult result = committer.commit(List.of(
                    update("u2", UpdateType.SERVICE_REGISTRATION, "user", "new"),
                    update("u3", UpdateType.SCHEMA_UPDATE, "order", "x")));

            assertThat(result.rolledBack()).isTrue();
            assertThat(result.applied()).isZero();
            assertThat(cache.graphNamespaces()).isEqualTo(before);
            assertThat(cache.contents()).doesNotContainKeys("kg:processed:u2", "kg:processed:u3")
                    .containsKey("kg:processed:u1");
            assertThat(metrics.getBatchesRolledBack().count()).isEqualTo(1.0);

            BatchResult retry = committer.commit(List.of(update("u2", UpdateType.SERVICE_REGISTRATION, "user", "new")));
            assertThat(retry.applied()).isEqualTo(1);
        }

        @Test
        @DisplayName("Batch is dropped when the backup cannot be taken")
        void dropsWithoutBackup() {
            cache.setUnavailable(true);

            BatchResult result = committer.commit(List.of(update("u1", UpdateType.SERVICE_REGISTRATION, "user", "a")));

            assertThat(result.applied()).isZero();
            assertThat(result.backupKey()).isNull();
            assertThat(metrics.getUpdatesDropped().count()).isEqualTo(1.0);
            cache.setUnavailable(false);
            assertThat(cache.contents()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Flush triggers")
    class TriggerTests {

        @Test
        @DisplayName("Flushes as soon as the batch size is reached")
        void sizeTrigger() {
            config.getBatch().setFlushIntervalMs(60_000);
            CompletableFuture.runAsync(() -> committer.run(cancellation));

            for (int i = 0; i < 3; i++) {
                buffer.put(update("u" + i, UpdateType.SCHEMA_UPDATE, "svc" + i, "v"), cancellation);
            }

            await().atMost(2, TimeUnit.SECONDS)
                    .until(() -> cache.scanKeys("kg:schema:*").size() == 3);
        }

        @Test
        @DisplayName("Flushes a partial batch when the interval elapses")
        void timeTrigger() {
            CompletableFuture.runAsync(() -> committer.run(cancellation));

            buffer.put(update("u1", UpdateType.SCHEMA_UPDATE, "svc", "v"), cancellation);

            await().atMost(2, TimeUnit.SECONDS).until(() -> cache.exists("kg:schema:svc"));
            assertThat(committer.getPendingCount()).isZero();
        }

        @Test
        @DisplayName("Flushes buffered updates on shutdown")
        void flushOnShutdown() {
            config.getBatch().setFlushIntervalMs(60_000);
            CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> committer.run(cancellation));
            buffer.put(update("u1", UpdateType.SCHEMA_UPDATE, "svc", "v"), cancellation);

            cancellation.cancel();

            await().atMost(2, TimeUnit.SECONDS).until(loop::isDone);
            assertThat(cache.exists("kg:schema:svc")).isTrue();
            assertThat(committer.getState()).isEqualTo(CommitterState.IDLE);
        }
    }
}
