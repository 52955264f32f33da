package com.kg.core.service.cache;

import com.kg.core.service.support.TestObjects;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the Redis cache and the backup manager against a real Redis.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisDurableCacheIntegrationTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisDurableCache cache;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        cache = new RedisDurableCache(redisTemplate);
    }

    @Test
    @DisplayName("Ping succeeds against a live server")
    void ping() {
        cache.ping();
    }

    @Test
    @DisplayName("Pipeline applies puts with and without TTL and deletes")
    void pipeline() {
        cache.put("kg:service:old", "{}", null);

        cache.execute(List.of(
                new CacheCommand.Delete(List.of("kg:service:old")),
                new CacheCommand.Put("kg:service:user", "{\"a\":1}"),
                new CacheCommand.Put("kg:processed:u1", "1", Duration.ofHours(24))));

        assertThat(cache.exists("kg:service:old")).isFalse();
        assertThat(cache.get("kg:service:user")).contains("{\"a\":1}");
        assertThat(redisTemplate.getExpire("kg:processed:u1")).isBetween(86_000L, 86_400L);
        assertThat(redisTemplate.getExpire("kg:service:user")).isEqualTo(-1L);
    }

    @Test
    @DisplayName("Scan matches a key namespace")
    void scan() {
        cache.put("kg:pattern:svc:1", "{}", null);
        cache.put("kg:pattern:svc:2", "{}", null);
        cache.put("kg:relation:svc:1", "{}", null);

        assertThat(cache.scanKeys("kg:pattern:*")).containsExactlyInAnyOrder("kg:pattern:svc:1", "kg:pattern:svc:2");
    }

    @Test
    @DisplayName("Rollback restores the captured namespaces")
    void snapshotAndRollback() {
        var backups = new CacheBackupManager(cache, TestObjects.objectMapper(),
                TestObjects.fastIngestionConfig(), Clock.systemUTC());
        cache.put("kg:service:user", "{\"v\":1}", null);

        BackupSnapshot snapshot = backups.snapshot();
        cache.put("kg:service:user", "{\"v\":2}", null);
        cache.put("kg:schema:user", "{}", null);
        cache.put("kg:processed:u9", "1", Duration.ofHours(1));

        backups.rollback(snapshot, List.of("kg:processed:u9"));

        assertThat(snapshot.entries()).isEqualTo(Map.of("kg:service:user", "{\"v\":1}"));
        assertThat(cache.get("kg:service:user")).contains("{\"v\":1}");
        assertThat(cache.exists("kg:schema:user")).isFalse();
        assertThat(cache.exists("kg:processed:u9")).isFalse();
        assertThat(cache.exists(snapshot.backupKey())).isTrue();
    }
}
