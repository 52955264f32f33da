package com.kg.core.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis implementation of the durable cache.
 *
 * Spring data access failures surface as {@link CacheUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisDurableCache implements DurableCache {

    private static final long SCAN_COUNT = 500;
    private static final String PONG = "PONG";

    private final StringRedisTemplate redisTemplate;

    @Override
    public void ping() {
        String reply;
        try {
            reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis ping failed: " + e.getMessage(), e);
        }
        if (!PONG.equalsIgnoreCase(reply)) {
            throw new CacheUnavailableException("Unexpected Redis ping reply: " + reply);
        }
    }

    @Override
    public Set<String> scanKeys(String pattern) {
        Set<String> keys = new LinkedHashSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Failed to scan keys matching " + pattern, e);
        }
        return keys;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Failed to read " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Failed to check " + key, e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            if (ttl == null) {
                redisTemplate.opsForValue().set(key, value);
            } else {
                redisTemplate.opsForValue().set(key, value, ttl);
            }
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Failed to write " + key, e);
        }
    }

    @Override
    public void execute(List<CacheCommand> commands) {
        if (commands.isEmpty()) {
            return;
        }
        try {
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                StringRedisConnection stringConnection = (StringRedisConnection) connection;
                for (CacheCommand command : commands) {
                    if (command instanceof CacheCommand.Put put) {
                        if (put.ttl() == null) {
                            stringConnection.set(put.key(), put.value());
                        } else {
                            stringConnection.setEx(put.key(), put.ttl().toSeconds(), put.value());
                        }
                    } else if (command instanceof CacheCommand.Delete delete && !delete.keys().isEmpty()) {
                        stringConnection.del(delete.keys().toArray(new String[0]));
                    }
                }
                return null;
            });
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis pipeline of " + commands.size() + " commands failed", e);
        }
        log.debug("Executed Redis pipeline of {} commands", commands.size());
    }
}
