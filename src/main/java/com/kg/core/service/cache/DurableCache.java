package com.kg.core.service.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value store holding committed graph updates.
 *
 * Every method throws {@link CacheUnavailableException} when the store cannot be reached.
 */
public interface DurableCache {

    /**
     * Verifies the store answers.
     */
    void ping();

    /**
     * Collects every key matching a glob pattern.
     */
    Set<String> scanKeys(String pattern);

    Optional<String> get(String key);

    boolean exists(String key);

    /**
     * Stores a value. A null ttl keeps the value until it is overwritten or deleted.
     */
    void put(String key, String value, Duration ttl);

    /**
     * Sends all commands in one round trip, in order.
     *
     * @param commands writes to apply
     */
    void execute(List<CacheCommand> commands);
}
