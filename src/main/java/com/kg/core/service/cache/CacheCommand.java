package com.kg.core.service.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * A single write queued into a cache pipeline.
 */
public sealed interface CacheCommand permits CacheCommand.Put, CacheCommand.Delete {

    /**
     * Stores a value, expiring after {@code ttl} when one is given.
     */
    record Put(String key, String value, Duration ttl) implements CacheCommand {

        public Put(String key, String value) {
            this(key, value, null);
        }
    }

    record Delete(List<String> keys) implements CacheCommand {

        public Delete(Collection<String> keys) {
            this(List.copyOf(keys));
        }
    }
}
