package com.kg.core.service.support;

import com.kg.core.service.cache.CacheCommand;
import com.kg.core.service.cache.CacheUnavailableException;
import com.kg.core.service.cache.DurableCache;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Map-backed durable cache with failure injection for pipeline tests.
 */
public class InMemoryDurableCache implements DurableCache {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private final AtomicInteger pipelinesToFail = new AtomicInteger();
    private volatile int commandsAppliedBeforeFailure;
    private volatile boolean unavailable;

    /**
     * Makes the next pipeline apply only its first commands and then fail.
     */
    public void failNextPipelineAfter(int appliedCommands) {
        this.commandsAppliedBeforeFailure = appliedCommands;
        pipelinesToFail.incrementAndGet();
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public Map<String, String> contents() {
        return new TreeMap<>(values);
    }

    /**
     * Contents of the namespaces a batch backup covers.
     */
    public Map<String, String> graphNamespaces() {
        return values.entrySet().stream()
                .filter(e -> e.getKey().startsWith("kg:service:") || e.getKey().startsWith("kg:schema:")
                        || e.getKey().startsWith("kg:pattern:") || e.getKey().startsWith("kg:relation:"))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, TreeMap::new));
    }

    public Optional<Duration> ttl(String key) {
        return Optional.ofNullable(ttls.get(key));
    }

    @Override
    public void ping() {
        checkAvailable();
    }

    @Override
    public Set<String> scanKeys(String pattern) {
        checkAvailable();
        Pattern regex = Pattern.compile(Pattern.quote(pattern).replace("*", "\\E.*\\Q"));
        return values.keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .collect(Collectors.toSet());
    }

    @Override
    public Optional<String> get(String key) {
        checkAvailable();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public boolean exists(String key) {
        checkAvailable();
        return values.containsKey(key);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        checkAvailable();
        values.put(key, value);
        if (ttl != null) {
            ttls.put(key, ttl);
        } else {
            ttls.remove(key);
        }
    }

    @Override
    public void execute(List<CacheCommand> commands) {
        checkAvailable();
        boolean fail = pipelinesToFail.getAndUpdate(n -> Math.max(0, n - 1)) > 0;
        int limit = fail ? Math.min(commandsAppliedBeforeFailure, commands.size()) : commands.size();
        for (int i = 0; i < limit; i++) {
            apply(commands.get(i));
        }
        if (fail) {
            throw new CacheUnavailableException("Injected pipeline failure");
        }
    }

    private void apply(CacheCommand command) {
        if (command instanceof CacheCommand.Put put) {
            put(put.key(), put.value(), put.ttl());
        } else if (command instanceof CacheCommand.Delete delete) {
            delete.keys().forEach(key -> {
                values.remove(key);
                ttls.remove(key);
            });
        }
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new CacheUnavailableException("Cache unavailable");
        }
    }
}
