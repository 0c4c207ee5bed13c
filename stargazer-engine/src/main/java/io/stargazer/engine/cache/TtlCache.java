/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.cache;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;

/**
 * A TTL keyed store shared by every fetch of the engine.
 * Entries are replaced atomically and become invisible once older than the TTL.
 * Safe for concurrent readers and writers.
 * <p>Cache statistics are published to the given registry, tagged with an instance id so that
 * several caches of the same name can coexist. {@link #close()} removes them.</p>
 */
public class TtlCache implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TtlCache.class);

    static final String INSTANCE_TAG = "instance";
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final Cache<String, Object> entries;
    private final Duration ttl;
    private final MeterRegistry registry;
    private final String instance;

    public TtlCache(String name, Duration ttl, MeterRegistry registry) {
        this(name, ttl, registry, Ticker.systemTicker());
    }

    TtlCache(String name, Duration ttl, MeterRegistry registry, Ticker ticker) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, was " + ttl);
        }
        this.ttl = ttl;
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.instance = String.valueOf(INSTANCES.incrementAndGet());
        this.entries = Caffeine.newBuilder()
                .recordStats()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        new CaffeineCacheMetrics<>(this.entries, "stargazer_" + name, List.of(Tag.of(INSTANCE_TAG, instance))).bindTo(registry);
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * @return the value for {@code key}, empty if absent, expired or of another type
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = entries.getIfPresent(key);
        if (value == null) {
            LOGGER.atDebug().setMessage("cache miss for {}").addArgument(key).log();
            return Optional.empty();
        }
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public void set(String key, Object value) {
        entries.put(key, Objects.requireNonNull(value));
    }

    /**
     * Returns the fresh value for {@code key}, computing and storing it if there is none.
     * Concurrent callers for the same key share one computation.
     * A computation that throws stores nothing and the exception propagates.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, Supplier<T> loader) {
        return (T) entries.get(key, k -> {
            LOGGER.atDebug().setMessage("cache miss for {}, loading").addArgument(k).log();
            return loader.get();
        });
    }

    public void invalidate(String key) {
        entries.invalidate(key);
    }

    /**
     * Invalidates every key starting with {@code prefix}.
     */
    public void invalidatePrefix(String prefix) {
        entries.asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }

    public void clear() {
        entries.invalidateAll();
    }

    /**
     * Drops every entry and removes this cache's meters from the registry.
     */
    @Override
    public void close() {
        entries.invalidateAll();
        registry.getMeters().stream()
                .filter(meter -> instance.equals(meter.getId().getTag(INSTANCE_TAG)))
                .toList()
                .forEach(registry::remove);
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
