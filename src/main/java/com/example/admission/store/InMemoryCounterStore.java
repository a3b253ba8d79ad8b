package com.example.admission.store;

import com.example.admission.model.WindowCounts;
import com.example.admission.model.WindowKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local counter store.
 * <p>
 * Counts are only correct for a single instance: every replica keeps its own counters, so a
 * fleet of N instances admits up to N times the configured limits. Use it for local runs and
 * tests, or as an explicitly degraded mode when no Redis is available.
 * <p>
 * The three windows are incremented one after the other, not as one atomic batch. Each window
 * count is exact under concurrency, but a concurrent {@link #peekAll} may observe the minute
 * counter already incremented and the hour or day counter not yet.
 * <p>
 * Eviction runs every {@code rate-limiter.memory-eviction-interval}.
 */
public class InMemoryCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCounterStore.class);

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final CounterKeys keys;
    private final Clock clock;

    public InMemoryCounterStore(CounterKeys keys, Clock clock) {
        this.keys = keys;
        this.clock = clock;
        log.warn("Using in-memory rate limit counters; limits are enforced per instance only");
    }

    @Override
    public WindowCounts incrementAll(String identifier, String category, Instant now) {
        long nowSeconds = now.getEpochSecond();
        long minute = increment(keys.key(identifier, category, WindowKind.MINUTE, nowSeconds), WindowKind.MINUTE, nowSeconds);
        long hour = increment(keys.key(identifier, category, WindowKind.HOUR, nowSeconds), WindowKind.HOUR, nowSeconds);
        long day = increment(keys.key(identifier, category, WindowKind.DAY, nowSeconds), WindowKind.DAY, nowSeconds);
        return WindowCounts.of(minute, hour, day);
    }

    @Override
    public WindowCounts peekAll(String identifier, String category, Instant now) {
        long nowSeconds = now.getEpochSecond();
        return WindowCounts.of(
                read(keys.key(identifier, category, WindowKind.MINUTE, nowSeconds), nowSeconds),
                read(keys.key(identifier, category, WindowKind.HOUR, nowSeconds), nowSeconds),
                read(keys.key(identifier, category, WindowKind.DAY, nowSeconds), nowSeconds));
    }

    @Override
    public boolean reset(String identifier, String category, Instant now) {
        List<String> liveKeys = keys.liveKeys(identifier, category, now.getEpochSecond());
        int deleted = 0;
        for (String key : liveKeys) {
            if (counters.remove(key) != null) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Reset {} rate limit counters for {} on {}", deleted, identifier, category);
        }
        return deleted > 0;
    }

    @Override
    public boolean isReachable() {
        return true;
    }

    @Override
    public Instant lastFailure() {
        return null;
    }

    @Override
    public String type() {
        return "memory";
    }

    /**
     * Drops expired counters. Expired entries are otherwise only replaced lazily on access.
     */
    @Scheduled(fixedDelayString = "${rate-limiter.memory-eviction-interval:PT1M}")
    public void evictExpired() {
        long nowSeconds = clock.instant().getEpochSecond();
        int before = counters.size();
        counters.values().removeIf(counter -> counter.isExpired(nowSeconds));
        int evicted = before - counters.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired in-memory counters", evicted);
        }
    }

    int size() {
        return counters.size();
    }

    private long increment(String key, WindowKind window, long nowSeconds) {
        long expiresAt = nowSeconds + keys.ttlSeconds(window);
        Counter counter = counters.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(nowSeconds)) {
                return new Counter(1L, expiresAt);
            }
            return new Counter(existing.value + 1L, expiresAt);
        });
        return counter.value;
    }

    private long read(String key, long nowSeconds) {
        Counter counter = counters.get(key);
        if (counter == null || counter.isExpired(nowSeconds)) {
            return 0L;
        }
        return counter.value;
    }

    private static final class Counter {
        private final long value;
        private final long expiresAtSeconds;

        private Counter(long value, long expiresAtSeconds) {
            this.value = value;
            this.expiresAtSeconds = expiresAtSeconds;
        }

        private boolean isExpired(long nowSeconds) {
            return nowSeconds >= expiresAtSeconds;
        }
    }
}
