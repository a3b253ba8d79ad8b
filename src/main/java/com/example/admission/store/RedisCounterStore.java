package com.example.admission.store;

import com.example.admission.model.WindowCounts;
import com.example.admission.model.WindowKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Counter store backed by Redis, shared by every instance of the service.
 *
 * The three window counters are incremented by a single Lua script so that concurrent callers
 * can never observe a partially updated set of counters. This class is responsible for:
 *  - building the window keys and their TTLs
 *  - translating the script result into {@link WindowCounts}
 *  - absorbing Redis failures and remembering when the last one happened
 */
public class RedisCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<List> incrementScript;
    private final CounterKeys keys;
    private final Clock clock;

    private volatile Instant lastFailure;

    public RedisCounterStore(
            StringRedisTemplate redisTemplate,
            RedisScript<List> incrementScript,
            CounterKeys keys,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = incrementScript;
        this.keys = keys;
        this.clock = clock;
    }

    @Override
    public WindowCounts incrementAll(String identifier, String category, Instant now) {
        List<String> windowKeys = keys.currentKeys(identifier, category, now.getEpochSecond());
        String minuteTtl = Long.toString(keys.ttlSeconds(WindowKind.MINUTE));
        String hourTtl = Long.toString(keys.ttlSeconds(WindowKind.HOUR));
        String dayTtl = Long.toString(keys.ttlSeconds(WindowKind.DAY));

        try {
            Object result = redisTemplate.execute(incrementScript, windowKeys, minuteTtl, hourTtl, dayTtl);

            if (!(result instanceof List<?> listResult) || listResult.size() < 3) {
                log.error("Unexpected counter script result for {} on {}: {}", identifier, category, result);
                return failure();
            }
            return WindowCounts.of(toLong(listResult.get(0)), toLong(listResult.get(1)), toLong(listResult.get(2)));
        } catch (RedisConnectionFailureException ex) {
            log.warn("Redis connection failure while incrementing counters for {} on {}", identifier, category, ex);
            return failure();
        } catch (DataAccessException ex) {
            // Script execution and other Redis-related errors.
            log.error("Redis data access error while incrementing counters for {} on {}", identifier, category, ex);
            return failure();
        } catch (RuntimeException ex) {
            log.error("Unexpected error while incrementing counters for {} on {}", identifier, category, ex);
            return failure();
        }
    }

    @Override
    public WindowCounts peekAll(String identifier, String category, Instant now) {
        List<String> windowKeys = keys.currentKeys(identifier, category, now.getEpochSecond());
        try {
            List<String> values = redisTemplate.opsForValue().multiGet(windowKeys);
            if (values == null || values.size() < 3) {
                // multiGet returns null inside a pipeline or transaction only.
                log.error("Unexpected MGET result for {} on {}: {}", identifier, category, values);
                return failure();
            }
            return WindowCounts.of(parseCount(values.get(0)), parseCount(values.get(1)), parseCount(values.get(2)));
        } catch (DataAccessException ex) {
            log.warn("Redis error while reading counters for {} on {}", identifier, category, ex);
            return failure();
        } catch (RuntimeException ex) {
            log.error("Unexpected error while reading counters for {} on {}", identifier, category, ex);
            return failure();
        }
    }

    @Override
    public boolean reset(String identifier, String category, Instant now) {
        List<String> liveKeys = keys.liveKeys(identifier, category, now.getEpochSecond());
        try {
            Long deleted = redisTemplate.delete(liveKeys);
            boolean anyDeleted = deleted != null && deleted > 0;
            if (anyDeleted) {
                log.info("Reset {} rate limit counters for {} on {}", deleted, identifier, category);
            }
            return anyDeleted;
        } catch (DataAccessException ex) {
            log.error("Redis error while resetting counters for {} on {}", identifier, category, ex);
            failure();
            return false;
        } catch (RuntimeException ex) {
            log.error("Unexpected error while resetting counters for {} on {}", identifier, category, ex);
            failure();
            return false;
        }
    }

    @Override
    public boolean isReachable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException ex) {
            log.warn("Redis ping failed: {}", ex.getMessage());
            failure();
            return false;
        }
    }

    @Override
    public Instant lastFailure() {
        return lastFailure;
    }

    @Override
    public String type() {
        return "redis";
    }

    private WindowCounts failure() {
        lastFailure = clock.instant();
        return WindowCounts.unavailable();
    }

    private long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }

    private long parseCount(String value) {
        if (value == null) {
            return 0L;
        }
        return Long.parseLong(value);
    }
}
