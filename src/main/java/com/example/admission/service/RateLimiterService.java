package com.example.admission.service;

import com.example.admission.config.LimitRegistry;
import com.example.admission.config.RateLimiterProperties;
import com.example.admission.exception.AdmissionUnavailableException;
import com.example.admission.exception.RateLimitExceededException;
import com.example.admission.model.Decision;
import com.example.admission.model.LimitConfig;
import com.example.admission.model.Tier;
import com.example.admission.model.WindowCounts;
import com.example.admission.model.WindowKind;
import com.example.admission.store.CounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Stateless admission engine that evaluates the minute, hour and day limits of a caller for one
 * endpoint category.
 *
 * All counting happens in the {@link CounterStore}. This service is mostly responsible for:
 *  - resolving the effective category, tier and limits
 *  - comparing the post-increment counts against the limits
 *  - picking the violated window and its retry-after
 *  - defining the behavior when the store is unavailable (fail-open vs fail-closed)
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final CounterStore counterStore;
    private final LimitRegistry registry;
    private final RateLimiterProperties properties;
    private final Clock clock;

    @Autowired
    public RateLimiterService(
            CounterStore counterStore,
            LimitRegistry registry,
            RateLimiterProperties properties,
            Clock clock
    ) {
        this.counterStore = counterStore;
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Evaluate whether the caller may perform one request in {@code category} now.
     * <p>
     * Every call consumes one unit in all three windows, including calls that end up rejected.
     *
     * @param identifier quota key of the caller, e.g. {@code user:42} or {@code ip:10.0.0.1}
     * @param category   endpoint category; unknown categories use the default category limits
     * @param tier       caller tier, or {@code null} for the default tier
     * @return an allowed decision
     * @throws RateLimitExceededException    if any window limit is exceeded
     * @throws AdmissionUnavailableException if the store is down and fail-open is disabled
     */
    public Decision check(String identifier, String category, Tier tier) {
        Instant now = clock.instant();
        String effectiveCategory = category;
        Tier effectiveTier = tier;
        LimitConfig limits = null;

        try {
            effectiveCategory = registry.resolveCategory(category);
            effectiveTier = registry.resolveTier(effectiveCategory, tier);
            limits = registry.limitsFor(effectiveCategory, effectiveTier);

            WindowCounts counts = counterStore.incrementAll(identifier, effectiveCategory, now);
            if (!counts.isAvailable()) {
                return handleStoreFailure(identifier, effectiveCategory, effectiveTier, limits, now);
            }

            WindowKind violated = firstViolated(counts, limits);
            if (violated != null) {
                long retryAfter = violated.secondsUntilRollover(now.getEpochSecond());
                Decision rejected = Decision.reject(violated, retryAfter, effectiveTier, effectiveCategory,
                        counts, limits, now);
                log.warn("Rate limit exceeded for {} on {} ({} window, count={}, limit={}, retryAfter={}s)",
                        identifier, effectiveCategory, violated.label(), counts.get(violated),
                        limits.limitFor(violated), retryAfter);
                throw new RateLimitExceededException(
                        "Rate limit exceeded for " + effectiveCategory + " endpoint",
                        retryAfter,
                        violated,
                        rejected);
            }

            log.debug("Rate limit check passed for {} on {}: {}", identifier, effectiveCategory, counts);
            return Decision.allow(effectiveTier, effectiveCategory, counts, limits, now);
        } catch (RateLimitExceededException | AdmissionUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // Last resort; a broken limiter must not take the protected API down with it.
            log.error("Unexpected error while evaluating rate limit for {} on {}, allowing request",
                    identifier, category, ex);
            return Decision.failOpen(effectiveTier, effectiveCategory, limits, now);
        }
    }

    /**
     * The smallest violated window: minute, then hour, then day.
     */
    static WindowKind firstViolated(WindowCounts counts, LimitConfig limits) {
        for (WindowKind window : WindowKind.values()) {
            if (counts.get(window) > limits.limitFor(window)) {
                return window;
            }
        }
        return null;
    }

    private Decision handleStoreFailure(String identifier, String category, Tier tier, LimitConfig limits,
                                        Instant now) {
        if (properties.isFailOpenOnRedisError()) {
            // Fail-open: keep the protected service available while enforcement is impossible.
            log.warn("Counter store unavailable, allowing request for {} on {} without enforcement",
                    identifier, category);
            return Decision.failOpen(tier, category, limits, now);
        }
        log.error("Counter store unavailable, rejecting request for {} on {} (fail-closed)", identifier, category);
        throw new AdmissionUnavailableException("Rate limiter backend unavailable");
    }
}
