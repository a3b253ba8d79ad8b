package com.example.admission.service;

import com.example.admission.config.LimitRegistry;
import com.example.admission.config.RateLimiterProperties;
import com.example.admission.model.HealthReport;
import com.example.admission.model.LimitConfig;
import com.example.admission.model.QuotaStatus;
import com.example.admission.model.Tier;
import com.example.admission.model.WindowCounts;
import com.example.admission.model.WindowKind;
import com.example.admission.store.CounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;

/**
 * Quota inspection, manual reset and health diagnostics. Nothing here increments a counter.
 */
@Service
public class RateLimitStatusService {

    private static final Logger log = LoggerFactory.getLogger(RateLimitStatusService.class);

    private final CounterStore counterStore;
    private final LimitRegistry registry;
    private final RateLimiterProperties properties;
    private final Clock clock;

    @Autowired
    public RateLimitStatusService(
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

    public QuotaStatus status(String identifier, String category, Tier tier) {
        String effectiveCategory = registry.resolveCategory(category);
        Tier effectiveTier = registry.resolveTier(effectiveCategory, tier);
        LimitConfig limits = registry.limitsFor(effectiveCategory, effectiveTier);

        WindowCounts counts = counterStore.peekAll(identifier, effectiveCategory, clock.instant());
        if (!counts.isAvailable()) {
            return new QuotaStatus(identifier, effectiveCategory, effectiveTier, WindowCounts.zero(), limits, false);
        }
        return new QuotaStatus(identifier, effectiveCategory, effectiveTier, counts, limits, true);
    }

    /**
     * Clears the counters of a caller for one category.
     *
     * @return true if counters were deleted, false if there were none or the store failed
     */
    public boolean reset(String identifier, String category) {
        String effectiveCategory = registry.resolveCategory(category);
        boolean deleted = counterStore.reset(identifier, effectiveCategory, clock.instant());
        if (!deleted) {
            log.info("No rate limit counters reset for {} on {}", identifier, effectiveCategory);
        }
        return deleted;
    }

    public HealthReport health() {
        boolean reachable = counterStore.isReachable();
        return new HealthReport(
                reachable ? HealthReport.HEALTHY : HealthReport.DEGRADED,
                reachable,
                counterStore.type(),
                counterStore.lastFailure(),
                properties.isFailOpenOnRedisError(),
                registry.categories(),
                registry.tiers(),
                clock.instant());
    }

    /**
     * Multi-line usage summary, e.g. {@code Minute: 3/5 (60.0%)} per window.
     */
    public String describe(QuotaStatus status) {
        StringBuilder message = new StringBuilder()
                .append("Rate limit status for ")
                .append(status.getTier().label())
                .append(" tier:");
        for (WindowKind window : WindowKind.values()) {
            String label = window.label();
            message.append('\n')
                    .append("- ")
                    .append(Character.toUpperCase(label.charAt(0))).append(label.substring(1))
                    .append(": ")
                    .append(status.getCounts().get(window))
                    .append('/')
                    .append(status.getLimits().limitFor(window))
                    .append(String.format(Locale.ROOT, " (%.1f%%)", status.usagePercentage(window)));
        }
        return message.toString();
    }
}
