package com.example.admission.config;

import com.example.admission.model.LimitConfig;
import com.example.admission.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup table for limits, endpoint classification and bypass rules.
 * <p>
 * Lookups never fail: unknown categories resolve to the default category and tiers that a
 * category does not configure resolve to the default tier.
 */
public final class LimitRegistry {

    private static final Logger log = LoggerFactory.getLogger(LimitRegistry.class);

    private final Map<String, Map<Tier, LimitConfig>> limits;
    private final Map<String, String> endpoints;
    private final Set<String> bypassPaths;
    private final List<String> bypassPrefixes;
    private final String defaultCategory;
    private final Tier defaultTier;

    private LimitRegistry(Builder builder) {
        Map<String, Map<Tier, LimitConfig>> copy = new LinkedHashMap<>();
        builder.limits.forEach((category, byTier) ->
                copy.put(category, Collections.unmodifiableMap(new EnumMap<>(byTier))));
        this.limits = Collections.unmodifiableMap(copy);
        this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.endpoints));
        this.bypassPaths = Collections.unmodifiableSet(new LinkedHashSet<>(builder.bypassPaths));
        this.bypassPrefixes = Collections.unmodifiableList(new ArrayList<>(builder.bypassPrefixes));
        this.defaultCategory = builder.defaultCategory;
        this.defaultTier = builder.defaultTier;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the registry from the bound {@code rate-limiter.*} properties.
     */
    public static LimitRegistry from(RateLimiterProperties properties) {
        Builder builder = builder()
                .defaultCategory(properties.getDefaultCategory())
                .defaultTier(properties.getDefaultTier());
        properties.getLimits().forEach((category, byTier) ->
                byTier.forEach((tier, limit) -> builder.limit(category, tier, new LimitConfig(
                        limit.getRequestsPerMinute(),
                        limit.getRequestsPerHour(),
                        limit.getRequestsPerDay(),
                        limit.getBurstLimit()))));
        properties.getEndpoints().forEach(builder::endpoint);
        properties.getBypassPaths().forEach(builder::bypassPath);
        properties.getBypassPrefixes().forEach(builder::bypassPrefix);
        return builder.build();
    }

    public LimitConfig limitsFor(String category, Tier tier) {
        String effectiveCategory = resolveCategory(category);
        return limits.get(effectiveCategory).get(resolveTier(effectiveCategory, tier));
    }

    /**
     * @return {@code category} if it is configured, otherwise the default category
     */
    public String resolveCategory(String category) {
        if (category != null && limits.containsKey(category)) {
            return category;
        }
        log.warn("Unknown endpoint category {}, using {} limits", category, defaultCategory);
        return defaultCategory;
    }

    /**
     * @return {@code tier} if {@code category} configures it, otherwise the default tier
     */
    public Tier resolveTier(String category, Tier tier) {
        Map<Tier, LimitConfig> byTier = limits.get(resolveCategory(category));
        if (tier != null && byTier.containsKey(tier)) {
            return tier;
        }
        if (tier != null) {
            log.warn("Tier {} not configured for category {}, using {}", tier, category, defaultTier);
        }
        return defaultTier;
    }

    public String classify(String path) {
        if (path == null) {
            return defaultCategory;
        }
        String exact = endpoints.get(path);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : endpoints.entrySet()) {
            if (path.startsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return defaultCategory;
    }

    public boolean isBypassed(String path) {
        if (path == null) {
            return false;
        }
        if (bypassPaths.contains(path)) {
            return true;
        }
        for (String prefix : bypassPrefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public List<String> categories() {
        return new ArrayList<>(limits.keySet());
    }

    public List<Tier> tiers() {
        return Arrays.asList(Tier.values());
    }

    public String defaultCategory() {
        return defaultCategory;
    }

    public Tier defaultTier() {
        return defaultTier;
    }

    public static final class Builder {

        private final Map<String, Map<Tier, LimitConfig>> limits = new LinkedHashMap<>();
        private final Map<String, String> endpoints = new LinkedHashMap<>();
        private final List<String> bypassPaths = new ArrayList<>();
        private final List<String> bypassPrefixes = new ArrayList<>();
        private String defaultCategory = "inference";
        private Tier defaultTier = Tier.FREE;

        private Builder() {
        }

        public Builder limit(String category, Tier tier, LimitConfig config) {
            if (category == null || tier == null || config == null) {
                throw new IllegalArgumentException("category, tier and config are required");
            }
            limits.computeIfAbsent(category, c -> new EnumMap<>(Tier.class)).put(tier, config);
            return this;
        }

        public Builder endpoint(String path, String category) {
            endpoints.put(path, category);
            return this;
        }

        public Builder bypassPath(String path) {
            bypassPaths.add(path);
            return this;
        }

        public Builder bypassPrefix(String prefix) {
            bypassPrefixes.add(prefix);
            return this;
        }

        public Builder defaultCategory(String defaultCategory) {
            this.defaultCategory = defaultCategory;
            return this;
        }

        public Builder defaultTier(Tier defaultTier) {
            this.defaultTier = defaultTier;
            return this;
        }

        public LimitRegistry build() {
            Map<Tier, LimitConfig> defaults = limits.get(defaultCategory);
            if (defaults == null || !defaults.containsKey(defaultTier)) {
                throw new IllegalStateException("No limits configured for default category "
                        + defaultCategory + " and default tier " + defaultTier);
            }
            for (Map.Entry<String, Map<Tier, LimitConfig>> entry : limits.entrySet()) {
                if (!entry.getValue().containsKey(defaultTier)) {
                    throw new IllegalStateException("Category " + entry.getKey()
                            + " has no limits for default tier " + defaultTier);
                }
                warnOnDecreasingLimits(entry.getKey(), entry.getValue());
            }
            endpoints.forEach((path, category) -> {
                if (!limits.containsKey(category)) {
                    log.warn("Endpoint {} maps to unconfigured category {}", path, category);
                }
            });
            return new LimitRegistry(this);
        }

        private static void warnOnDecreasingLimits(String category, Map<Tier, LimitConfig> byTier) {
            LimitConfig previous = null;
            Tier previousTier = null;
            for (Map.Entry<Tier, LimitConfig> entry : byTier.entrySet()) {
                if (previous != null && !entry.getValue().isAtLeast(previous)) {
                    log.warn("Limits for category {} decrease from tier {} to tier {}: {} -> {}",
                            category, previousTier, entry.getKey(), previous, entry.getValue());
                }
                previous = entry.getValue();
                previousTier = entry.getKey();
            }
        }
    }
}
