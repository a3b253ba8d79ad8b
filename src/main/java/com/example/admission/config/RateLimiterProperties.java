package com.example.admission.config;

import com.example.admission.model.Tier;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "rate-limiter")
@Validated
public class RateLimiterProperties {

    /**
     * If true, requests are allowed when Redis is unavailable.
     * If false, requests are rejected when we cannot reliably enforce limits.
     */
    private boolean failOpenOnRedisError = true;

    /**
     * Where counters live. MEMORY is a single-instance mode and is not safe behind a load balancer.
     */
    @NotNull
    private StoreType store = StoreType.REDIS;

    @NotBlank
    private String keyPrefix = "rate_limit";

    /**
     * Counter TTL as a multiple of the window size.
     */
    @Min(1)
    private int expiryMultiplier = 2;

    @NotBlank
    private String defaultCategory = "inference";

    @NotNull
    private Tier defaultTier = Tier.FREE;

    /**
     * category -> tier -> limits.
     */
    private Map<String, Map<Tier, Limit>> limits = new LinkedHashMap<>();

    /**
     * Request path -> category. Declaration order decides prefix matches.
     */
    private Map<String, String> endpoints = new LinkedHashMap<>();

    private List<String> bypassPaths = new ArrayList<>();

    private List<String> bypassPrefixes = new ArrayList<>();

    /**
     * How often expired counters are swept when {@code store} is MEMORY.
     */
    @NotNull
    private Duration memoryEvictionInterval = Duration.ofMinutes(1);

    /**
     * Shared secret expected in the {@code X-Admin-Token} header by the status and reset endpoints.
     * Administration is disabled while unset.
     */
    private String adminToken;

    public enum StoreType {
        REDIS,
        MEMORY
    }

    public boolean isFailOpenOnRedisError() {
        return failOpenOnRedisError;
    }

    public void setFailOpenOnRedisError(boolean failOpenOnRedisError) {
        this.failOpenOnRedisError = failOpenOnRedisError;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getExpiryMultiplier() {
        return expiryMultiplier;
    }

    public void setExpiryMultiplier(int expiryMultiplier) {
        this.expiryMultiplier = expiryMultiplier;
    }

    public String getDefaultCategory() {
        return defaultCategory;
    }

    public void setDefaultCategory(String defaultCategory) {
        this.defaultCategory = defaultCategory;
    }

    public Tier getDefaultTier() {
        return defaultTier;
    }

    public void setDefaultTier(Tier defaultTier) {
        this.defaultTier = defaultTier;
    }

    public Map<String, Map<Tier, Limit>> getLimits() {
        return limits;
    }

    public void setLimits(Map<String, Map<Tier, Limit>> limits) {
        this.limits = limits;
    }

    public Map<String, String> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(Map<String, String> endpoints) {
        this.endpoints = endpoints;
    }

    public List<String> getBypassPaths() {
        return bypassPaths;
    }

    public void setBypassPaths(List<String> bypassPaths) {
        this.bypassPaths = bypassPaths;
    }

    public List<String> getBypassPrefixes() {
        return bypassPrefixes;
    }

    public void setBypassPrefixes(List<String> bypassPrefixes) {
        this.bypassPrefixes = bypassPrefixes;
    }

    public Duration getMemoryEvictionInterval() {
        return memoryEvictionInterval;
    }

    public void setMemoryEvictionInterval(Duration memoryEvictionInterval) {
        this.memoryEvictionInterval = memoryEvictionInterval;
    }

    public String getAdminToken() {
        return adminToken;
    }

    public void setAdminToken(String adminToken) {
        this.adminToken = adminToken;
    }

    /**
     * Limits for one (category, tier) cell of the table.
     */
    public static class Limit {

        private long requestsPerMinute;
        private long requestsPerHour;
        private long requestsPerDay;

        // Informational only
        private long burstLimit;

        public long getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(long requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public long getRequestsPerHour() {
            return requestsPerHour;
        }

        public void setRequestsPerHour(long requestsPerHour) {
            this.requestsPerHour = requestsPerHour;
        }

        public long getRequestsPerDay() {
            return requestsPerDay;
        }

        public void setRequestsPerDay(long requestsPerDay) {
            this.requestsPerDay = requestsPerDay;
        }

        public long getBurstLimit() {
            return burstLimit;
        }

        public void setBurstLimit(long burstLimit) {
            this.burstLimit = burstLimit;
        }
    }
}
