package com.example.admission.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a caller's quota for one category.
 */
public class QuotaStatus {

    private final String identifier;
    private final String category;
    private final Tier tier;
    private final WindowCounts counts;
    private final LimitConfig limits;
    private final boolean storeAvailable;

    public QuotaStatus(String identifier, String category, Tier tier, WindowCounts counts, LimitConfig limits,
                       boolean storeAvailable) {
        this.identifier = identifier;
        this.category = category;
        this.tier = tier;
        this.counts = counts;
        this.limits = limits;
        this.storeAvailable = storeAvailable;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getCategory() {
        return category;
    }

    public Tier getTier() {
        return tier;
    }

    public WindowCounts getCounts() {
        return counts;
    }

    public LimitConfig getLimits() {
        return limits;
    }

    public boolean isStoreAvailable() {
        return storeAvailable;
    }

    /**
     * Usage of each window as a percentage of its limit, keyed by window label.
     */
    public Map<String, Double> getUsagePercentages() {
        Map<String, Double> usage = new LinkedHashMap<>();
        for (WindowKind window : WindowKind.values()) {
            usage.put(window.label(), usagePercentage(window));
        }
        return usage;
    }

    public double usagePercentage(WindowKind window) {
        if (limits == null) {
            return 0.0d;
        }
        return counts.get(window) * 100.0d / limits.limitFor(window);
    }
}
