package com.example.admission.service;

import com.example.admission.model.Tier;

/**
 * Assigns every caller the same tier until a real tier lookup is wired in.
 */
public class DefaultTierResolver implements TierResolver {

    private final Tier defaultTier;

    public DefaultTierResolver(Tier defaultTier) {
        this.defaultTier = defaultTier;
    }

    @Override
    public Tier resolveTier(String userId) {
        return defaultTier;
    }
}
