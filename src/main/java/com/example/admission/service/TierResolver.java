package com.example.admission.service;

import com.example.admission.model.Tier;

/**
 * Looks up the subscription tier of a caller.
 * <p>
 * Integration point for the identity or billing system. Define a bean of this type to replace
 * {@link DefaultTierResolver}.
 */
public interface TierResolver {

    /**
     * @param userId authenticated user id, or {@code null} for anonymous callers
     * @return the caller's tier, or {@code null} to use the default tier
     */
    Tier resolveTier(String userId);
}
