package com.example.admission.model;

import java.util.Locale;

/**
 * Service level assigned to a caller. Higher ordinals always receive equal-or-looser limits.
 */
public enum Tier {
    FREE,
    BASIC,
    PREMIUM,
    ENTERPRISE;

    /**
     * Lenient lookup by name.
     *
     * @return the matching tier, or {@code null} if the value is blank or names no tier
     */
    public static Tier fromName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Tier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
