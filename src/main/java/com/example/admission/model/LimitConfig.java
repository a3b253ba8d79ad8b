package com.example.admission.model;

import java.util.Objects;

/**
 * Request ceilings for one (endpoint category, tier) pair.
 * <p>
 * {@code burstLimit} is informational: the counting algorithm does not enforce it.
 */
public final class LimitConfig {

    private final long requestsPerMinute;
    private final long requestsPerHour;
    private final long requestsPerDay;
    private final long burstLimit;

    public LimitConfig(long requestsPerMinute, long requestsPerHour, long requestsPerDay, long burstLimit) {
        if (requestsPerMinute <= 0 || requestsPerHour <= 0 || requestsPerDay <= 0) {
            throw new IllegalArgumentException("limits must be > 0, got minute=" + requestsPerMinute
                    + " hour=" + requestsPerHour + " day=" + requestsPerDay);
        }
        if (burstLimit < 0) {
            throw new IllegalArgumentException("burstLimit must be >= 0");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.requestsPerHour = requestsPerHour;
        this.requestsPerDay = requestsPerDay;
        this.burstLimit = burstLimit;
    }

    public static LimitConfig of(long perMinute, long perHour, long perDay) {
        return new LimitConfig(perMinute, perHour, perDay, 0L);
    }

    public long getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public long getRequestsPerHour() {
        return requestsPerHour;
    }

    public long getRequestsPerDay() {
        return requestsPerDay;
    }

    public long getBurstLimit() {
        return burstLimit;
    }

    public long limitFor(WindowKind window) {
        switch (window) {
            case MINUTE:
                return requestsPerMinute;
            case HOUR:
                return requestsPerHour;
            default:
                return requestsPerDay;
        }
    }

    /**
     * @return true if every window of this config is at least as generous as {@code other}
     */
    public boolean isAtLeast(LimitConfig other) {
        return requestsPerMinute >= other.requestsPerMinute
                && requestsPerHour >= other.requestsPerHour
                && requestsPerDay >= other.requestsPerDay;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LimitConfig)) {
            return false;
        }
        LimitConfig that = (LimitConfig) o;
        return requestsPerMinute == that.requestsPerMinute
                && requestsPerHour == that.requestsPerHour
                && requestsPerDay == that.requestsPerDay
                && burstLimit == that.burstLimit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestsPerMinute, requestsPerHour, requestsPerDay, burstLimit);
    }

    @Override
    public String toString() {
        return "LimitConfig{minute=" + requestsPerMinute + ", hour=" + requestsPerHour
                + ", day=" + requestsPerDay + ", burst=" + burstLimit + '}';
    }
}
