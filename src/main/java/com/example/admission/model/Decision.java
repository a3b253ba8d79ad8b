package com.example.admission.model;

import java.time.Instant;

/**
 * Result of a single admission check.
 */
public class Decision {

    public static final String NO_LIMIT = "none";

    private final boolean allowed;
    private final long retryAfterSeconds;
    private final WindowKind limitType;
    private final Tier tier;
    private final String category;
    private final WindowCounts counts;
    private final LimitConfig limits;
    private final boolean degraded;
    private final Instant evaluatedAt;

    public Decision(boolean allowed,
                    long retryAfterSeconds,
                    WindowKind limitType,
                    Tier tier,
                    String category,
                    WindowCounts counts,
                    LimitConfig limits,
                    boolean degraded,
                    Instant evaluatedAt) {
        this.allowed = allowed;
        this.retryAfterSeconds = retryAfterSeconds;
        this.limitType = limitType;
        this.tier = tier;
        this.category = category;
        this.counts = counts;
        this.limits = limits;
        this.degraded = degraded;
        this.evaluatedAt = evaluatedAt;
    }

    public static Decision allow(Tier tier, String category, WindowCounts counts, LimitConfig limits, Instant now) {
        return new Decision(true, 0L, null, tier, category, counts, limits, false, now);
    }

    public static Decision reject(WindowKind violated, long retryAfterSeconds, Tier tier, String category,
                                  WindowCounts counts, LimitConfig limits, Instant now) {
        return new Decision(false, Math.max(0L, retryAfterSeconds), violated, tier, category, counts, limits, false, now);
    }

    /**
     * Allowed decision produced without knowing the real counts (store outage or internal failure).
     */
    public static Decision failOpen(Tier tier, String category, LimitConfig limits, Instant now) {
        return new Decision(true, 0L, null, tier, category, WindowCounts.zero(), limits, true, now);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    /**
     * @return the violated window, or {@code null} when nothing was violated
     */
    public WindowKind getLimitType() {
        return limitType;
    }

    public String getLimitTypeLabel() {
        return limitType != null ? limitType.label() : NO_LIMIT;
    }

    public Tier getTier() {
        return tier;
    }

    public String getCategory() {
        return category;
    }

    public WindowCounts getCounts() {
        return counts;
    }

    public LimitConfig getLimits() {
        return limits;
    }

    /**
     * @return true if the decision was produced while enforcement was not possible and the
     * request was let through anyway
     */
    public boolean isDegraded() {
        return degraded;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public long remaining(WindowKind window) {
        if (limits == null) {
            return 0L;
        }
        return Math.max(0L, limits.limitFor(window) - counts.get(window));
    }

    /**
     * Epoch second at which {@code window} next rolls over.
     */
    public long resetAt(WindowKind window) {
        return window.nextBoundary(evaluatedAt.getEpochSecond());
    }

    @Override
    public String toString() {
        return "Decision{allowed=" + allowed
                + ", limitType=" + getLimitTypeLabel()
                + ", retryAfter=" + retryAfterSeconds
                + ", tier=" + tier
                + ", category=" + category
                + ", counts=" + counts
                + ", degraded=" + degraded + '}';
    }
}
