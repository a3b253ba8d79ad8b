package com.example.admission.exception;

import com.example.admission.model.Decision;
import com.example.admission.model.WindowKind;

/**
 * Thrown when a request exceeds one of its window limits.
 * Carries the rejected decision so callers can still report remaining quota.
 */
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterSeconds;
    private final WindowKind limitType;
    private final transient Decision decision;

    public RateLimitExceededException(String message, long retryAfterSeconds, WindowKind limitType, Decision decision) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
        this.limitType = limitType;
        this.decision = decision;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public WindowKind getLimitType() {
        return limitType;
    }

    public String getLimitTypeLabel() {
        return limitType.label();
    }

    public Decision getDecision() {
        return decision;
    }
}
