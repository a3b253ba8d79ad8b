package com.example.admission.filter;

import com.example.admission.exception.RateLimitExceededException;
import com.example.admission.model.Decision;
import com.example.admission.model.WindowKind;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quota disclosure headers and the rejection body shared by the filter and the exception handler.
 */
public final class RateLimitHeaders {

    public static final String LIMIT_PREFIX = "X-RateLimit-Limit-";
    public static final String REMAINING_PREFIX = "X-RateLimit-Remaining-";
    public static final String RESET_PREFIX = "X-RateLimit-Reset-";
    public static final String TIER = "X-RateLimit-Tier";
    public static final String DEGRADED = "X-RateLimit-Degraded";

    private RateLimitHeaders() {
    }

    public static HttpHeaders of(Decision decision) {
        HttpHeaders headers = new HttpHeaders();
        if (decision == null) {
            return headers;
        }
        if (decision.getLimits() != null) {
            for (WindowKind window : WindowKind.values()) {
                String suffix = suffix(window);
                headers.set(LIMIT_PREFIX + suffix, Long.toString(decision.getLimits().limitFor(window)));
                headers.set(REMAINING_PREFIX + suffix, Long.toString(decision.remaining(window)));
                headers.set(RESET_PREFIX + suffix, Long.toString(decision.resetAt(window)));
            }
        }
        if (decision.getTier() != null) {
            headers.set(TIER, decision.getTier().label());
        }
        if (decision.isDegraded()) {
            headers.set(DEGRADED, "true");
        }
        return headers;
    }

    public static void apply(HttpServletResponse response, Decision decision) {
        of(decision).forEach((name, values) -> values.forEach(value -> response.setHeader(name, value)));
    }

    public static Map<String, Object> rejectionBody(RateLimitExceededException ex, String identifier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "rate_limit_exceeded");
        body.put("message", ex.getMessage());
        body.put("retry_after", ex.getRetryAfterSeconds());
        body.put("limit_type", ex.getLimitTypeLabel());
        if (ex.getDecision() != null) {
            body.put("endpoint", ex.getDecision().getCategory());
        }
        if (identifier != null) {
            body.put("identifier", identifier);
        }
        return body;
    }

    private static String suffix(WindowKind window) {
        String label = window.label();
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
