package com.example.admission.filter;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * Derives the quota identifier of a request: {@code user:<id>} for authenticated callers,
 * {@code ip:<address>} otherwise.
 */
@Component
public class CallerIdentifierResolver {

    /**
     * Request attribute an upstream authentication filter sets to the authenticated user id.
     */
    public static final String USER_ID_ATTRIBUTE = "admission.userId";

    static final String FORWARDED_FOR = "X-Forwarded-For";

    public String resolve(HttpServletRequest request) {
        String userId = userId(request);
        if (userId != null) {
            return "user:" + userId;
        }
        return "ip:" + clientAddress(request);
    }

    /**
     * @return the authenticated user id, or {@code null} for anonymous requests
     */
    public String userId(HttpServletRequest request) {
        Object attribute = request.getAttribute(USER_ID_ATTRIBUTE);
        if (attribute != null && !attribute.toString().isBlank()) {
            return attribute.toString();
        }
        Principal principal = request.getUserPrincipal();
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return principal.getName();
        }
        return null;
    }

    /**
     * First hop of {@code X-Forwarded-For} when present, else the connection peer.
     */
    String clientAddress(HttpServletRequest request) {
        String forwardedFor = request.getHeader(FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String firstHop = forwardedFor.split(",")[0].trim();
            if (!firstHop.isEmpty()) {
                return firstHop;
            }
        }
        String remote = request.getRemoteAddr();
        return remote != null && !remote.isBlank() ? remote : "unknown";
    }
}
