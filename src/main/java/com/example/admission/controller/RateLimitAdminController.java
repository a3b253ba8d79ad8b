package com.example.admission.controller;

import com.example.admission.config.RateLimiterProperties;
import com.example.admission.filter.CallerIdentifierResolver;
import com.example.admission.model.HealthReport;
import com.example.admission.model.QuotaStatus;
import com.example.admission.model.Tier;
import com.example.admission.service.RateLimitStatusService;
import com.example.admission.service.TierResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quota inspection and support overrides. None of these endpoints consume quota of the
 * identifier they inspect; the whole path is listed under {@code rate-limiter.bypass-prefixes}.
 * <p>
 * {@code /status} and {@code /reset} act on arbitrary identifiers and require the
 * {@value #ADMIN_TOKEN_HEADER} header to match {@code rate-limiter.admin-token}.
 * {@code /me} and {@code /health} are public.
 */
@RestController
@RequestMapping("/api/v1/rate-limit")
public class RateLimitAdminController {

    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private static final Logger log = LoggerFactory.getLogger(RateLimitAdminController.class);

    private final RateLimitStatusService statusService;
    private final CallerIdentifierResolver identifierResolver;
    private final TierResolver tierResolver;
    private final RateLimiterProperties properties;

    public RateLimitAdminController(
            RateLimitStatusService statusService,
            CallerIdentifierResolver identifierResolver,
            TierResolver tierResolver,
            RateLimiterProperties properties
    ) {
        this.statusService = statusService;
        this.identifierResolver = identifierResolver;
        this.tierResolver = tierResolver;
        this.properties = properties;
    }

    @GetMapping("/status")
    public QuotaStatus status(
            @RequestHeader(name = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @RequestParam String identifier,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String tier
    ) {
        requireAdmin(adminToken, "status");
        return statusService.status(identifier, category, Tier.fromName(tier));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset(
            @RequestHeader(name = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @Valid @RequestBody ResetRequest request
    ) {
        requireAdmin(adminToken, "reset");
        boolean reset = statusService.reset(request.identifier(), request.category());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reset", reset);
        body.put("identifier", request.identifier());
        body.put("category", request.category());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = statusService.health();
        HttpStatus status = report.storeReachable() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(report);
    }

    /**
     * Quota of the calling identifier, plus a human-readable summary.
     */
    @GetMapping("/me")
    public Map<String, Object> me(HttpServletRequest request, @RequestParam(required = false) String category) {
        String identifier = identifierResolver.resolve(request);
        Tier tier = tierResolver.resolveTier(identifierResolver.userId(request));
        QuotaStatus status = statusService.status(identifier, category, tier);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("summary", statusService.describe(status));
        return body;
    }

    private void requireAdmin(String presented, String operation) {
        String expected = properties.getAdminToken();
        if (expected == null || expected.isBlank()) {
            log.warn("Rejected rate limit {} request: rate-limiter.admin-token is not configured", operation);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Rate limit administration is disabled");
        }
        if (presented == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected rate limit {} request with a missing or invalid admin token", operation);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Invalid admin token");
        }
    }

    public record ResetRequest(@NotBlank String identifier, String category) {
    }
}
