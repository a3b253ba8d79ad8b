package com.example.admission.filter;

import com.example.admission.config.LimitRegistry;
import com.example.admission.exception.AdmissionUnavailableException;
import com.example.admission.exception.RateLimitExceededException;
import com.example.admission.model.Decision;
import com.example.admission.model.Tier;
import com.example.admission.service.RateLimiterService;
import com.example.admission.service.TierResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Servlet filter that applies admission control to every incoming HTTP request.
 *
 * The filter classifies the request, delegates the decision to
 * {@link RateLimiterService} and translates the result into HTTP semantics (quota headers,
 * 429 or 503).
 */
@Component
public class RateLimitingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitingFilter.class);

    private final RateLimiterService rateLimiterService;
    private final LimitRegistry registry;
    private final CallerIdentifierResolver identifierResolver;
    private final TierResolver tierResolver;
    private final ObjectMapper objectMapper;

    public RateLimitingFilter(
            RateLimiterService rateLimiterService,
            LimitRegistry registry,
            CallerIdentifierResolver identifierResolver,
            TierResolver tierResolver,
            ObjectMapper objectMapper
    ) {
        this.rateLimiterService = rateLimiterService;
        this.registry = registry;
        this.identifierResolver = identifierResolver;
        this.tierResolver = tierResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return registry.isBypassed(pathOf(request));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String identifier;
        Decision decision;
        try {
            identifier = identifierResolver.resolve(request);
            String category = registry.classify(pathOf(request));
            Tier tier = tierResolver.resolveTier(identifierResolver.userId(request));

            decision = rateLimiterService.check(identifier, category, tier);
        } catch (RateLimitExceededException ex) {
            writeRejection(request, response, ex);
            return;
        } catch (AdmissionUnavailableException ex) {
            // Fail-closed: reject with 503 and make the root cause explicit.
            log.error("Rejecting request {} because the rate limiter backend is unavailable", request.getRequestURI());
            writeJson(response, HttpStatus.SERVICE_UNAVAILABLE, Map.of(
                    "error", "rate_limiter_unavailable",
                    "message", ex.getMessage()));
            return;
        } catch (RuntimeException ex) {
            log.error("Rate limiting filter error for {}, letting the request through", request.getRequestURI(), ex);
            filterChain.doFilter(request, response);
            return;
        }

        // Headers go on before the chain runs; the response may be committed afterwards.
        RateLimitHeaders.apply(response, decision);
        filterChain.doFilter(request, response);
    }

    private void writeRejection(HttpServletRequest request, HttpServletResponse response,
                                RateLimitExceededException ex) throws IOException {
        String identifier = identifierResolver.resolve(request);
        RateLimitHeaders.apply(response, ex.getDecision());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(ex.getRetryAfterSeconds()));
        writeJson(response, HttpStatus.TOO_MANY_REQUESTS, RateLimitHeaders.rejectionBody(ex, identifier));
    }

    private void writeJson(HttpServletResponse response, HttpStatus status, Map<String, Object> body)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(new LinkedHashMap<>(body)));
    }

    private String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
