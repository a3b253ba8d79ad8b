package com.example.admission.exception;

import com.example.admission.filter.RateLimitHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Translates admission exceptions thrown from controllers, for handlers that call
 * {@code RateLimiterService} directly instead of relying on the filter.
 */
@RestControllerAdvice
public class RateLimitExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitExceptionHandler.class);

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(RateLimitExceededException ex) {
        log.warn("Rate limit exceeded: {}", ex.getMessage());

        HttpHeaders headers = RateLimitHeaders.of(ex.getDecision());
        headers.set(HttpHeaders.RETRY_AFTER, Long.toString(ex.getRetryAfterSeconds()));
        return new ResponseEntity<>(RateLimitHeaders.rejectionBody(ex, null), headers, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(AdmissionUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(AdmissionUnavailableException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "error", "rate_limiter_unavailable",
                "message", ex.getMessage()));
    }
}
