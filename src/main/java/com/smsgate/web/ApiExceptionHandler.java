package com.smsgate.web;

import com.smsgate.consent.InvalidConsentTransitionException;
import com.smsgate.dispatch.ConsentDeniedException;
import com.smsgate.dispatch.RateLimitExceededException;
import com.smsgate.dispatch.ValidationException;
import com.smsgate.gateway.GatewayException;
import com.smsgate.message.InvalidTransitionException;
import com.smsgate.message.MessageNotFoundException;
import com.smsgate.ratelimit.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to JSON error bodies. Stack traces never reach the client.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> body = error("validation_failed", ex.getMessage());
        body.put("field", ex.getField());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(error("validation_failed", ex.getMessage()));
    }

    @ExceptionHandler(ConsentDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleConsentDenied(ConsentDeniedException ex) {
        Map<String, Object> body = error("consent_denied", ex.getMessage());
        body.put("category", ex.getCategory());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(RateLimitExceededException ex) {
        long retryAfter = Math.max(1, ex.getResetTime().getEpochSecond() - clock.instant().getEpochSecond());
        Map<String, Object> body = error("rate_limit_exceeded", ex.getMessage());
        body.put("window", ex.getLimitType().lowerName());
        body.put("limit", ex.getLimit());
        body.put("resetTime", ex.getResetTime().toString());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                .body(body);
    }

    @ExceptionHandler({InvalidTransitionException.class, InvalidConsentTransitionException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error("invalid_transition", ex.getMessage()));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrentUpdate(ObjectOptimisticLockingFailureException ex) {
        log.info("Concurrent update rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(error("concurrent_update", "Record was modified concurrently, retry the request"));
    }

    @ExceptionHandler(MessageNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(MessageNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGateway(GatewayException ex) {
        log.warn("Gateway failure surfaced to caller: code={} {}", ex.getErrorCode(), ex.getMessage());
        Map<String, Object> body = error("gateway_error", ex.getMessage());
        body.put("code", ex.getErrorCode());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.warn("Counter store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(error("store_unavailable", "Rate limit store is unavailable"));
    }

    private Map<String, Object> error(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        body.put("timestamp", clock.instant().toString());
        return body;
    }
}
