package com.gocomet.tripsafety.common.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String FALLBACK_ACTION = "CALL_EMERGENCY_SERVICES";
    private static final String SOS_TRIGGER_PATH = "/v1/sos";

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler({InvalidStateTransitionException.class, TripNotActiveException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
        return error(HttpStatus.CONFLICT, "CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimit(RateLimitExceededException ex) {
        Map<String, Object> body = body("RATE_LIMITED", ex.getMessage());
        body.put("endpointClass", ex.getEndpointClass().name());
        body.put("retryAfter", ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body);
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<Map<String, Object>> handleCircuitOpen(CircuitOpenException ex) {
        Map<String, Object> body = body("DEPENDENCY_UNAVAILABLE", ex.getMessage());
        body.put("dependency", ex.getDependency());
        body.put("retryAfter", ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body);
    }

    @ExceptionHandler(SosPersistenceException.class)
    public ResponseEntity<Map<String, Object>> handleSosPersistence(SosPersistenceException ex) {
        log.error("SOS trigger failed: {}", ex.getMessage(), ex);
        Map<String, Object> body = body("SOS_NOT_RECORDED", ex.getMessage());
        body.put("fallback", FALLBACK_ACTION);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    /**
     * A backing store (Redis, Postgres) is unreachable. An SOS trigger that ends
     * here was not recorded, so the caller gets the same fallback as a failed persist.
     */
    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(DataAccessResourceFailureException ex,
                                                                      HttpServletRequest request) {
        log.error("Store unavailable on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        Map<String, Object> body = body("DEPENDENCY_UNAVAILABLE", "A backing store is unavailable");
        if ("POST".equals(request.getMethod()) && SOS_TRIGGER_PATH.equals(request.getRequestURI())) {
            body.put("fallback", FALLBACK_ACTION);
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<Map<String, Object>> handleInvariant(InvariantViolationException ex) {
        log.error("Invariant violation: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INVARIANT_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(body(code, message));
    }

    private Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
