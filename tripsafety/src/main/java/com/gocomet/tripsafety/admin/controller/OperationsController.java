package com.gocomet.tripsafety.admin.controller;

import com.gocomet.tripsafety.admission.model.BreakerMetrics;
import com.gocomet.tripsafety.admission.model.CircuitState;
import com.gocomet.tripsafety.admission.service.CircuitBreakerService;
import com.gocomet.tripsafety.common.exception.ResourceNotFoundException;
import com.gocomet.tripsafety.notification.dto.NotificationJobResponse;
import com.gocomet.tripsafety.notification.service.NotificationQueueService;
import com.gocomet.tripsafety.sos.service.SosAlertPersister;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator view of the delivery pipeline.
 */
@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class OperationsController {

    static final List<String> DEPENDENCIES = List.of("push", "sms", "email", "dashboard", "voice",
            SosAlertPersister.DEPENDENCY);

    private final CircuitBreakerService circuitBreakerService;
    private final NotificationQueueService queueService;

    /**
     * GET /v1/admin/health — Breaker states and queue depth
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, CircuitState> breakers = circuitBreakerService.snapshot(DEPENDENCIES);
        boolean degraded = breakers.values().stream().anyMatch(s -> s != CircuitState.CLOSED);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", degraded ? "DEGRADED" : "UP");
        body.put("circuitBreakers", breakers);
        body.put("queueDepth", queueService.depth());
        body.put("failedByChannel", queueService.failedByChannel());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /v1/admin/circuit-breakers — State and call counters per dependency
     */
    @GetMapping("/circuit-breakers")
    public ResponseEntity<List<BreakerMetrics>> circuitBreakers() {
        return ResponseEntity.ok(circuitBreakerService.metrics(DEPENDENCIES));
    }

    /**
     * POST /v1/admin/circuit-breakers/{dependency}/reset — Force a circuit closed
     */
    @PostMapping("/circuit-breakers/{dependency}/reset")
    public ResponseEntity<BreakerMetrics> resetCircuitBreaker(@PathVariable String dependency,
                                                              @RequestHeader(value = "X-Actor-Id", required = false) String operatorId) {
        if (!DEPENDENCIES.contains(dependency)) {
            throw new ResourceNotFoundException("CircuitBreaker", "dependency", dependency);
        }
        log.info("Operator {} resetting circuit '{}'", operatorId, dependency);
        return ResponseEntity.ok(circuitBreakerService.reset(dependency));
    }

    /**
     * GET /v1/admin/notifications/failed — Jobs that exhausted their attempts
     */
    @GetMapping("/notifications/failed")
    public ResponseEntity<List<NotificationJobResponse>> failedJobs(
            @RequestParam(defaultValue = "50") int limit) {

        return ResponseEntity.ok(queueService.failedJobs(Math.max(1, Math.min(limit, 500))).stream()
                .map(NotificationJobResponse::from)
                .toList());
    }

    /**
     * POST /v1/admin/notifications/{jobId}/requeue — Give a failed job a fresh set of attempts
     */
    @PostMapping("/notifications/{jobId}/requeue")
    public ResponseEntity<NotificationJobResponse> requeue(@PathVariable UUID jobId) {
        return ResponseEntity.ok(NotificationJobResponse.from(queueService.requeue(jobId)));
    }
}
