package com.gocomet.tripsafety.sos.controller;

import com.gocomet.tripsafety.admission.model.EndpointClass;
import com.gocomet.tripsafety.admission.web.RateLimited;
import com.gocomet.tripsafety.sos.dto.AcknowledgeRequest;
import com.gocomet.tripsafety.sos.dto.ResolveRequest;
import com.gocomet.tripsafety.sos.dto.SosAlertResponse;
import com.gocomet.tripsafety.sos.dto.SosTriggerRequest;
import com.gocomet.tripsafety.sos.dto.SosTriggerResponse;
import com.gocomet.tripsafety.sos.model.SosState;
import com.gocomet.tripsafety.sos.service.SosAlertService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/sos")
@RequiredArgsConstructor
public class SosController {

    private final SosAlertService sosAlertService;

    /**
     * POST /v1/sos — Raise an SOS for a trip.
     * 201 for a new alert, 200 when an open alert for the trip already existed.
     */
    @PostMapping
    @RateLimited(EndpointClass.CRITICAL)
    public ResponseEntity<SosTriggerResponse> trigger(@Valid @RequestBody SosTriggerRequest request) {
        SosTriggerResponse response = sosAlertService.triggerSos(request);
        return ResponseEntity.status(response.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(response);
    }

    /**
     * POST /v1/sos/{alertId}/acknowledge — Operator picks the alert up
     */
    @PostMapping("/{alertId}/acknowledge")
    @RateLimited
    public ResponseEntity<SosAlertResponse> acknowledge(
            @PathVariable UUID alertId,
            @Valid @RequestBody AcknowledgeRequest request) {

        return ResponseEntity.ok(sosAlertService.acknowledgeAlert(alertId, request.getOperatorId()));
    }

    /**
     * POST /v1/sos/{alertId}/resolve — Close the alert with a resolution
     */
    @PostMapping("/{alertId}/resolve")
    @RateLimited
    public ResponseEntity<SosAlertResponse> resolve(
            @PathVariable UUID alertId,
            @Valid @RequestBody ResolveRequest request) {

        return ResponseEntity.ok(sosAlertService.resolveAlert(alertId, request.getResolvedBy(),
                request.getResolution(), request.getActionsTaken()));
    }

    /**
     * GET /v1/sos/{alertId} — Alert details, channel results and timeline
     */
    @GetMapping("/{alertId}")
    @RateLimited
    public ResponseEntity<SosAlertResponse> getAlert(@PathVariable UUID alertId) {
        return ResponseEntity.ok(sosAlertService.getAlert(alertId));
    }

    /**
     * GET /v1/sos?state=NOTIFYING — Most recent alerts, optionally by state
     */
    @GetMapping
    @RateLimited
    public ResponseEntity<List<SosAlertResponse>> listAlerts(
            @RequestParam(required = false) SosState state,
            @RequestParam(defaultValue = "20") int limit) {

        return ResponseEntity.ok(sosAlertService.listAlerts(state, limit));
    }

    /**
     * GET /v1/sos/active-count — Alerts per non-terminal state
     */
    @GetMapping("/active-count")
    @RateLimited
    public ResponseEntity<Map<SosState, Long>> activeCounts() {
        return ResponseEntity.ok(sosAlertService.activeCounts());
    }
}
