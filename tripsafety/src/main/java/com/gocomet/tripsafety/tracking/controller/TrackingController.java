package com.gocomet.tripsafety.tracking.controller;

import com.gocomet.tripsafety.admission.model.EndpointClass;
import com.gocomet.tripsafety.admission.web.RateLimited;
import com.gocomet.tripsafety.common.exception.ResourceNotFoundException;
import com.gocomet.tripsafety.tracking.dto.IngestResponse;
import com.gocomet.tripsafety.tracking.dto.LocationSampleRequest;
import com.gocomet.tripsafety.tracking.dto.SubscriptionResponse;
import com.gocomet.tripsafety.tracking.event.LocalFanoutDispatcher;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import com.gocomet.tripsafety.tracking.service.TrackingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/trips")
@RequiredArgsConstructor
public class TrackingController {

    private final TrackingService trackingService;

    /**
     * POST /v1/trips/{tripId}/locations — Ingest a location sample from a device
     */
    @PostMapping("/{tripId}/locations")
    @RateLimited(EndpointClass.CRITICAL)
    public ResponseEntity<IngestResponse> ingestLocation(
            @PathVariable UUID tripId,
            @Valid @RequestBody LocationSampleRequest request) {

        boolean accepted = trackingService.ingestLocation(tripId, request.toSample(tripId));
        return ResponseEntity.accepted().body(new IngestResponse(tripId, accepted));
    }

    /**
     * GET /v1/trips/{tripId}/location — Last known position
     */
    @GetMapping("/{tripId}/location")
    @RateLimited
    public ResponseEntity<LocationSample> getLocation(@PathVariable UUID tripId) {
        LocationSample sample = trackingService.lastKnownLocation(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Location", "tripId", tripId));
        return ResponseEntity.ok(sample);
    }

    /**
     * POST /v1/trips/{tripId}/subscriptions — Register a connection for live updates
     */
    @PostMapping("/{tripId}/subscriptions")
    @RateLimited(EndpointClass.CRITICAL)
    public ResponseEntity<SubscriptionResponse> subscribe(
            @PathVariable UUID tripId,
            @RequestParam String connectionId) {

        LocationSample lastKnown = trackingService.subscribeToTrip(tripId, connectionId).orElse(null);
        return ResponseEntity.ok(SubscriptionResponse.builder()
                .tripId(tripId)
                .connectionId(connectionId)
                .destination(LocalFanoutDispatcher.TRIP_DESTINATION_PREFIX + tripId)
                .lastKnown(lastKnown)
                .build());
    }

    /**
     * DELETE /v1/trips/{tripId}/subscriptions/{connectionId} — Stop live updates
     */
    @DeleteMapping("/{tripId}/subscriptions/{connectionId}")
    @RateLimited
    public ResponseEntity<Void> unsubscribe(
            @PathVariable UUID tripId,
            @PathVariable String connectionId) {

        trackingService.unsubscribeFromTrip(tripId, connectionId);
        return ResponseEntity.noContent().build();
    }
}
