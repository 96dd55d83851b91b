package com.gocomet.tripsafety.sos.service;

import com.gocomet.tripsafety.common.event.SosEvent;
import com.gocomet.tripsafety.common.event.SosLocationSampledEvent;
import com.gocomet.tripsafety.common.exception.InvalidStateTransitionException;
import com.gocomet.tripsafety.common.exception.InvariantViolationException;
import com.gocomet.tripsafety.common.exception.ResourceNotFoundException;
import com.gocomet.tripsafety.common.exception.TripNotActiveException;
import com.gocomet.tripsafety.notification.dto.NotificationRequest;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.JobPriority;
import com.gocomet.tripsafety.notification.service.NotificationQueueService;
import com.gocomet.tripsafety.sos.config.SosProperties;
import com.gocomet.tripsafety.sos.contact.EmergencyContact;
import com.gocomet.tripsafety.sos.contact.EmergencyContactDirectory;
import com.gocomet.tripsafety.sos.dto.SosAlertResponse;
import com.gocomet.tripsafety.sos.dto.SosTriggerRequest;
import com.gocomet.tripsafety.sos.dto.SosTriggerResponse;
import com.gocomet.tripsafety.sos.event.SosEventPublisher;
import com.gocomet.tripsafety.sos.model.SosAlert;
import com.gocomet.tripsafety.sos.model.SosLocationPoint;
import com.gocomet.tripsafety.sos.model.SosState;
import com.gocomet.tripsafety.sos.model.TriggeredByRole;
import com.gocomet.tripsafety.sos.repository.SosAlertRepository;
import com.gocomet.tripsafety.sos.repository.SosChannelResultRepository;
import com.gocomet.tripsafety.sos.repository.SosLocationPointRepository;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import com.gocomet.tripsafety.trip.store.TripWindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * SOS alert state machine.
 *
 * Trigger:
 * 1. An open alert for the trip is returned as-is (duplicate taps, client retries).
 *    Two triggers racing past this check meet at the unique active_trip_id column.
 * 2. Completed trips are refused
 * 3. Alert written as PERSISTED and read back (SosAlertPersister)
 * 4. Only then: PERSISTED → NOTIFYING, one CRITICAL job per channel and contact,
 *    plus the delayed escalation timer job
 *
 * Every transition is a conditional update on the alert row, so concurrent
 * operators, timers and redelivered jobs cannot move an alert twice. Resolve
 * writes the operator's actions in the same transaction as its update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SosAlertService {

    private static final Set<SosState> ENQUEUEABLE = EnumSet.of(SosState.PERSISTED, SosState.NOTIFYING, SosState.ESCALATED);
    private static final Set<SosState> RESOLVABLE = EnumSet.of(SosState.ACKNOWLEDGED, SosState.ESCALATED);

    private final SosAlertRepository alertRepository;
    private final SosChannelResultRepository channelResultRepository;
    private final SosLocationPointRepository locationPointRepository;
    private final SosAlertPersister persister;
    private final NotificationQueueService queueService;
    private final EmergencyContactDirectory contactDirectory;
    private final TripWindowStore tripWindowStore;
    private final SosEventPublisher eventPublisher;
    private final SosProperties properties;
    private final Clock clock;

    public SosTriggerResponse triggerSos(SosTriggerRequest request) {
        return triggerSos(request.getTripId(), request.getTriggeredBy(), request.getRole(),
                request.getLat(), request.getLng(), request.getAddress());
    }

    public SosTriggerResponse triggerSos(UUID tripId, String triggeredBy, TriggeredByRole role,
                                         double lat, double lng, String address) {
        Optional<SosAlert> open = alertRepository.findFirstByTripIdAndStateInOrderByTriggeredAtDesc(tripId, SosState.OPEN);
        if (open.isPresent()) {
            SosAlert existing = open.get();
            log.info("SOS already open for trip {} (alert {}, {}), returning it", tripId, existing.getId(), existing.getState());
            return toTriggerResponse(existing, true);
        }
        if (isCompleted(tripId)) {
            throw new TripNotActiveException(tripId, "SOS trigger");
        }

        Instant now = clock.instant();
        log.info("🚨 SOS TRIGGERED on trip {} by {} {}", tripId, role, triggeredBy);
        SosAlert alert = SosAlert.builder()
                .id(UUID.randomUUID())
                .tripId(tripId)
                .activeTripId(tripId)
                .triggeredBy(triggeredBy)
                .triggeredByRole(role)
                .lat(lat)
                .lng(lng)
                .address(address)
                .state(SosState.PERSISTED)
                .triggeredAt(now)
                .persistedAt(now)
                .build();

        SosAlert persisted = persister.persist(alert);
        if (!persisted.getId().equals(alert.getId())) {
            log.info("Concurrent SOS on trip {} resolved to alert {}", tripId, persisted.getId());
            return toTriggerResponse(persisted, true);
        }
        log.info("SOS alert {} PERSISTED for trip {}", persisted.getId(), tripId);

        SosEvent triggered = SosEvent.of(SosEvent.EventType.TRIGGERED, persisted.getId(), tripId,
                SosState.PERSISTED.name(), triggeredBy, now);
        triggered.setLocation(new LocationSample(tripId, lat, lng, 0, 0, now));
        eventPublisher.announce(triggered);

        startNotifying(persisted);
        return toTriggerResponse(findAlert(persisted.getId()), false);
    }

    /**
     * Operator has picked the alert up. Re-acknowledging an acknowledged alert is a no-op.
     */
    public SosAlertResponse acknowledgeAlert(UUID alertId, String operatorId) {
        SosAlert alert = findAlert(alertId);
        if (alert.getState() == SosState.ACKNOWLEDGED) {
            return toResponse(alert);
        }
        if (alertRepository.acknowledge(alertId, SosState.ACKNOWLEDGEABLE, SosState.ACKNOWLEDGED,
                operatorId, clock.instant()) != 1) {
            throw new InvalidStateTransitionException("SosAlert", findAlert(alertId).getState().name(),
                    SosState.ACKNOWLEDGED.name());
        }
        log.info("SOS alert {} ACKNOWLEDGED by {}", alertId, operatorId);
        eventPublisher.announce(SosEvent.of(SosEvent.EventType.ACKNOWLEDGED, alertId, alert.getTripId(),
                SosState.ACKNOWLEDGED.name(), operatorId, clock.instant()));
        return toResponse(findAlert(alertId));
    }

    /**
     * Closes the alert. An alert nobody acknowledged yet is acknowledged by the
     * resolver first, so RESOLVED is always entered from ACKNOWLEDGED or ESCALATED.
     */
    public SosAlertResponse resolveAlert(UUID alertId, String resolvedBy, String resolution, List<String> actionsTaken) {
        if (resolution == null || resolution.isBlank()) {
            throw new IllegalArgumentException("Resolution is required");
        }
        SosAlert alert = findAlert(alertId);
        if (SosState.AWAITING_ACK.contains(alert.getState())) {
            acknowledgeAlert(alertId, resolvedBy);
        }

        Instant now = clock.instant();
        if (alertRepository.resolveWithActions(alertId, RESOLVABLE, SosState.RESOLVED, resolvedBy,
                resolution.trim(), now, actionsTaken) != 1) {
            throw new InvalidStateTransitionException("SosAlert", findAlert(alertId).getState().name(),
                    SosState.RESOLVED.name());
        }

        try {
            tripWindowStore.clearSosActive(alert.getTripId());
        } catch (RuntimeException e) {
            log.warn("Could not clear SOS flag of trip {}: {}", alert.getTripId(), e.getMessage());
        }
        log.info("SOS alert {} RESOLVED by {}: {}", alertId, resolvedBy, resolution);
        eventPublisher.announce(SosEvent.of(SosEvent.EventType.RESOLVED, alertId, alert.getTripId(),
                SosState.RESOLVED.name(), resolvedBy, now));
        return toResponse(findAlert(alertId));
    }

    /**
     * Fired by the delayed timer job once the acknowledge window has passed.
     * Safe to run more than once: exactly one VOICE job exists per escalated alert.
     */
    public void onEscalationTimer(UUID alertId) {
        SosAlert alert = findAlert(alertId);
        Instant now = clock.instant();

        boolean escalated = alertRepository.escalate(alertId, SosState.AWAITING_ACK, SosState.ESCALATED, now) == 1;
        if (!escalated) {
            SosAlert current = findAlert(alertId);
            if (current.getState() != SosState.ESCALATED
                    || queueService.countJobs(alertId, ChannelType.VOICE) > 0) {
                log.debug("Escalation timer for alert {} is a no-op, state {}", alertId, current.getState());
                return;
            }
            // an earlier run escalated but died before enqueueing the call
        } else {
            log.warn("⏰ SOS alert {} not acknowledged within {}s, ESCALATED",
                    alertId, properties.getAcknowledgeWindow().toSeconds());
            eventPublisher.announce(SosEvent.of(SosEvent.EventType.ESCALATED, alertId, alert.getTripId(),
                    SosState.ESCALATED.name(), null, now));
        }

        enqueueForAlert(alertId, NotificationRequest.builder()
                .priority(JobPriority.CRITICAL)
                .channel(ChannelType.VOICE)
                .recipient(properties.getOnCallNumber())
                .subject("Unacknowledged SOS")
                .payload(messageFor(alert))
                .alertId(alertId)
                .build());
    }

    /**
     * Continuous tracking of an open alert: appends the position to the alert's
     * trail and moves its last known location forward. A sample that is not newer
     * than the last recorded one is ignored.
     *
     * @return whether the sample was recorded
     * @throws InvalidStateTransitionException if the alert is already resolved
     */
    public boolean recordLocation(UUID alertId, LocationSample sample) {
        SosAlert alert = findAlert(alertId);
        if (!SosState.OPEN.contains(alert.getState())) {
            throw new InvalidStateTransitionException("SosAlert", alert.getState().name(), "LOCATION_UPDATE");
        }
        if (alertRepository.updateLastLocation(alertId, SosState.OPEN, sample.lat(), sample.lng(),
                sample.capturedAt()) != 1) {
            log.debug("Location for alert {} captured at {} is not newer, skipped", alertId, sample.capturedAt());
            return false;
        }
        locationPointRepository.save(SosLocationPoint.builder()
                .alertId(alertId)
                .lat(sample.lat())
                .lng(sample.lng())
                .speed(sample.speed())
                .heading(sample.heading())
                .capturedAt(sample.capturedAt())
                .recordedAt(clock.instant())
                .build());
        trimTrail(alertId);
        return true;
    }

    @EventListener
    public void onLocationSampled(SosLocationSampledEvent event) {
        try {
            recordLocation(event.alertId(), event.sample());
        } catch (InvalidStateTransitionException | ResourceNotFoundException e) {
            log.debug("Location for alert {} not recorded: {}", event.alertId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not record SOS location for alert {}: {}", event.alertId(), e.getMessage());
        }
    }

    public SosAlertResponse getAlert(UUID alertId) {
        return toResponse(findAlert(alertId));
    }

    public List<SosAlertResponse> listAlerts(SosState state, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 200)));
        List<SosAlert> alerts = state == null
                ? alertRepository.findAllByOrderByTriggeredAtDesc(page)
                : alertRepository.findByStateOrderByTriggeredAtDesc(state, page);
        return alerts.stream().map(this::toResponse).toList();
    }

    /**
     * Number of alerts in each non-terminal state.
     */
    public Map<SosState, Long> activeCounts() {
        Map<SosState, Long> counts = new EnumMap<>(SosState.class);
        for (SosState state : SosState.OPEN) {
            counts.put(state, alertRepository.countByState(state));
        }
        return counts;
    }

    private void startNotifying(SosAlert alert) {
        UUID alertId = alert.getId();
        if (alertRepository.transition(alertId, EnumSet.of(SosState.PERSISTED), SosState.NOTIFYING) != 1) {
            log.info("SOS alert {} left PERSISTED before notifying started, state {}", alertId, findAlert(alertId).getState());
        } else {
            log.info("SOS alert {} NOTIFYING", alertId);
        }

        String message = messageFor(alert);
        List<NotificationRequest> requests = new ArrayList<>();
        for (EmergencyContact contact : contactDirectory.contactsOf(alert.getTriggeredBy())) {
            if (contact.pushToken() != null) {
                requests.add(critical(alert, ChannelType.PUSH, contact.pushToken(), message));
            }
            if (contact.phone() != null) {
                requests.add(critical(alert, ChannelType.SMS, contact.phone(), message));
            }
            if (contact.email() != null) {
                requests.add(critical(alert, ChannelType.EMAIL, contact.email(), message));
            }
        }
        requests.add(critical(alert, ChannelType.DASHBOARD, properties.getOperatorDashboardRecipient(), message));
        requests.add(NotificationRequest.builder()
                .priority(JobPriority.CRITICAL)
                .channel(ChannelType.SOS_ESCALATION_TIMER)
                .recipient(alertId.toString())
                .alertId(alertId)
                .notBefore(alert.getPersistedAt().plus(properties.getAcknowledgeWindow()))
                .build());

        for (NotificationRequest request : requests) {
            enqueueForAlert(alertId, request);
        }

        try {
            tripWindowStore.markSosActive(alert.getTripId(), alertId);
        } catch (RuntimeException e) {
            log.warn("Could not flag trip {} as SOS-active: {}", alert.getTripId(), e.getMessage());
        }
        eventPublisher.announce(SosEvent.of(SosEvent.EventType.NOTIFYING, alertId, alert.getTripId(),
                SosState.NOTIFYING.name(), null, clock.instant()));
    }

    /**
     * Enqueues a job for an alert after checking, against the store, that the
     * alert is durably recorded in a state that may still notify.
     */
    UUID enqueueForAlert(UUID alertId, NotificationRequest request) {
        SosState state = alertRepository.findById(alertId)
                .map(SosAlert::getState)
                .orElseThrow(() -> new InvariantViolationException(
                        "Refusing to notify for alert " + alertId + " which is not persisted"));
        if (!ENQUEUEABLE.contains(state)) {
            throw new InvariantViolationException(String.format(
                    "Refusing to notify for alert %s in state %s", alertId, state));
        }
        return queueService.enqueue(request);
    }

    private NotificationRequest critical(SosAlert alert, ChannelType channel, String recipient, String message) {
        return NotificationRequest.builder()
                .priority(JobPriority.CRITICAL)
                .channel(channel)
                .recipient(recipient)
                .subject("SOS alert")
                .payload(message)
                .alertId(alert.getId())
                .build();
    }

    private String messageFor(SosAlert alert) {
        String where = alert.getAddress() != null && !alert.getAddress().isBlank()
                ? alert.getAddress()
                : String.format("%.5f,%.5f", alert.getLat(), alert.getLng());
        return String.format("SOS raised by %s on trip %s at %s. Location: %s. Live location: %s",
                alert.getTriggeredByRole().name().toLowerCase(), alert.getTripId(), alert.getTriggeredAt(),
                where, locationLink(alert));
    }

    /**
     * Link to the live-tracking page of the alert, seeded with the trigger position.
     */
    String locationLink(SosAlert alert) {
        return UriComponentsBuilder.fromHttpUrl(properties.getTrackingLinkBaseUrl())
                .pathSegment("sos", "track", alert.getId().toString())
                .queryParam("lat", alert.getLat())
                .queryParam("lng", alert.getLng())
                .toUriString();
    }

    // the trip flags live in the cache; an SOS is never refused because the cache is down
    private boolean isCompleted(UUID tripId) {
        try {
            return tripWindowStore.isCompleted(tripId);
        } catch (RuntimeException e) {
            log.warn("Could not check completion of trip {}, accepting SOS: {}", tripId, e.getMessage());
            return false;
        }
    }

    private SosAlert findAlert(UUID alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("SosAlert", "id", alertId));
    }

    private void trimTrail(UUID alertId) {
        List<SosLocationPoint> oldestKept = locationPointRepository.findByAlertIdOrderByCapturedAtDesc(alertId,
                PageRequest.of(trailLimit() - 1, 1));
        if (!oldestKept.isEmpty()) {
            locationPointRepository.deleteOlderThan(alertId, oldestKept.get(0).getCapturedAt());
        }
    }

    private int trailLimit() {
        return Math.max(1, properties.getLocationTrailLimit());
    }

    private SosAlertResponse toResponse(SosAlert alert) {
        return SosAlertResponse.from(alert,
                channelResultRepository.findByAlertIdOrderByChannelAsc(alert.getId()),
                locationPointRepository.findByAlertIdOrderByCapturedAtDesc(alert.getId(), PageRequest.of(0, trailLimit())));
    }

    private static SosTriggerResponse toTriggerResponse(SosAlert alert, boolean duplicate) {
        return SosTriggerResponse.builder()
                .alertId(alert.getId())
                .tripId(alert.getTripId())
                .state(alert.getState())
                .triggeredAt(alert.getTriggeredAt())
                .duplicate(duplicate)
                .build();
    }
}
