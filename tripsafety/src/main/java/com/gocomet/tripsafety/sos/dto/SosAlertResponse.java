package com.gocomet.tripsafety.sos.dto;

import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.sos.model.ChannelResultStatus;
import com.gocomet.tripsafety.sos.model.SosAlert;
import com.gocomet.tripsafety.sos.model.SosChannelResult;
import com.gocomet.tripsafety.sos.model.SosLocationPoint;
import com.gocomet.tripsafety.sos.model.SosState;
import com.gocomet.tripsafety.sos.model.TriggeredByRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SosAlertResponse {

    private UUID alertId;
    private UUID tripId;
    private String triggeredBy;
    private TriggeredByRole triggeredByRole;
    private double lat;
    private double lng;
    private String address;
    private LocationView lastLocation;
    private List<LocationView> locationTrail; // oldest first
    private SosState state;
    private Instant triggeredAt;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant escalatedAt;
    private Instant resolvedAt;
    private String resolvedBy;
    private String resolution;
    private List<String> actionsTaken;
    private boolean delivered; // at least one channel reported success
    private List<ChannelResultView> channelResults;
    private List<TimelineEntry> timeline;

    public record ChannelResultView(ChannelType channel, ChannelResultStatus status, int attempts,
                                    Instant attemptedAt, String lastError) {
    }

    public record TimelineEntry(String event, Instant at, String by) {
    }

    public record LocationView(double lat, double lng, Instant capturedAt) {
    }

    /**
     * @param trail continuous-tracking points, newest first
     */
    public static SosAlertResponse from(SosAlert alert, List<SosChannelResult> results, List<SosLocationPoint> trail) {
        List<LocationView> points = new ArrayList<>(trail.stream()
                .map(p -> new LocationView(p.getLat(), p.getLng(), p.getCapturedAt()))
                .toList());
        Collections.reverse(points);
        LocationView last = alert.getLastLocationAt() == null ? null
                : new LocationView(alert.getLastLat(), alert.getLastLng(), alert.getLastLocationAt());

        List<ChannelResultView> views = results.stream()
                .map(r -> new ChannelResultView(r.getChannel(), r.getStatus(), r.getAttempts(),
                        r.getAttemptedAt(), r.getLastError()))
                .toList();

        return SosAlertResponse.builder()
                .alertId(alert.getId())
                .tripId(alert.getTripId())
                .triggeredBy(alert.getTriggeredBy())
                .triggeredByRole(alert.getTriggeredByRole())
                .lat(alert.getLat())
                .lng(alert.getLng())
                .address(alert.getAddress())
                .lastLocation(last)
                .locationTrail(points)
                .state(alert.getState())
                .triggeredAt(alert.getTriggeredAt())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .acknowledgedBy(alert.getAcknowledgedBy())
                .escalatedAt(alert.getEscalatedAt())
                .resolvedAt(alert.getResolvedAt())
                .resolvedBy(alert.getResolvedBy())
                .resolution(alert.getResolution())
                .actionsTaken(List.copyOf(alert.getActionsTaken()))
                .delivered(views.stream().anyMatch(v -> v.status() == ChannelResultStatus.SUCCESS))
                .channelResults(views)
                .timeline(timelineOf(alert))
                .build();
    }

    private static List<TimelineEntry> timelineOf(SosAlert alert) {
        List<TimelineEntry> timeline = new ArrayList<>();
        timeline.add(new TimelineEntry("triggered", alert.getTriggeredAt(), alert.getTriggeredBy()));
        if (alert.getPersistedAt() != null) {
            timeline.add(new TimelineEntry("persisted", alert.getPersistedAt(), null));
        }
        if (alert.getEscalatedAt() != null) {
            timeline.add(new TimelineEntry("escalated", alert.getEscalatedAt(), null));
        }
        if (alert.getAcknowledgedAt() != null) {
            timeline.add(new TimelineEntry("acknowledged", alert.getAcknowledgedAt(), alert.getAcknowledgedBy()));
        }
        if (alert.getResolvedAt() != null) {
            timeline.add(new TimelineEntry("resolved", alert.getResolvedAt(), alert.getResolvedBy()));
        }
        timeline.sort(Comparator.comparing(TimelineEntry::at));
        return timeline;
    }
}
