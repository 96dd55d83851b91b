package com.gocomet.tripsafety.sos.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "sos_alerts", indexes = {
        @Index(name = "idx_sos_alerts_trip_id", columnList = "trip_id"),
        @Index(name = "idx_sos_alerts_state", columnList = "state")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SosAlert {

    @Id
    private UUID id;  // assigned before the first write so a retried insert stays idempotent

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    // set while the alert is open, nulled on resolve; unique so a trip has at most one open alert
    @Column(name = "active_trip_id", unique = true)
    private UUID activeTripId;

    @Column(name = "triggered_by", nullable = false)
    private String triggeredBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "triggered_by_role", nullable = false)
    private TriggeredByRole triggeredByRole;

    @Column(nullable = false)
    private Double lat;

    @Column(nullable = false)
    private Double lng;

    private String address;

    // newest continuous-tracking position, null until the first one arrives
    @Column(name = "last_lat")
    private Double lastLat;

    @Column(name = "last_lng")
    private Double lastLng;

    @Column(name = "last_location_at")
    private Instant lastLocationAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SosState state;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Column(name = "persisted_at")
    private Instant persistedAt;

    @Column(name = "acknowledged_by")
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(length = 2000)
    private String resolution;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sos_alert_actions", joinColumns = @JoinColumn(name = "alert_id"))
    @Column(name = "action", nullable = false)
    @Builder.Default
    private List<String> actionsTaken = new ArrayList<>();
}
