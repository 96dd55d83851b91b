package com.gocomet.tripsafety.sos.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One position of the continuous tracking kept while an alert is open.
 */
@Entity
@Table(name = "sos_location_points", indexes = {
        @Index(name = "idx_sos_location_points_alert", columnList = "alert_id, captured_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SosLocationPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "alert_id", nullable = false)
    private UUID alertId;

    @Column(nullable = false)
    private Double lat;

    @Column(nullable = false)
    private Double lng;

    private Double speed;

    private Double heading;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
