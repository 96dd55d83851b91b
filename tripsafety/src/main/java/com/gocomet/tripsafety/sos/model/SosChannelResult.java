package com.gocomet.tripsafety.sos.model;

import com.gocomet.tripsafety.notification.model.ChannelType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Latest delivery outcome of one channel for one alert. A channel that succeeded
 * once stays SUCCESS whatever later attempts report.
 */
@Entity
@Table(name = "sos_channel_results", uniqueConstraints = {
        @UniqueConstraint(name = "uk_sos_channel_results_alert_channel", columnNames = {"alert_id", "channel"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SosChannelResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "alert_id", nullable = false)
    private UUID alertId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChannelType channel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChannelResultStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "attempted_at", nullable = false)
    private Instant attemptedAt;

    @Column(name = "last_error", length = 1000)
    private String lastError;
}
