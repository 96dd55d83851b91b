package com.gocomet.tripsafety.tracking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.UUID;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.tracking")
public class TrackingProperties {

    // idle window after which a trip's last sample expires
    private Duration locationTtl = Duration.ofMinutes(5);

    // identifies this process in the shared subscription registry
    private String instanceId = UUID.randomUUID().toString();

    private Duration completedTripRetention = Duration.ofHours(24);

    // upper bound on an open trip window if the completion signal is never received
    private Duration maxTripDuration = Duration.ofHours(12);
}
