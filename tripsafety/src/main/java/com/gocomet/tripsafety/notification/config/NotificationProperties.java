package com.gocomet.tripsafety.notification.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.UUID;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.notification")
public class NotificationProperties {

    private int maxAttempts = 5;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(30);

    private long pollIntervalMs = 500;
    private int batchSize = 20;

    // how long a claimed job may stay IN_FLIGHT before another worker reclaims it
    private Duration lease = Duration.ofSeconds(60);

    private int workerThreads = 8;
    private boolean workerEnabled = true;
    private String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    private Gateway gateway = new Gateway();

    /**
     * Behaviour of the simulated provider gateways.
     */
    @Getter
    @Setter
    public static class Gateway {
        private double failureRate = 0.1;
        private long minLatencyMs = 20;
        private long maxLatencyMs = 200;
    }
}
