package com.gocomet.tripsafety.admission.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Rate-limit quotas and breaker thresholds, bound from app.admission.*
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.admission")
public class AdmissionProperties {

    private RateLimit rateLimit = new RateLimit();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Getter
    @Setter
    public static class RateLimit {
        private Duration window = Duration.ofMinutes(1);
        private long standardLimit = 100;
        private long criticalLimit = 300;
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        // consecutive failures before the circuit opens
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(30);
    }
}
