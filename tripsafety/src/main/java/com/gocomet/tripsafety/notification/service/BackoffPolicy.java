package com.gocomet.tripsafety.notification.service;

import com.gocomet.tripsafety.notification.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;

/**
 * Delay before the next attempt: initial × multiplier^(attempt-1), capped at max.
 */
@Component
@RequiredArgsConstructor
public class BackoffPolicy {

    private final NotificationProperties properties;

    /**
     * @param attemptsMade attempts already made, at least 1
     */
    public Duration delayAfter(int attemptsMade) {
        ExponentialBackOff backOff = new ExponentialBackOff(
                properties.getInitialBackoff().toMillis(), properties.getBackoffMultiplier());
        backOff.setMaxInterval(properties.getMaxBackoff().toMillis());

        BackOffExecution execution = backOff.start();
        long delay = execution.nextBackOff();
        for (int i = 1; i < attemptsMade; i++) {
            delay = execution.nextBackOff();
        }
        return Duration.ofMillis(delay);
    }
}
