package com.gocomet.tripsafety.notification.channel;

import com.gocomet.tripsafety.notification.config.NotificationProperties;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulates the external providers (FCM/APNs, SMS aggregator, mail relay, voice
 * dialler).
 *
 * Behavior:
 * - configurable failure rate (default 10%)
 * - random latency between min and max (simulates network round trip)
 *
 * In production each channel would call its provider's SDK here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimulatedGateway {

    private final NotificationProperties properties;

    public void send(ChannelType channel, NotificationJob job) {
        NotificationProperties.Gateway gateway = properties.getGateway();
        ThreadLocalRandom random = ThreadLocalRandom.current();

        long latency = gateway.getMinLatencyMs()
                + (gateway.getMaxLatencyMs() > gateway.getMinLatencyMs()
                ? random.nextLong(gateway.getMaxLatencyMs() - gateway.getMinLatencyMs())
                : 0);
        try {
            Thread.sleep(latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException(channel, "interrupted");
        }

        if (random.nextDouble() < gateway.getFailureRate()) {
            log.info("Gateway stub: {} to {} FAILED after {}ms", channel, job.getRecipient(), latency);
            throw new ChannelDeliveryException(channel, "provider unavailable");
        }
        log.info("Gateway stub: [{}] to={} subject='{}' delivered in {}ms",
                channel, job.getRecipient(), job.getSubject(), latency);
    }
}
