package com.gocomet.tripsafety.notification.service;

import com.gocomet.tripsafety.admission.service.CircuitBreakerService;
import com.gocomet.tripsafety.common.exception.CircuitOpenException;
import com.gocomet.tripsafety.notification.channel.NotificationChannel;
import com.gocomet.tripsafety.notification.event.NotificationAttemptEvent;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.JobStatus;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one claimed job through its channel and reports the outcome to the queue.
 *
 * External channels go through their circuit breaker. A rejection by an open
 * circuit is recorded as a failed attempt like any other failure, so a job
 * whose provider stays down still terminates within maxAttempts.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final Map<ChannelType, NotificationChannel> channels = new EnumMap<>(ChannelType.class);
    private final NotificationQueueService queueService;
    private final CircuitBreakerService circuitBreakerService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  NotificationQueueService queueService,
                                  CircuitBreakerService circuitBreakerService,
                                  ApplicationEventPublisher eventPublisher,
                                  Clock clock) {
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.type(), channel);
        }
        this.queueService = queueService;
        this.circuitBreakerService = circuitBreakerService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void dispatch(NotificationJob job, String workerId) {
        NotificationChannel channel = channels.get(job.getChannel());
        String error;
        try {
            if (channel == null) {
                throw new IllegalStateException("No channel registered for " + job.getChannel());
            }
            if (channel.dependency() == null) {
                channel.deliver(job);
            } else {
                circuitBreakerService.run(channel.dependency(), () -> channel.deliver(job));
            }
            queueService.complete(job, workerId);
            publish(job, true, true, null);
            return;
        } catch (CircuitOpenException e) {
            error = "circuit open: " + e.getDependency();
        } catch (RuntimeException e) {
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }

        JobStatus next = queueService.fail(job, workerId, error);
        publish(job, false, next == JobStatus.FAILED, error);
    }

    public boolean supports(ChannelType type) {
        return channels.containsKey(type);
    }

    private void publish(NotificationJob job, boolean success, boolean terminal, String error) {
        try {
            eventPublisher.publishEvent(new NotificationAttemptEvent(job.getId(), job.getAlertId(),
                    job.getChannel(), success, job.getAttempts(), terminal, error, clock.instant()));
        } catch (RuntimeException e) {
            // the job's own state is already recorded; a listener failure must not undo it
            log.warn("Attempt listener failed for job {}: {}", job.getId(), e.getMessage());
        }
    }
}
