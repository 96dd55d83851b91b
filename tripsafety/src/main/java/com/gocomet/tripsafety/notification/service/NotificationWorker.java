package com.gocomet.tripsafety.notification.service;

import com.gocomet.tripsafety.notification.config.NotificationProperties;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Poll loop of the delivery queue. Each tick housekeeps, then claims only as
 * many jobs as the executor has room for and hands them over.
 */
@Component
@ConditionalOnProperty(prefix = "app.notification", name = "worker-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class NotificationWorker {

    private final NotificationQueueService queueService;
    private final NotificationDispatcher dispatcher;
    private final ThreadPoolTaskExecutor executor;
    private final NotificationProperties properties;

    public NotificationWorker(NotificationQueueService queueService,
                              NotificationDispatcher dispatcher,
                              @Qualifier("notificationExecutor") ThreadPoolTaskExecutor executor,
                              NotificationProperties properties) {
        this.queueService = queueService;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${app.notification.poll-interval-ms:500}")
    public void poll() {
        try {
            queueService.housekeep();

            int capacity = Math.min(properties.getBatchSize(),
                    executor.getThreadPoolExecutor().getQueue().remainingCapacity());
            List<NotificationJob> jobs = queueService.claimDue(properties.getWorkerId(), capacity);
            for (NotificationJob job : jobs) {
                submit(job);
            }
        } catch (RuntimeException e) {
            // next tick retries; claimed jobs are recovered through their lease
            log.error("Notification worker tick failed: {}", e.getMessage(), e);
        }
    }

    private void submit(NotificationJob job) {
        try {
            executor.execute(() -> dispatcher.dispatch(job, properties.getWorkerId()));
        } catch (TaskRejectedException e) {
            log.warn("Executor full, job {} will be recovered when its lease expires", job.getId());
        }
    }
}
