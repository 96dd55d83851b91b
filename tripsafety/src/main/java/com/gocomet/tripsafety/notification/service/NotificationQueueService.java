package com.gocomet.tripsafety.notification.service;

import com.gocomet.tripsafety.common.exception.InvalidStateTransitionException;
import com.gocomet.tripsafety.common.exception.ResourceNotFoundException;
import com.gocomet.tripsafety.notification.config.NotificationProperties;
import com.gocomet.tripsafety.notification.dto.NotificationRequest;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.JobPriority;
import com.gocomet.tripsafety.notification.model.JobStatus;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import com.gocomet.tripsafety.notification.repository.NotificationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable delivery queue on top of the notification_jobs table.
 *
 * QUEUED → IN_FLIGHT → COMPLETED
 *                    → RETRYING → QUEUED (when due)
 *                    → FAILED   (attempts == maxAttempts)
 *
 * Claiming increments attempts in the same conditional update, so a job can
 * never be delivered more than maxAttempts times and always ends COMPLETED or FAILED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationQueueService {

    private final NotificationJobRepository jobRepository;
    private final BackoffPolicy backoffPolicy;
    private final NotificationProperties properties;
    private final Clock clock;

    /**
     * Writes the job and flushes it before returning its id.
     */
    @Transactional
    public UUID enqueue(NotificationRequest request) {
        Objects.requireNonNull(request.getChannel(), "channel");
        if (request.getRecipient() == null || request.getRecipient().isBlank()) {
            throw new IllegalArgumentException("Notification recipient is required");
        }
        JobPriority priority = request.getPriority() == null ? JobPriority.NORMAL : request.getPriority();
        Instant now = clock.instant();

        NotificationJob job = NotificationJob.builder()
                .priority(priority)
                .priorityRank(priority.rank())
                .channel(request.getChannel())
                .recipient(request.getRecipient())
                .subject(request.getSubject())
                .payload(request.getPayload())
                .alertId(request.getAlertId())
                .maxAttempts(request.getMaxAttempts() == null ? properties.getMaxAttempts() : request.getMaxAttempts())
                .nextAttemptAt(request.getNotBefore() == null ? now : request.getNotBefore())
                .status(JobStatus.QUEUED)
                .updatedAt(now)
                .build();
        job = jobRepository.saveAndFlush(job);

        log.debug("Enqueued {} job {} [{}] for {} due {}",
                job.getChannel(), job.getId(), priority, job.getRecipient(), job.getNextAttemptAt());
        return job.getId();
    }

    /**
     * Claims up to {@code limit} due jobs for {@code workerId}, highest priority first.
     * Jobs another worker claimed in between are skipped.
     */
    @Transactional
    public List<NotificationJob> claimDue(String workerId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(properties.getLease());

        List<UUID> candidates = jobRepository.findClaimable(now, PageRequest.of(0, limit));
        List<UUID> claimed = new ArrayList<>(candidates.size());
        for (UUID id : candidates) {
            if (jobRepository.claim(id, workerId, now, leaseUntil) == 1) {
                claimed.add(id);
            }
        }
        return claimed.isEmpty() ? List.of() : jobRepository.findAllById(claimed).stream()
                .sorted((a, b) -> a.getPriorityRank() != b.getPriorityRank()
                        ? Integer.compare(a.getPriorityRank(), b.getPriorityRank())
                        : a.getNextAttemptAt().compareTo(b.getNextAttemptAt()))
                .toList();
    }

    @Transactional
    public void complete(NotificationJob job, String workerId) {
        if (jobRepository.markCompleted(job.getId(), workerId, clock.instant()) == 1) {
            log.info("✅ {} job {} delivered on attempt {}", job.getChannel(), job.getId(), job.getAttempts());
        } else {
            log.warn("Job {} was no longer owned by {} when it completed", job.getId(), workerId);
        }
    }

    /**
     * Records a failed attempt.
     *
     * @return the status the job moved to
     */
    @Transactional
    public JobStatus fail(NotificationJob job, String workerId, String error) {
        Instant now = clock.instant();
        if (job.getAttempts() >= job.getMaxAttempts()) {
            if (jobRepository.markFailed(job.getId(), workerId, truncate(error), now) == 1) {
                log.error("❌ {} job {} FAILED after {} attempts: {}",
                        job.getChannel(), job.getId(), job.getAttempts(), error);
            }
            return JobStatus.FAILED;
        }

        Instant nextAttemptAt = now.plus(backoffPolicy.delayAfter(job.getAttempts()));
        if (jobRepository.markRetrying(job.getId(), workerId, nextAttemptAt, truncate(error), now) == 1) {
            log.warn("{} job {} attempt {}/{} failed ({}), retrying at {}",
                    job.getChannel(), job.getId(), job.getAttempts(), job.getMaxAttempts(), error, nextAttemptAt);
        }
        return JobStatus.RETRYING;
    }

    /**
     * Moves due RETRYING jobs back to QUEUED and reclaims IN_FLIGHT jobs whose
     * worker stopped reporting.
     */
    @Transactional
    public void housekeep() {
        Instant now = clock.instant();
        int promoted = jobRepository.promoteDueRetries(now);
        int expiredFailed = jobRepository.failExpiredLeases(now);
        int expiredRetried = jobRepository.retryExpiredLeases(now);
        if (promoted > 0) {
            log.debug("Promoted {} due retries to QUEUED", promoted);
        }
        if (expiredFailed > 0) {
            log.error("{} in-flight jobs lost their lease with no attempts left, marked FAILED", expiredFailed);
        }
        if (expiredRetried > 0) {
            log.warn("{} in-flight jobs lost their lease, rescheduled", expiredRetried);
        }
    }

    /**
     * Manual re-queue of a terminally failed job; attempts start again from zero.
     */
    @Transactional
    public NotificationJob requeue(UUID jobId) {
        NotificationJob job = getJob(jobId);
        if (jobRepository.requeueFailed(jobId, clock.instant()) != 1) {
            throw new InvalidStateTransitionException("NotificationJob", job.getStatus().name(), JobStatus.QUEUED.name());
        }
        log.info("Job {} re-queued by operator", jobId);
        return getJob(jobId);
    }

    @Transactional(readOnly = true)
    public NotificationJob getJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("NotificationJob", "id", jobId));
    }

    @Transactional(readOnly = true)
    public List<NotificationJob> failedJobs(int limit) {
        return jobRepository.findByStatusOrderByUpdatedAtDesc(JobStatus.FAILED, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<NotificationJob> jobsForAlert(UUID alertId) {
        return jobRepository.findByAlertIdOrderByCreatedAtAsc(alertId);
    }

    @Transactional(readOnly = true)
    public long countJobs(UUID alertId, ChannelType channel) {
        return jobRepository.countByAlertIdAndChannel(alertId, channel);
    }

    /**
     * Queue depth per status, every status present.
     */
    @Transactional(readOnly = true)
    public Map<JobStatus, Long> depth() {
        Map<JobStatus, Long> depth = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            depth.put(status, 0L);
        }
        for (Object[] row : jobRepository.countByStatus()) {
            depth.put((JobStatus) row[0], (Long) row[1]);
        }
        return depth;
    }

    @Transactional(readOnly = true)
    public Map<ChannelType, Long> failedByChannel() {
        Map<ChannelType, Long> failed = new EnumMap<>(ChannelType.class);
        for (Object[] row : jobRepository.countFailedByChannel()) {
            failed.put((ChannelType) row[0], (Long) row[1]);
        }
        return failed;
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 1000 ? error.substring(0, 1000) : error;
    }
}
