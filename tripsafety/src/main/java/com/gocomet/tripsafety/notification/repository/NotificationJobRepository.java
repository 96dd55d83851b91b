package com.gocomet.tripsafety.notification.repository;

import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.JobStatus;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Every state change is a single conditional UPDATE whose WHERE clause names
 * the state it starts from; a return value of 0 means another worker got there first.
 */
@Repository
public interface NotificationJobRepository extends JpaRepository<NotificationJob, UUID> {

    @Query("select j.id from NotificationJob j " +
            "where j.status = com.gocomet.tripsafety.notification.model.JobStatus.QUEUED and j.nextAttemptAt <= :now " +
            "order by j.priorityRank asc, j.nextAttemptAt asc")
    List<UUID> findClaimable(@Param("now") Instant now, Pageable pageable);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.IN_FLIGHT, j.attempts = j.attempts + 1, " +
            "j.leaseUntil = :leaseUntil, j.lockedBy = :workerId, j.updatedAt = :now " +
            "where j.id = :id and j.status = com.gocomet.tripsafety.notification.model.JobStatus.QUEUED and j.nextAttemptAt <= :now")
    int claim(@Param("id") UUID id,
              @Param("workerId") String workerId,
              @Param("now") Instant now,
              @Param("leaseUntil") Instant leaseUntil);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.COMPLETED, j.completedAt = :now, j.updatedAt = :now, " +
            "j.leaseUntil = null, j.lastError = null " +
            "where j.id = :id and j.status = com.gocomet.tripsafety.notification.model.JobStatus.IN_FLIGHT and j.lockedBy = :workerId")
    int markCompleted(@Param("id") UUID id, @Param("workerId") String workerId, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.RETRYING, j.nextAttemptAt = :nextAttemptAt, " +
            "j.lastError = :error, j.leaseUntil = null, j.updatedAt = :now " +
            "where j.id = :id and j.status = com.gocomet.tripsafety.notification.model.JobStatus.IN_FLIGHT and j.lockedBy = :workerId")
    int markRetrying(@Param("id") UUID id,
                     @Param("workerId") String workerId,
                     @Param("nextAttemptAt") Instant nextAttemptAt,
                     @Param("error") String error,
                     @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.FAILED, j.lastError = :error, j.completedAt = :now, " +
            "j.leaseUntil = null, j.updatedAt = :now " +
            "where j.id = :id and j.status = com.gocomet.tripsafety.notification.model.JobStatus.IN_FLIGHT and j.lockedBy = :workerId")
    int markFailed(@Param("id") UUID id,
                   @Param("workerId") String workerId,
                   @Param("error") String error,
                   @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.QUEUED, j.updatedAt = :now " +
            "where j.status = com.gocomet.tripsafety.notification.model.JobStatus.RETRYING and j.nextAttemptAt <= :now")
    int promoteDueRetries(@Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.FAILED, j.lastError = 'lease expired', " +
            "j.completedAt = :now, j.leaseUntil = null, j.updatedAt = :now " +
            "where j.status = com.gocomet.tripsafety.notification.model.JobStatus.IN_FLIGHT and j.leaseUntil < :now and j.attempts >= j.maxAttempts")
    int failExpiredLeases(@Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.RETRYING, j.nextAttemptAt = :now, " +
            "j.lastError = 'lease expired', j.leaseUntil = null, j.lockedBy = null, j.updatedAt = :now " +
            "where j.status = com.gocomet.tripsafety.notification.model.JobStatus.IN_FLIGHT and j.leaseUntil < :now and j.attempts < j.maxAttempts")
    int retryExpiredLeases(@Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update NotificationJob j set j.status = com.gocomet.tripsafety.notification.model.JobStatus.QUEUED, j.attempts = 0, j.nextAttemptAt = :now, " +
            "j.lastError = null, j.completedAt = null, j.lockedBy = null, j.updatedAt = :now " +
            "where j.id = :id and j.status = com.gocomet.tripsafety.notification.model.JobStatus.FAILED")
    int requeueFailed(@Param("id") UUID id, @Param("now") Instant now);

    @Query("select j.status, count(j) from NotificationJob j group by j.status")
    List<Object[]> countByStatus();

    @Query("select j.channel, count(j) from NotificationJob j where j.status = com.gocomet.tripsafety.notification.model.JobStatus.FAILED group by j.channel")
    List<Object[]> countFailedByChannel();

    List<NotificationJob> findByStatusOrderByUpdatedAtDesc(JobStatus status, Pageable pageable);

    List<NotificationJob> findByAlertIdOrderByCreatedAtAsc(UUID alertId);

    long countByAlertIdAndChannel(UUID alertId, ChannelType channel);
}
