package com.gocomet.tripsafety.notification.dto;

import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.JobPriority;
import com.gocomet.tripsafety.notification.model.JobStatus;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationJobResponse {

    private UUID id;
    private JobPriority priority;
    private ChannelType channel;
    private String recipient;
    private UUID alertId;
    private JobStatus status;
    private int attempts;
    private int maxAttempts;
    private Instant nextAttemptAt;
    private String lastError;
    private Instant createdAt;
    private Instant completedAt;

    public static NotificationJobResponse from(NotificationJob job) {
        return NotificationJobResponse.builder()
                .id(job.getId())
                .priority(job.getPriority())
                .channel(job.getChannel())
                .recipient(job.getRecipient())
                .alertId(job.getAlertId())
                .status(job.getStatus())
                .attempts(job.getAttempts())
                .maxAttempts(job.getMaxAttempts())
                .nextAttemptAt(job.getNextAttemptAt())
                .lastError(job.getLastError())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
