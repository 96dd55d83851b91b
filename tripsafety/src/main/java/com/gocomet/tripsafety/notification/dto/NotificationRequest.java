package com.gocomet.tripsafety.notification.dto;

import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.JobPriority;
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
public class NotificationRequest {

    private JobPriority priority;
    private ChannelType channel;
    private String recipient;
    private String subject;
    private String payload;
    private UUID alertId;
    private Instant notBefore;   // null = deliver as soon as possible
    private Integer maxAttempts; // null = configured default
}
