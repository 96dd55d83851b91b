package com.gocomet.tripsafety.sos.dto;

import com.gocomet.tripsafety.sos.model.SosState;
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
public class SosTriggerResponse {

    private UUID alertId;
    private UUID tripId;
    private SosState state;
    private Instant triggeredAt;
    private boolean duplicate; // true when an open alert already existed for the trip
}
