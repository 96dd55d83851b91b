package com.gocomet.tripsafety.tracking.dto;

import com.gocomet.tripsafety.tracking.model.LocationSample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubscriptionResponse {

    private UUID tripId;
    private String connectionId;
    private String destination;      // STOMP topic the client should listen on
    private LocationSample lastKnown; // null if nothing cached yet
}
