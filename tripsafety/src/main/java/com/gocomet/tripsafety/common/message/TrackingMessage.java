package com.gocomet.tripsafety.common.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Envelope pushed to end-user and operator clients over STOMP.
 *
 * type: "location" or "sosEvent"
 * ts:   server time the message was produced, epoch millis
 *
 * Clients ignore a "location" message whose payload.capturedAt is not newer
 * than the last one they rendered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingMessage {

    public static final String TYPE_LOCATION = "location";
    public static final String TYPE_SOS_EVENT = "sosEvent";

    private String type;
    private UUID tripId;
    private Object payload;
    private long ts;

    public static TrackingMessage location(LocationSample sample, long ts) {
        return TrackingMessage.builder()
                .type(TYPE_LOCATION)
                .tripId(sample.tripId())
                .payload(sample)
                .ts(ts)
                .build();
    }

    public static TrackingMessage sosEvent(UUID tripId, Object payload, long ts) {
        return TrackingMessage.builder()
                .type(TYPE_SOS_EVENT)
                .tripId(tripId)
                .payload(payload)
                .ts(ts)
                .build();
    }

    @JsonIgnore
    public boolean isLocation() {
        return TYPE_LOCATION.equals(type);
    }
}
