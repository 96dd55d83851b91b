package com.gocomet.tripsafety.common.event;

import com.gocomet.tripsafety.tracking.model.LocationSample;

import java.util.UUID;

/**
 * A sample accepted by the location cache for a trip with an open SOS alert.
 * Published once, on the instance that took the write.
 */
public record SosLocationSampledEvent(UUID alertId, LocationSample sample) {
}
