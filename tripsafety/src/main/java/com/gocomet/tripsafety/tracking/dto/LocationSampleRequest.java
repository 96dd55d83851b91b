package com.gocomet.tripsafety.tracking.dto;

import com.gocomet.tripsafety.tracking.model.LocationSample;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationSampleRequest {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double lat;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double lng;

    @DecimalMin(value = "0.0", message = "Speed cannot be negative")
    private Double speed;

    @DecimalMin(value = "0.0", message = "Heading must be >= 0")
    @DecimalMax(value = "360.0", inclusive = false, message = "Heading must be < 360")
    private Double heading;

    @NotNull(message = "capturedAt is required")
    private Instant capturedAt;

    public LocationSample toSample(UUID tripId) {
        return new LocationSample(tripId, lat, lng,
                speed == null ? 0.0 : speed,
                heading == null ? 0.0 : heading,
                capturedAt);
    }
}
