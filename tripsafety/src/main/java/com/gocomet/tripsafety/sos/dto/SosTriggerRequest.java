package com.gocomet.tripsafety.sos.dto;

import com.gocomet.tripsafety.sos.model.TriggeredByRole;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SosTriggerRequest {

    @NotNull(message = "Trip ID is required")
    private UUID tripId;

    @NotBlank(message = "triggeredBy is required")
    private String triggeredBy;

    @NotNull(message = "Role is required (PASSENGER or DRIVER)")
    private TriggeredByRole role;

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double lat;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double lng;

    private String address;
}
