package com.gocomet.tripsafety.sos.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeRequest {

    @NotBlank(message = "operatorId is required")
    private String operatorId;
}
