package com.gocomet.tripsafety.sos.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolveRequest {

    @NotBlank(message = "resolvedBy is required")
    private String resolvedBy;

    @NotBlank(message = "Resolution is required")
    private String resolution;

    @Builder.Default
    private List<String> actionsTaken = new ArrayList<>();
}
