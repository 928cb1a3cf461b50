package com.example.engage.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import lombok.Data;

@Data
public class RescheduleRequest {

    @NotBlank
    private String userId;

    @NotNull
    private Instant scheduledFor;
}
