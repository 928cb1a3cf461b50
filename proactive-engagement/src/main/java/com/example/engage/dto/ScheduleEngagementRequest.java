package com.example.engage.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import lombok.Data;

@Data
public class ScheduleEngagementRequest {

    @NotBlank
    private String userId;

    @NotBlank
    private String chatId;

    @NotBlank
    private String characterId;

    @NotBlank
    private String message;

    @NotNull
    private Instant scheduledFor;
}
