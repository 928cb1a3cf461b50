package com.example.engage.dto;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import lombok.Data;

@Data
public class UpdateDueDateRequest {

    @NotBlank
    private String userId;

    private Instant dueAt;
}
