package com.example.engage.dto;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import lombok.Data;

@Data
public class CreateCommitmentRequest {

    @NotBlank
    private String userId;

    @NotBlank
    private String chatId;

    private String characterId;

    @NotBlank
    private String description;

    private String type;

    private Instant dueAt;
}
