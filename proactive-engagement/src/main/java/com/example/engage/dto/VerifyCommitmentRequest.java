package com.example.engage.dto;

import com.example.engage.domain.VerificationOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class VerifyCommitmentRequest {

    @NotBlank
    private String userId;

    @NotNull
    private VerificationOutcome decision;

    private String reasoning;
}
