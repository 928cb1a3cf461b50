package com.example.engage.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SubmitCommitmentRequest {

    @NotBlank
    private String userId;

    @NotBlank
    private String submissionText;
}
