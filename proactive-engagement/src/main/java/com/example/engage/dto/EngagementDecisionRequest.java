package com.example.engage.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class EngagementDecisionRequest {

    @NotBlank
    private String userId;

    private String sessionId;

    private String personalityId;

    private boolean shouldEngage;

    /**
     * Oracle timing value, e.g. {@code immediate} or {@code wait_2_minutes}.
     */
    private String timing;

    /**
     * Explicit delay; takes precedence over {@link #timing}.
     */
    @PositiveOrZero
    private Long delaySeconds;

    private String content;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    private String trigger;
}
