package com.example.engage.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Engagement implements Serializable {

    private String id;
    private String userId;
    private String sessionId;
    private String personalityId;
    private String content;
    private String trigger;
    private Double confidence;
    private Instant optimalTiming;
    private EngagementStatus status;
    private int attempts;
    private String lastError;
    private Instant claimedAt;
    private Instant deliveredAt;
    private Instant createdAt;
    private Instant updatedAt;
}
