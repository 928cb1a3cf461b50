package com.example.engage.dto;

import com.example.engage.domain.EngagementStatus;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScheduleEngagementResponse {
    String engagementId;
    Instant scheduledFor;
    EngagementStatus status;
}
