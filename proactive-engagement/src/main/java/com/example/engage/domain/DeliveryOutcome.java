package com.example.engage.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeliveryOutcome {

    public enum Kind {
        DELIVERED,
        SCHEDULED
    }

    Kind kind;
    String engagementId;
    Instant optimalTiming;

    public static DeliveryOutcome delivered(Engagement engagement) {
        return new DeliveryOutcome(Kind.DELIVERED, engagement.getId(), engagement.getOptimalTiming());
    }

    public static DeliveryOutcome scheduled(Engagement engagement) {
        return new DeliveryOutcome(Kind.SCHEDULED, engagement.getId(), engagement.getOptimalTiming());
    }
}
