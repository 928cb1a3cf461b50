package com.example.engage.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementEvent implements Serializable {

    private String eventId;
    private EngagementEventType type;
    private String aggregateId;
    private String userId;
    private Instant occurredAt;
    private Map<String, Object> payload;
}
