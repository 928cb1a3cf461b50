package com.example.engage.dto;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PresenceResponse {
    String userId;
    boolean connected;
    Instant lastSeen;
}
