package com.example.engage.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DecisionContext {
    String userId;
    String sessionId;
    String personalityId;
}
