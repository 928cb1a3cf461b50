package com.example.engage.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Output of the decision oracle for one conversational moment.
 */
@Value
@Builder
public class EngagementDecision {
    boolean shouldEngage;
    EngagementTiming timing;
    String content;
    Double confidence;
    String trigger;
}
