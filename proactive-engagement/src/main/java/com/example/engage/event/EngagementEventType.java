package com.example.engage.event;

public enum EngagementEventType {
    ENGAGEMENT_SCHEDULED,
    ENGAGEMENT_DELIVERED,
    ENGAGEMENT_RELEASED,
    ENGAGEMENT_FAILED,
    ENGAGEMENT_CANCELLED,
    ENGAGEMENT_RESCHEDULED,
    COMMITMENT_CREATED,
    COMMITMENT_SUBMITTED,
    COMMITMENT_VERIFIED,
    COMMITMENT_CANCELLED
}
