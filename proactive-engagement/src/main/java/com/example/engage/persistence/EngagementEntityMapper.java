package com.example.engage.persistence;

import com.example.engage.domain.Engagement;
import com.example.engage.domain.EngagementStatus;
import org.springframework.stereotype.Component;

@Component
public class EngagementEntityMapper {

    public EngagementEntity toEntity(Engagement engagement) {
        EngagementEntity entity = new EngagementEntity();
        entity.setId(engagement.getId());
        entity.setUserId(engagement.getUserId());
        entity.setSessionId(engagement.getSessionId());
        entity.setPersonalityId(engagement.getPersonalityId());
        entity.setContent(engagement.getContent());
        entity.setTrigger(engagement.getTrigger());
        entity.setConfidence(engagement.getConfidence());
        entity.setOptimalTiming(engagement.getOptimalTiming());
        entity.setStatus(engagement.getStatus());
        entity.setAttempts(engagement.getAttempts());
        entity.setLastError(engagement.getLastError());
        entity.setClaimedAt(engagement.getClaimedAt());
        entity.setDeliveredAt(engagement.getDeliveredAt());
        entity.setCreatedAt(engagement.getCreatedAt());
        entity.setUpdatedAt(engagement.getUpdatedAt());
        return entity;
    }

    public Engagement toDomain(EngagementEntity entity) {
        if (entity == null) {
            return null;
        }
        return Engagement.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .sessionId(entity.getSessionId())
                .personalityId(entity.getPersonalityId())
                .content(entity.getContent())
                .trigger(entity.getTrigger())
                .confidence(entity.getConfidence())
                .optimalTiming(entity.getOptimalTiming())
                .status(entity.getStatus() != null ? entity.getStatus() : EngagementStatus.PENDING)
                .attempts(entity.getAttempts())
                .lastError(entity.getLastError())
                .claimedAt(entity.getClaimedAt())
                .deliveredAt(entity.getDeliveredAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
