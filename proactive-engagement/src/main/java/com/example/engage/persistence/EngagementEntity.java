package com.example.engage.persistence;

import com.example.engage.domain.EngagementStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "proactive_engagements",
        indexes = {
            @Index(name = "idx_engagements_status_timing", columnList = "status, optimal_timing"),
            @Index(name = "idx_engagements_user_created", columnList = "user_id, created_at")
        })
public class EngagementEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "session_id", length = 128)
    private String sessionId;

    @Column(name = "personality_id", length = 128)
    private String personalityId;

    @Column(name = "engagement_content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "trigger_context", length = 512)
    private String trigger;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "optimal_timing", nullable = false)
    private Instant optimalTiming;

    @Convert(converter = EngagementStatusConverter.class)
    @Column(name = "status", nullable = false, length = 32)
    private EngagementStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 1024)
    private String lastError;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
