package com.example.engage.persistence;

import com.example.engage.domain.CommitmentStatus;
import com.example.engage.domain.VerificationOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "commitments", indexes = @Index(name = "idx_commitments_user_chat", columnList = "user_id, chat_id"))
public class CommitmentEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "chat_id", length = 128)
    private String chatId;

    @Column(name = "character_id", length = 128)
    private String characterId;

    @Column(name = "description", nullable = false, columnDefinition = "text")
    private String description;

    @Column(name = "commitment_type", length = 64)
    private String type;

    @Column(name = "due_at")
    private Instant dueAt;

    @Convert(converter = CommitmentStatusConverter.class)
    @Column(name = "status", nullable = false, length = 32)
    private CommitmentStatus status;

    @Column(name = "submission_content", columnDefinition = "text")
    private String submissionContent;

    @Convert(converter = VerificationOutcomeConverter.class)
    @Column(name = "verification_decision", length = 32)
    private VerificationOutcome verificationDecision;

    @Column(name = "verification_reasoning", columnDefinition = "text")
    private String verificationReasoning;

    @Column(name = "revision_count", nullable = false)
    private int revisionCount;

    @Column(name = "reminder_engagement_id", length = 64)
    private String reminderEngagementId;

    @Column(name = "assigned_at", nullable = false)
    private Instant assignedAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
