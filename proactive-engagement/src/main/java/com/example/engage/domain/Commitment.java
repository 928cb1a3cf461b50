package com.example.engage.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Commitment implements Serializable {

    private String id;
    private String userId;
    private String chatId;
    private String characterId;
    private String description;
    private String type;
    private Instant dueAt;
    private CommitmentStatus status;
    private String submissionContent;
    private VerificationOutcome verificationDecision;
    private String verificationReasoning;
    private int revisionCount;
    private String reminderEngagementId;
    private Instant assignedAt;
    private Instant submittedAt;
    private Instant verifiedAt;
    private Instant updatedAt;
    private Long version;
}
