package com.example.engage.persistence;

import com.example.engage.domain.Commitment;
import com.example.engage.domain.CommitmentStatus;
import org.springframework.stereotype.Component;

@Component
public class CommitmentEntityMapper {

    public CommitmentEntity toEntity(Commitment commitment) {
        CommitmentEntity entity = new CommitmentEntity();
        entity.setId(commitment.getId());
        entity.setUserId(commitment.getUserId());
        entity.setChatId(commitment.getChatId());
        entity.setCharacterId(commitment.getCharacterId());
        entity.setDescription(commitment.getDescription());
        entity.setType(commitment.getType());
        entity.setDueAt(commitment.getDueAt());
        entity.setStatus(commitment.getStatus());
        entity.setSubmissionContent(commitment.getSubmissionContent());
        entity.setVerificationDecision(commitment.getVerificationDecision());
        entity.setVerificationReasoning(commitment.getVerificationReasoning());
        entity.setRevisionCount(commitment.getRevisionCount());
        entity.setReminderEngagementId(commitment.getReminderEngagementId());
        entity.setAssignedAt(commitment.getAssignedAt());
        entity.setSubmittedAt(commitment.getSubmittedAt());
        entity.setVerifiedAt(commitment.getVerifiedAt());
        entity.setUpdatedAt(commitment.getUpdatedAt());
        entity.setVersion(commitment.getVersion());
        return entity;
    }

    public Commitment toDomain(CommitmentEntity entity) {
        if (entity == null) {
            return null;
        }
        return Commitment.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .chatId(entity.getChatId())
                .characterId(entity.getCharacterId())
                .description(entity.getDescription())
                .type(entity.getType())
                .dueAt(entity.getDueAt())
                .status(entity.getStatus() != null ? entity.getStatus() : CommitmentStatus.ACTIVE)
                .submissionContent(entity.getSubmissionContent())
                .verificationDecision(entity.getVerificationDecision())
                .verificationReasoning(entity.getVerificationReasoning())
                .revisionCount(entity.getRevisionCount())
                .reminderEngagementId(entity.getReminderEngagementId())
                .assignedAt(entity.getAssignedAt())
                .submittedAt(entity.getSubmittedAt())
                .verifiedAt(entity.getVerifiedAt())
                .updatedAt(entity.getUpdatedAt())
                .version(entity.getVersion())
                .build();
    }
}
