package com.example.engage.service;

import com.example.engage.config.EngageProperties;
import com.example.engage.domain.Commitment;
import com.example.engage.domain.CommitmentStatus;
import com.example.engage.domain.Engagement;
import com.example.engage.domain.VerificationOutcome;
import com.example.engage.event.EngagementEventPublisher;
import com.example.engage.event.EngagementEventType;
import com.example.engage.service.exception.ConflictException;
import com.example.engage.service.exception.NotFoundException;
import com.example.engage.service.exception.OwnershipException;
import com.example.engage.service.exception.ValidationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class CommitmentService {

    public static final String REMINDER_TRIGGER_PREFIX = "commitment_reminder:";
    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 1000;

    private static final Set<CommitmentStatus> ACTIVE_STATUSES =
            EnumSet.of(CommitmentStatus.ACTIVE, CommitmentStatus.SUBMITTED, CommitmentStatus.NEEDS_REVISION);

    private final CommitmentStore commitmentStore;
    private final EngagementStore engagementStore;
    private final DeliveryCoordinator deliveryCoordinator;
    private final EngagementEventPublisher eventPublisher;
    private final EngageProperties engageProperties;
    private final Clock clock;

    public Commitment create(
            String userId, String chatId, String characterId, String description, String type, Instant dueAt) {
        requireUser(userId);
        if (!StringUtils.hasText(description)) {
            throw new ValidationException("description must not be empty");
        }
        Instant now = clock.instant();
        Commitment commitment = commitmentStore.save(Commitment.builder()
                .userId(userId)
                .chatId(chatId)
                .characterId(characterId)
                .description(description)
                .type(StringUtils.hasText(type) ? type : "general")
                .dueAt(dueAt)
                .status(CommitmentStatus.ACTIVE)
                .revisionCount(0)
                .assignedAt(now)
                .build());
        log.info("Commitment {} assigned to user {}", commitment.getId(), userId);
        eventPublisher.publishCommitment(EngagementEventType.COMMITMENT_CREATED, commitment);
        return attachReminder(commitment);
    }

    public Commitment findById(String commitmentId, String userId) {
        requireUser(userId);
        return requireOwned(commitmentId, userId);
    }

    public List<Commitment> findActive(String userId, String chatId) {
        requireUser(userId);
        return commitmentStore.findByUser(userId, chatId, ACTIVE_STATUSES);
    }

    public List<Commitment> findHistory(String userId, String chatId, Integer limit) {
        requireUser(userId);
        int resolved = limit != null ? limit : DEFAULT_HISTORY_LIMIT;
        if (resolved < 1 || resolved > MAX_HISTORY_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return commitmentStore.findHistory(userId, chatId, resolved);
    }

    /**
     * Records a submission. Allowed from {@code active} and {@code needs_revision}; earlier
     * submission content is replaced.
     */
    public Commitment submit(String commitmentId, String userId, String content) {
        requireUser(userId);
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("submission must not be empty");
        }
        Commitment commitment = requireOwned(commitmentId, userId);
        if (!commitment.getStatus().acceptsSubmission()) {
            throw new ConflictException(
                    "Commitment " + commitmentId + " does not accept submissions while " + commitment.getStatus().value());
        }
        if (commitment.getSubmissionContent() != null) {
            log.debug("Commitment {} resubmitted, replacing previous submission", commitmentId);
        }
        commitment.setStatus(CommitmentStatus.SUBMITTED);
        commitment.setSubmissionContent(content);
        commitment.setSubmittedAt(clock.instant());
        Commitment saved = commitmentStore.save(commitment);
        eventPublisher.publishCommitment(EngagementEventType.COMMITMENT_SUBMITTED, saved);
        return saved;
    }

    public Commitment verify(String commitmentId, String userId, VerificationOutcome outcome, String reasoning) {
        requireUser(userId);
        if (outcome == null) {
            throw new ValidationException("decision is required");
        }
        Commitment commitment = requireOwned(commitmentId, userId);
        CommitmentStatus next = outcome.resultingStatus();
        requireTransition(commitment, next);

        commitment.setStatus(next);
        commitment.setVerificationDecision(outcome);
        commitment.setVerificationReasoning(reasoning);
        commitment.setVerifiedAt(clock.instant());
        if (outcome == VerificationOutcome.NEEDS_REVISION) {
            commitment.setRevisionCount(commitment.getRevisionCount() + 1);
        }
        if (next.isTerminal()) {
            cancelReminder(commitment);
        }
        Commitment saved = commitmentStore.save(commitment);
        log.info("Commitment {} verified as {}", commitmentId, outcome.value());
        eventPublisher.publishCommitment(EngagementEventType.COMMITMENT_VERIFIED, saved);
        return saved;
    }

    public Commitment updateDueAt(String commitmentId, String userId, Instant dueAt) {
        requireUser(userId);
        Commitment commitment = requireOwned(commitmentId, userId);
        if (commitment.getStatus().isTerminal()) {
            throw new ConflictException("Commitment " + commitmentId + " is " + commitment.getStatus().value());
        }
        cancelReminder(commitment);
        commitment.setDueAt(dueAt);
        return attachReminder(commitmentStore.save(commitment));
    }

    public Commitment cancel(String commitmentId, String userId) {
        requireUser(userId);
        Commitment commitment = requireOwned(commitmentId, userId);
        requireTransition(commitment, CommitmentStatus.CANCELLED);
        commitment.setStatus(CommitmentStatus.CANCELLED);
        cancelReminder(commitment);
        Commitment saved = commitmentStore.save(commitment);
        eventPublisher.publishCommitment(EngagementEventType.COMMITMENT_CANCELLED, saved);
        return saved;
    }

    private Commitment attachReminder(Commitment commitment) {
        if (commitment.getDueAt() == null) {
            return commitment;
        }
        Duration lead = engageProperties.getCommitment().getReminderLead();
        Instant remindAt = commitment.getDueAt().minus(lead != null ? lead : Duration.ZERO);
        if (!remindAt.isAfter(clock.instant())) {
            log.debug("Commitment {} is due too soon for a reminder", commitment.getId());
            return commitment;
        }
        Engagement reminder = deliveryCoordinator.schedule(Engagement.builder()
                .userId(commitment.getUserId())
                .sessionId(commitment.getChatId())
                .personalityId(commitment.getCharacterId())
                .content(reminderContent(commitment))
                .trigger(REMINDER_TRIGGER_PREFIX + commitment.getId())
                .confidence(1.0)
                .optimalTiming(remindAt)
                .build());
        commitment.setReminderEngagementId(reminder.getId());
        return commitmentStore.save(commitment);
    }

    private void cancelReminder(Commitment commitment) {
        String reminderId = commitment.getReminderEngagementId();
        if (reminderId == null) {
            return;
        }
        try {
            engagementStore.cancel(reminderId, commitment.getUserId());
            log.debug("Cancelled reminder {} of commitment {}", reminderId, commitment.getId());
        } catch (ConflictException | NotFoundException ex) {
            log.debug("Reminder {} of commitment {} no longer pending: {}", reminderId, commitment.getId(), ex.getMessage());
        }
        commitment.setReminderEngagementId(null);
    }

    static String reminderContent(Commitment commitment) {
        return "Just checking in about your commitment: \"" + commitment.getDescription() + "\". How is it going?";
    }

    private Commitment requireOwned(String commitmentId, String userId) {
        Commitment commitment = commitmentStore.findById(commitmentId)
                .orElseThrow(() -> new NotFoundException("Commitment not found: " + commitmentId));
        if (!commitment.getUserId().equals(userId)) {
            throw new OwnershipException("Commitment not found: " + commitmentId);
        }
        return commitment;
    }

    private void requireTransition(Commitment commitment, CommitmentStatus next) {
        if (!commitment.getStatus().canTransitionTo(next)) {
            throw new ConflictException("Commitment " + commitment.getId() + " cannot move from "
                    + commitment.getStatus().value() + " to " + next.value());
        }
    }

    private void requireUser(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new ValidationException("userId is required");
        }
    }
}
