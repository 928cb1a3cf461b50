package com.example.engage.service;

import com.example.engage.config.EngageProperties;
import com.example.engage.domain.DecisionContext;
import com.example.engage.domain.DeliveryOutcome;
import com.example.engage.domain.Engagement;
import com.example.engage.domain.EngagementDecision;
import com.example.engage.domain.EngagementStatus;
import com.example.engage.domain.EngagementTiming;
import com.example.engage.dto.ProactiveMessagePayload;
import com.example.engage.event.EngagementEventPublisher;
import com.example.engage.event.EngagementEventType;
import com.example.engage.service.exception.PersistenceFailureException;
import com.example.engage.service.exception.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turns engagement decisions into pushes or pending rows, and drives each claimed row to
 * delivered, pending or failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryCoordinator {

    public static final String PROACTIVE_EVENT = "proactive_message";

    private final EngagementStore engagementStore;
    private final ConnectionRegistry connectionRegistry;
    private final EngagementEventPublisher eventPublisher;
    private final EngageProperties engageProperties;
    private final Clock clock;

    public enum ItemResult {
        DELIVERED,
        RELEASED,
        RETRY,
        FAILED,
        LOST
    }

    public Optional<DeliveryOutcome> processDecision(EngagementDecision decision, DecisionContext context) {
        if (decision == null || !decision.isShouldEngage() || !StringUtils.hasText(decision.getContent())) {
            return Optional.empty();
        }
        if (context == null || !StringUtils.hasText(context.getUserId())) {
            throw new ValidationException("userId is required");
        }
        Double confidence = decision.getConfidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new ValidationException("confidence must be within [0, 1]");
        }

        Instant now = clock.instant();
        EngagementTiming timing = decision.getTiming() != null ? decision.getTiming() : EngagementTiming.immediate();
        Engagement draft = Engagement.builder()
                .userId(context.getUserId())
                .sessionId(context.getSessionId())
                .personalityId(context.getPersonalityId())
                .content(decision.getContent())
                .trigger(decision.getTrigger())
                .confidence(confidence)
                .optimalTiming(timing.resolve(now))
                .build();

        if (timing instanceof EngagementTiming.DelayedBy) {
            return Optional.of(DeliveryOutcome.scheduled(schedule(draft)));
        }
        Engagement result = pushOrQueue(draft);
        return Optional.of(result.getStatus() == EngagementStatus.DELIVERED
                ? DeliveryOutcome.delivered(result)
                : DeliveryOutcome.scheduled(result));
    }

    /**
     * Pushes a draft that is already due, falling back to a pending row when the recipient
     * cannot take it now. Drafts timed in the future go straight to the scheduler.
     */
    public Engagement deliverOrSchedule(Engagement draft) {
        Instant optimalTiming = draft.getOptimalTiming();
        if (optimalTiming == null || optimalTiming.isAfter(clock.instant())) {
            return schedule(draft);
        }
        return pushOrQueue(draft);
    }

    /**
     * Persists a pending engagement for later delivery by the scheduler.
     */
    public Engagement schedule(Engagement draft) {
        Engagement created = engagementStore.create(draft);
        log.debug("Scheduled engagement {} for user {} at {}", created.getId(), created.getUserId(), created.getOptimalTiming());
        eventPublisher.publishEngagement(EngagementEventType.ENGAGEMENT_SCHEDULED, created);
        return created;
    }

    public ItemResult deliverDue(Engagement engagement) {
        String id = engagement.getId();
        if (!connectionRegistry.isConnected(engagement.getUserId())) {
            engagementStore.release(id, null);
            log.debug("User {} offline, engagement {} stays pending", engagement.getUserId(), id);
            return ItemResult.RELEASED;
        }

        SendResult result = connectionRegistry.send(
                engagement.getUserId(), PROACTIVE_EVENT, ProactiveMessagePayload.from(engagement));
        switch (result.status()) {
            case DELIVERED:
                if (!engagementStore.markDelivered(id)) {
                    log.warn("Engagement {} was pushed but its claim was lost before it could be marked delivered", id);
                    return ItemResult.LOST;
                }
                log.info("Delivered engagement {} to user {}", id, engagement.getUserId());
                eventPublisher.publishEngagement(
                        EngagementEventType.ENGAGEMENT_DELIVERED,
                        engagement.toBuilder().status(EngagementStatus.DELIVERED).build());
                return ItemResult.DELIVERED;
            case NOT_CONNECTED:
                engagementStore.release(id, null);
                return ItemResult.RELEASED;
            default:
                return handleSendFailure(engagement, result.reason());
        }
    }

    private ItemResult handleSendFailure(Engagement engagement, String reason) {
        String id = engagement.getId();
        int attempts = engagement.getAttempts() + 1;
        int maxAttempts = Math.max(engageProperties.getDelivery().getMaxAttempts(), 1);
        if (attempts >= maxAttempts) {
            if (!engagementStore.markFailed(id, reason)) {
                return ItemResult.LOST;
            }
            log.warn("Engagement {} failed after {} attempts: {}", id, attempts, reason);
            eventPublisher.publishEngagement(
                    EngagementEventType.ENGAGEMENT_FAILED,
                    engagement.toBuilder().status(EngagementStatus.FAILED).attempts(attempts).lastError(reason).build());
            return ItemResult.FAILED;
        }
        if (!engagementStore.release(id, reason)) {
            return ItemResult.LOST;
        }
        log.info("Engagement {} send failed (attempt {}/{}), retrying next tick: {}", id, attempts, maxAttempts, reason);
        eventPublisher.publishEngagement(
                EngagementEventType.ENGAGEMENT_RELEASED,
                engagement.toBuilder().status(EngagementStatus.PENDING).attempts(attempts).lastError(reason).build());
        return ItemResult.RETRY;
    }

    private Engagement pushOrQueue(Engagement draft) {
        Engagement withId = draft.toBuilder().id(UUID.randomUUID().toString()).build();
        SendResult result = connectionRegistry.send(
                withId.getUserId(), PROACTIVE_EVENT, ProactiveMessagePayload.from(withId));
        if (!result.isDelivered()) {
            log.debug("Immediate push to {} not possible ({}), queueing engagement", withId.getUserId(), result.reason());
            return schedule(withId);
        }

        try {
            Engagement recorded = engagementStore.recordDelivered(withId);
            eventPublisher.publishEngagement(EngagementEventType.ENGAGEMENT_DELIVERED, recorded);
            return recorded;
        } catch (PersistenceFailureException ex) {
            log.error("Engagement {} reached user {} but its audit record could not be stored",
                    withId.getId(), withId.getUserId(), ex);
            return withId.toBuilder().status(EngagementStatus.DELIVERED).deliveredAt(clock.instant()).build();
        }
    }
}
