package com.example.engage.service;

import com.example.engage.domain.DecisionContext;
import com.example.engage.domain.DeliveryOutcome;
import com.example.engage.domain.Engagement;
import com.example.engage.domain.EngagementDecision;
import com.example.engage.event.EngagementEventPublisher;
import com.example.engage.event.EngagementEventType;
import com.example.engage.service.exception.ValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class EngagementService {

    public static final String API_TRIGGER = "api_scheduled";
    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 1000;

    private final EngagementStore engagementStore;
    private final DeliveryCoordinator deliveryCoordinator;
    private final EngagementEventPublisher eventPublisher;

    /**
     * Schedules a message for {@code scheduledFor}. A time that is not in the future is pushed
     * right away when the user is connected.
     */
    public Engagement schedule(String userId, String chatId, String characterId, String message, Instant scheduledFor) {
        requireUser(userId);
        if (!StringUtils.hasText(message)) {
            throw new ValidationException("message must not be empty");
        }
        if (scheduledFor == null) {
            throw new ValidationException("scheduledFor is required");
        }
        Engagement draft = Engagement.builder()
                .userId(userId)
                .sessionId(chatId)
                .personalityId(characterId)
                .content(message)
                .trigger(API_TRIGGER)
                .confidence(1.0)
                .optimalTiming(scheduledFor)
                .build();
        return deliveryCoordinator.deliverOrSchedule(draft);
    }

    public Optional<DeliveryOutcome> submitDecision(EngagementDecision decision, DecisionContext context) {
        return deliveryCoordinator.processDecision(decision, context);
    }

    public List<Engagement> listPending(String userId) {
        requireUser(userId);
        return engagementStore.findPending(userId);
    }

    public Engagement cancel(String engagementId, String userId) {
        requireUser(userId);
        Engagement cancelled = engagementStore.cancel(engagementId, userId);
        eventPublisher.publishEngagement(EngagementEventType.ENGAGEMENT_CANCELLED, cancelled);
        return cancelled;
    }

    public Engagement reschedule(String engagementId, String userId, Instant scheduledFor) {
        requireUser(userId);
        if (scheduledFor == null) {
            throw new ValidationException("scheduledFor is required");
        }
        Engagement rescheduled = engagementStore.reschedule(engagementId, userId, scheduledFor);
        eventPublisher.publishEngagement(EngagementEventType.ENGAGEMENT_RESCHEDULED, rescheduled);
        return rescheduled;
    }

    public List<Engagement> history(String userId, Integer limit) {
        requireUser(userId);
        int resolved = limit != null ? limit : DEFAULT_HISTORY_LIMIT;
        if (resolved < 1 || resolved > MAX_HISTORY_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return engagementStore.findHistory(userId, resolved);
    }

    private void requireUser(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new ValidationException("userId is required");
        }
    }
}
