package com.example.engage.event;

import com.example.engage.config.EngageProperties;
import com.example.engage.domain.Commitment;
import com.example.engage.domain.Engagement;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes engagement and commitment lifecycle events. Publishing is best effort: a broker
 * failure is logged and never fails the state change that produced the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngagementEventPublisher {

    private final KafkaTemplate<String, EngagementEvent> engagementEventKafkaTemplate;
    private final EngageProperties engageProperties;

    public void publishEngagement(EngagementEventType type, Engagement engagement) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", engagement.getStatus() != null ? engagement.getStatus().value() : null);
        payload.put("trigger", engagement.getTrigger());
        payload.put("optimalTiming", engagement.getOptimalTiming() != null ? engagement.getOptimalTiming().toString() : null);
        payload.put("attempts", engagement.getAttempts());
        if (engagement.getLastError() != null) {
            payload.put("lastError", engagement.getLastError());
        }
        publish(type, engagement.getId(), engagement.getUserId(), payload);
    }

    public void publishCommitment(EngagementEventType type, Commitment commitment) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", commitment.getStatus() != null ? commitment.getStatus().value() : null);
        payload.put("chatId", commitment.getChatId());
        payload.put("revisionCount", commitment.getRevisionCount());
        publish(type, commitment.getId(), commitment.getUserId(), payload);
    }

    public void publish(EngagementEventType type, String aggregateId, String userId, Map<String, Object> payload) {
        EngagementEvent event = EngagementEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .aggregateId(aggregateId)
                .userId(userId)
                .occurredAt(Instant.now())
                .payload(payload)
                .build();
        try {
            engagementEventKafkaTemplate
                    .send(engageProperties.getKafka().getLifecycleTopic(), aggregateId, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} for {}", type, aggregateId, ex);
                        }
                    });
        } catch (Exception ex) {
            log.warn("Failed to publish {} for {}", type, aggregateId, ex);
        }
    }
}
