package com.example.engage.controller;

import com.example.engage.domain.DecisionContext;
import com.example.engage.domain.DeliveryOutcome;
import com.example.engage.domain.Engagement;
import com.example.engage.domain.EngagementDecision;
import com.example.engage.domain.EngagementTiming;
import com.example.engage.dto.EngagementDecisionRequest;
import com.example.engage.dto.PresenceResponse;
import com.example.engage.dto.RescheduleRequest;
import com.example.engage.dto.ScheduleEngagementRequest;
import com.example.engage.dto.ScheduleEngagementResponse;
import com.example.engage.service.ConnectionRegistry;
import com.example.engage.service.EngagementService;
import com.example.engage.service.PresenceService;
import com.example.engage.service.exception.ValidationException;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/proactive")
public class EngagementController {

    private static final String NO_ENGAGEMENT_TIMING = "none";

    private final EngagementService engagementService;
    private final ConnectionRegistry connectionRegistry;
    private final PresenceService presenceService;

    public EngagementController(
            EngagementService engagementService,
            ConnectionRegistry connectionRegistry,
            PresenceService presenceService) {
        this.engagementService = engagementService;
        this.connectionRegistry = connectionRegistry;
        this.presenceService = presenceService;
    }

    @PostMapping("/schedule")
    public ResponseEntity<ScheduleEngagementResponse> schedule(@Valid @RequestBody ScheduleEngagementRequest request) {
        Engagement engagement = engagementService.schedule(
                request.getUserId(),
                request.getChatId(),
                request.getCharacterId(),
                request.getMessage(),
                request.getScheduledFor());
        return ResponseEntity.ok(ScheduleEngagementResponse.builder()
                .engagementId(engagement.getId())
                .scheduledFor(engagement.getOptimalTiming())
                .status(engagement.getStatus())
                .build());
    }

    @PostMapping("/decisions")
    public ResponseEntity<DeliveryOutcome> submitDecision(@Valid @RequestBody EngagementDecisionRequest request) {
        if (NO_ENGAGEMENT_TIMING.equalsIgnoreCase(request.getTiming()) && request.getDelaySeconds() == null) {
            return ResponseEntity.noContent().build();
        }
        EngagementDecision decision = EngagementDecision.builder()
                .shouldEngage(request.isShouldEngage())
                .timing(resolveTiming(request))
                .content(request.getContent())
                .confidence(request.getConfidence())
                .trigger(request.getTrigger())
                .build();
        DecisionContext context = DecisionContext.builder()
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .personalityId(request.getPersonalityId())
                .build();
        Optional<DeliveryOutcome> outcome = engagementService.submitDecision(decision, context);
        return outcome.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/pending")
    public ResponseEntity<List<Engagement>> pending(@RequestParam String userId) {
        return ResponseEntity.ok(engagementService.listPending(userId));
    }

    @DeleteMapping("/{engagementId}")
    public ResponseEntity<Engagement> cancel(@PathVariable String engagementId, @RequestParam String userId) {
        return ResponseEntity.ok(engagementService.cancel(engagementId, userId));
    }

    @PatchMapping("/{engagementId}")
    public ResponseEntity<Engagement> reschedule(
            @PathVariable String engagementId, @Valid @RequestBody RescheduleRequest request) {
        return ResponseEntity.ok(
                engagementService.reschedule(engagementId, request.getUserId(), request.getScheduledFor()));
    }

    @GetMapping("/history")
    public ResponseEntity<List<Engagement>> history(
            @RequestParam String userId, @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(engagementService.history(userId, limit));
    }

    @GetMapping("/presence")
    public ResponseEntity<PresenceResponse> presence(@RequestParam String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new ValidationException("userId is required");
        }
        return ResponseEntity.ok(PresenceResponse.builder()
                .userId(userId)
                .connected(connectionRegistry.isConnected(userId))
                .lastSeen(presenceService.lastSeen(userId).orElse(null))
                .build());
    }

    private EngagementTiming resolveTiming(EngagementDecisionRequest request) {
        if (request.getDelaySeconds() != null) {
            return EngagementTiming.delayedBy(request.getDelaySeconds());
        }
        if (!StringUtils.hasText(request.getTiming())) {
            return EngagementTiming.immediate();
        }
        return EngagementTiming.fromOracleValue(request.getTiming())
                .orElseThrow(() -> new ValidationException("Unsupported timing: " + request.getTiming()));
    }
}
