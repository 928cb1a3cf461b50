package com.example.engage.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.engage.config.EngageProperties;
import com.example.engage.domain.Engagement;
import com.example.engage.domain.EngagementStatus;
import com.example.engage.dto.ProactiveMessagePayload;
import com.example.engage.event.EngagementEventPublisher;
import com.example.engage.service.DeliveryCoordinator;
import com.example.engage.service.EngagementScheduler;
import com.example.engage.service.EngagementScheduler.TickReport;
import com.example.engage.service.InMemoryConnectionRegistry;
import com.example.engage.service.RecordingConnectionHandle;
import com.example.engage.service.exception.ConflictException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Scheduler, coordinator, registry and the JPA store working together against H2.
 */
@DataJpaTest
@Import({JpaEngagementStore.class, EngagementEntityMapper.class, StoreTestConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class EngagementDeliveryFlowTest {

    @Autowired
    private JpaEngagementStore store;

    @Autowired
    private EngagementJpaRepository repository;

    @Autowired
    private ShiftableClock storeClock;

    private EngageProperties properties;
    private InMemoryConnectionRegistry registry;
    private EngagementEventPublisher publisher;

    @BeforeEach
    void setUp() {
        properties = new EngageProperties();
        properties.getScheduler().setEnabled(false);
        properties.getDelivery().setMaxAttempts(3);
        properties.getDelivery().setSendTimeout(Duration.ofMillis(500));
        registry = new InMemoryConnectionRegistry(properties);
        publisher = Mockito.mock(EngagementEventPublisher.class);
    }

    @AfterEach
    void cleanUp() {
        storeClock.reset();
        repository.deleteAll();
    }

    @Test
    void offlineRecipientReceivesMessageOnceAfterReconnecting() {
        Engagement engagement = store.create(draft("u1", Instant.now().minusSeconds(1)));
        EngagementScheduler scheduler = schedulerAt(Clock.systemUTC());

        TickReport offline = scheduler.runOnce();
        assertThat(offline.released()).isEqualTo(1);
        Engagement stillPending = store.findById(engagement.getId()).orElseThrow();
        assertThat(stillPending.getStatus()).isEqualTo(EngagementStatus.PENDING);
        assertThat(stillPending.getAttempts()).isZero();

        RecordingConnectionHandle handle = new RecordingConnectionHandle();
        registry.register("u1", handle);

        TickReport online = scheduler.runOnce();
        assertThat(online.delivered()).isEqualTo(1);
        assertThat(store.findById(engagement.getId()).orElseThrow().getStatus()).isEqualTo(EngagementStatus.DELIVERED);

        scheduler.runOnce();
        assertThat(handle.payloads()).hasSize(1);
        ProactiveMessagePayload payload = (ProactiveMessagePayload) handle.payloads().get(0);
        assertThat(payload.getEngagementId()).isEqualTo(engagement.getId());
        assertThat(payload.getContent()).isEqualTo("Did the interview go well?");
    }

    @Test
    void repeatedSendFailuresEndInFailed() {
        Engagement engagement = store.create(draft("u1", Instant.now().minusSeconds(1)));
        RecordingConnectionHandle handle = new RecordingConnectionHandle();
        handle.setMode(RecordingConnectionHandle.Mode.FAIL);
        registry.register("u1", handle);
        EngagementScheduler scheduler = schedulerAt(Clock.systemUTC());

        assertThat(scheduler.runOnce().retried()).isEqualTo(1);
        assertThat(scheduler.runOnce().retried()).isEqualTo(1);
        assertThat(scheduler.runOnce().failed()).isEqualTo(1);
        assertThat(scheduler.runOnce().claimed()).isZero();

        Engagement failed = store.findById(engagement.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(EngagementStatus.FAILED);
        assertThat(failed.getAttempts()).isEqualTo(3);
        assertThat(failed.getLastError()).contains("socket write failed");
        assertThat(handle.attempts()).isEqualTo(3);
    }

    @Test
    void cancelLosesToAnEarlierClaim() {
        Engagement engagement = store.create(draft("u1", Instant.now().minusSeconds(1)));

        assertThat(store.claimDue(Instant.now(), 10)).hasSize(1);

        assertThatThrownBy(() -> store.cancel(engagement.getId(), "u1")).isInstanceOf(ConflictException.class);
        assertThat(store.findById(engagement.getId()).orElseThrow().getStatus()).isEqualTo(EngagementStatus.PROCESSING);
    }

    @Test
    void claimsAbandonedByACrashedProcessAreRecovered() {
        Engagement engagement = store.create(draft("u1", Instant.now().minusSeconds(1)));
        assertThat(store.claimDue(Instant.now(), 10)).hasSize(1);
        registry.register("u1", new RecordingConnectionHandle());

        EngagementScheduler later = schedulerAt(Clock.offset(Clock.systemUTC(), Duration.ofMinutes(10)));
        TickReport report = later.runOnce();

        assertThat(report.staleReleased()).isEqualTo(1);
        assertThat(report.delivered()).isEqualTo(1);
        assertThat(store.findById(engagement.getId()).orElseThrow().getStatus()).isEqualTo(EngagementStatus.DELIVERED);
    }

    @Test
    void recipientsGoneTooLongAreExpired() {
        storeClock.shift(Duration.ofDays(-8));
        Engagement engagement = store.create(draft("u1", storeClock.instant()));
        storeClock.reset();

        TickReport report = schedulerAt(Clock.systemUTC()).runOnce();

        assertThat(report.released()).isEqualTo(1);
        assertThat(report.expired()).isEqualTo(1);
        Engagement expired = store.findById(engagement.getId()).orElseThrow();
        assertThat(expired.getStatus()).isEqualTo(EngagementStatus.FAILED);
        assertThat(expired.getLastError()).isEqualTo("expired");
        assertThat(expired.getAttempts()).isZero();
    }

    @Test
    void longWaitingRowIsDeliveredWhenRecipientIsBack() {
        storeClock.shift(Duration.ofDays(-8));
        Engagement engagement = store.create(draft("u1", storeClock.instant()));
        storeClock.reset();
        RecordingConnectionHandle handle = new RecordingConnectionHandle();
        registry.register("u1", handle);

        TickReport report = schedulerAt(Clock.systemUTC()).runOnce();

        assertThat(report.delivered()).isEqualTo(1);
        assertThat(report.expired()).isZero();
        assertThat(store.findById(engagement.getId()).orElseThrow().getStatus()).isEqualTo(EngagementStatus.DELIVERED);
        assertThat(handle.payloads()).hasSize(1);
    }

    @Test
    void freshRowWithOldTimingIsDeliveredToConnectedRecipient() {
        Engagement engagement = store.create(draft("u1", Instant.now().minus(Duration.ofDays(8))));
        RecordingConnectionHandle handle = new RecordingConnectionHandle();
        registry.register("u1", handle);

        TickReport report = schedulerAt(Clock.systemUTC()).runOnce();

        assertThat(report.delivered()).isEqualTo(1);
        assertThat(report.expired()).isZero();
        Engagement delivered = store.findById(engagement.getId()).orElseThrow();
        assertThat(delivered.getStatus()).isEqualTo(EngagementStatus.DELIVERED);
        assertThat(handle.payloads()).hasSize(1);
    }

    @Test
    void freshRowWithOldTimingWaitsForOfflineRecipient() {
        Engagement engagement = store.create(draft("u1", Instant.now().minus(Duration.ofDays(8))));

        TickReport report = schedulerAt(Clock.systemUTC()).runOnce();

        assertThat(report.released()).isEqualTo(1);
        assertThat(report.expired()).isZero();
        assertThat(store.findById(engagement.getId()).orElseThrow().getStatus()).isEqualTo(EngagementStatus.PENDING);
    }

    private EngagementScheduler schedulerAt(Clock clock) {
        DeliveryCoordinator coordinator = new DeliveryCoordinator(store, registry, publisher, properties, clock);
        return new EngagementScheduler(store, coordinator, properties, clock);
    }

    private Engagement draft(String userId, Instant optimalTiming) {
        return Engagement.builder()
                .userId(userId)
                .sessionId("session-1")
                .personalityId("persona-1")
                .content("Did the interview go well?")
                .trigger("conversation_pause")
                .confidence(0.9)
                .optimalTiming(optimalTiming)
                .build();
    }
}
