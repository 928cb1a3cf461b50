package com.example.engage.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.engage.config.EngageProperties;
import com.example.engage.domain.Commitment;
import com.example.engage.domain.CommitmentStatus;
import com.example.engage.domain.Engagement;
import com.example.engage.domain.EngagementStatus;
import com.example.engage.domain.VerificationOutcome;
import com.example.engage.event.EngagementEventPublisher;
import com.example.engage.service.exception.ConflictException;
import com.example.engage.service.exception.NotFoundException;
import com.example.engage.service.exception.OwnershipException;
import com.example.engage.service.exception.ValidationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CommitmentServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private EngagementStore engagementStore;

    @Mock
    private DeliveryCoordinator deliveryCoordinator;

    @Mock
    private EngagementEventPublisher eventPublisher;

    private InMemoryCommitmentStore commitmentStore;
    private CommitmentService service;

    @BeforeEach
    void setUp() {
        commitmentStore = new InMemoryCommitmentStore();
        EngageProperties properties = new EngageProperties();
        properties.getCommitment().setReminderLead(Duration.ofHours(1));
        service = new CommitmentService(
                commitmentStore,
                engagementStore,
                deliveryCoordinator,
                eventPublisher,
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void revisionCycleCountsExactlyOnce() {
        Commitment commitment = service.create("u1", "c1", "ch1", "Write 500 words", "writing", null);

        service.submit(commitment.getId(), "u1", "draft one");
        Commitment revised = service.verify(commitment.getId(), "u1", VerificationOutcome.NEEDS_REVISION, "too short");
        assertThat(revised.getStatus()).isEqualTo(CommitmentStatus.NEEDS_REVISION);
        assertThat(revised.getRevisionCount()).isEqualTo(1);

        Commitment resubmitted = service.submit(commitment.getId(), "u1", "draft two");
        assertThat(resubmitted.getSubmissionContent()).isEqualTo("draft two");
        assertThat(resubmitted.getRevisionCount()).isEqualTo(1);

        Commitment completed = service.verify(commitment.getId(), "u1", VerificationOutcome.APPROVED, "great");
        assertThat(completed.getStatus()).isEqualTo(CommitmentStatus.COMPLETED);
        assertThat(completed.getRevisionCount()).isEqualTo(1);
        assertThat(completed.getVerificationDecision()).isEqualTo(VerificationOutcome.APPROVED);
        assertThat(completed.getVerifiedAt()).isEqualTo(NOW);
    }

    @Test
    void rejectedCommitmentCannotBeResubmitted() {
        Commitment commitment = service.create("u1", "c1", null, "Run 5k", null, null);
        service.submit(commitment.getId(), "u1", "did it");
        service.verify(commitment.getId(), "u1", VerificationOutcome.REJECTED, "no evidence");

        assertThatThrownBy(() -> service.submit(commitment.getId(), "u1", "really did it"))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("does not accept submissions while rejected");
    }

    @Test
    void notVerifiableClosesOnHonorSystem() {
        Commitment commitment = service.create("u1", "c1", null, "Meditate", null, null);
        service.submit(commitment.getId(), "u1", "done");

        Commitment closed = service.verify(commitment.getId(), "u1", VerificationOutcome.NOT_VERIFIABLE, null);

        assertThat(closed.getStatus()).isEqualTo(CommitmentStatus.NOT_VERIFIABLE);
        assertThat(closed.getStatus().isTerminal()).isTrue();
    }

    @Test
    void verifyingAnActiveCommitmentIsAConflict() {
        Commitment commitment = service.create("u1", "c1", null, "Read", null, null);

        assertThatThrownBy(() -> service.verify(commitment.getId(), "u1", VerificationOutcome.APPROVED, null))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void dueDateInFutureSchedulesReminderOneHourBefore() {
        Instant dueAt = NOW.plus(Duration.ofHours(5));
        when(deliveryCoordinator.schedule(any())).thenAnswer(invocation -> {
            Engagement draft = invocation.getArgument(0);
            return draft.toBuilder().id("rem-1").status(EngagementStatus.PENDING).build();
        });

        Commitment commitment = service.create("u1", "c1", "ch1", "Finish chapter", null, dueAt);

        ArgumentCaptor<Engagement> reminder = ArgumentCaptor.forClass(Engagement.class);
        verify(deliveryCoordinator).schedule(reminder.capture());
        assertThat(reminder.getValue().getOptimalTiming()).isEqualTo(dueAt.minus(Duration.ofHours(1)));
        assertThat(reminder.getValue().getTrigger()).isEqualTo("commitment_reminder:" + commitment.getId());
        assertThat(reminder.getValue().getContent())
                .isEqualTo("Just checking in about your commitment: \"Finish chapter\". How is it going?");
        assertThat(commitment.getReminderEngagementId()).isEqualTo("rem-1");
    }

    @Test
    void dueDateInsideLeadWindowSchedulesNoReminder() {
        Commitment commitment = service.create("u1", "c1", null, "Call mom", null, NOW.plus(Duration.ofMinutes(30)));

        assertThat(commitment.getStatus()).isEqualTo(CommitmentStatus.ACTIVE);
        assertThat(commitment.getReminderEngagementId()).isNull();
        verify(deliveryCoordinator, never()).schedule(any());
    }

    @Test
    void dueDateAlreadyPastSchedulesNoReminder() {
        Commitment commitment = service.create("u1", "c1", null, "File taxes", null, NOW.minus(Duration.ofDays(1)));

        assertThat(commitment.getStatus()).isEqualTo(CommitmentStatus.ACTIVE);
        assertThat(commitment.getDueAt()).isEqualTo(NOW.minus(Duration.ofDays(1)));
        assertThat(commitment.getReminderEngagementId()).isNull();
        verifyNoInteractions(deliveryCoordinator, engagementStore);
    }

    @Test
    void updatingDueDateReplacesPendingReminder() {
        when(deliveryCoordinator.schedule(any()))
                .thenReturn(Engagement.builder().id("rem-1").build())
                .thenReturn(Engagement.builder().id("rem-2").build());
        Commitment commitment = service.create("u1", "c1", null, "Ship it", null, NOW.plus(Duration.ofHours(3)));

        Commitment updated = service.updateDueAt(commitment.getId(), "u1", NOW.plus(Duration.ofHours(6)));

        verify(engagementStore).cancel("rem-1", "u1");
        assertThat(updated.getReminderEngagementId()).isEqualTo("rem-2");
    }

    @Test
    void reminderAlreadyDeliveredDoesNotBlockCompletion() {
        when(deliveryCoordinator.schedule(any())).thenReturn(Engagement.builder().id("rem-1").build());
        when(engagementStore.cancel("rem-1", "u1")).thenThrow(new ConflictException("already delivered"));
        Commitment commitment = service.create("u1", "c1", null, "Ship it", null, NOW.plus(Duration.ofHours(3)));
        service.submit(commitment.getId(), "u1", "shipped");

        Commitment completed = service.verify(commitment.getId(), "u1", VerificationOutcome.APPROVED, "nice");

        assertThat(completed.getStatus()).isEqualTo(CommitmentStatus.COMPLETED);
        assertThat(completed.getReminderEngagementId()).isNull();
    }

    @Test
    void cancelCancelsPendingReminder() {
        when(deliveryCoordinator.schedule(any())).thenReturn(Engagement.builder().id("rem-1").build());
        Commitment commitment = service.create("u1", "c1", null, "Ship it", null, NOW.plus(Duration.ofHours(3)));

        Commitment cancelled = service.cancel(commitment.getId(), "u1");

        assertThat(cancelled.getStatus()).isEqualTo(CommitmentStatus.CANCELLED);
        verify(engagementStore).cancel(eq("rem-1"), eq("u1"));
    }

    @Test
    void otherUsersCommitmentIsHidden() {
        Commitment commitment = service.create("u1", "c1", null, "Read", null, null);

        assertThatThrownBy(() -> service.findById(commitment.getId(), "u2")).isInstanceOf(OwnershipException.class);
        assertThatThrownBy(() -> service.submit(commitment.getId(), "u2", "x")).isInstanceOf(OwnershipException.class);
        assertThatThrownBy(() -> service.findById("missing", "u1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void activeListingExcludesClosedCommitments() {
        Commitment open = service.create("u1", "c1", null, "Open one", null, null);
        Commitment closed = service.create("u1", "c1", null, "Closed one", null, null);
        service.cancel(closed.getId(), "u1");

        assertThat(service.findActive("u1", "c1")).extracting(Commitment::getId).containsExactly(open.getId());
        assertThat(service.findHistory("u1", "c1", null)).hasSize(2);
    }

    @Test
    void invalidInputIsRejected() {
        assertThatThrownBy(() -> service.create("u1", "c1", null, " ", null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.findHistory("u1", null, 0)).isInstanceOf(ValidationException.class);
    }

    static class InMemoryCommitmentStore implements CommitmentStore {

        private final Map<String, Commitment> rows = new ConcurrentHashMap<>();

        @Override
        public Commitment save(Commitment commitment) {
            if (commitment.getId() == null) {
                commitment.setId(UUID.randomUUID().toString());
            }
            Commitment copy = commitment.toBuilder().build();
            rows.put(copy.getId(), copy);
            return copy.toBuilder().build();
        }

        @Override
        public Optional<Commitment> findById(String id) {
            return Optional.ofNullable(rows.get(id)).map(row -> row.toBuilder().build());
        }

        @Override
        public List<Commitment> findByUser(String userId, String chatId, Collection<CommitmentStatus> statuses) {
            List<Commitment> result = new ArrayList<>();
            for (Commitment row : rows.values()) {
                if (row.getUserId().equals(userId)
                        && (chatId == null || chatId.equals(row.getChatId()))
                        && statuses.contains(row.getStatus())) {
                    result.add(row.toBuilder().build());
                }
            }
            return result;
        }

        @Override
        public List<Commitment> findHistory(String userId, String chatId, int limit) {
            return rows.values().stream()
                    .filter(row -> row.getUserId().equals(userId))
                    .filter(row -> chatId == null || chatId.equals(row.getChatId()))
                    .sorted(Comparator.comparing(Commitment::getAssignedAt).reversed())
                    .limit(limit)
                    .map(row -> row.toBuilder().build())
                    .toList();
        }
    }
}
