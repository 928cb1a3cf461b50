package com.example.engage.persistence;

import com.example.engage.domain.Engagement;
import com.example.engage.domain.EngagementStatus;
import com.example.engage.service.EngagementStore;
import com.example.engage.service.exception.ConflictException;
import com.example.engage.service.exception.NotFoundException;
import com.example.engage.service.exception.OwnershipException;
import com.example.engage.service.exception.PersistenceFailureException;
import com.example.engage.service.exception.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

@Slf4j
@Repository
@Primary
public class JpaEngagementStore implements EngagementStore {

    private final EngagementJpaRepository engagementJpaRepository;
    private final EngagementEntityMapper mapper;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;
    private final Clock clock;

    public JpaEngagementStore(
            EngagementJpaRepository engagementJpaRepository,
            EngagementEntityMapper mapper,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.engagementJpaRepository = engagementJpaRepository;
        this.mapper = mapper;
        this.clock = clock;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public Engagement create(Engagement draft) {
        validateDraft(draft);
        return insert(draft, EngagementStatus.PENDING);
    }

    @Override
    public Engagement recordDelivered(Engagement draft) {
        validateDraft(draft);
        return insert(draft, EngagementStatus.DELIVERED);
    }

    @Override
    public Optional<Engagement> findById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return read(() -> engagementJpaRepository.findById(id).map(mapper::toDomain));
    }

    @Override
    public Engagement cancel(String id, String requestingUserId) {
        Engagement current = requireOwned(id, requestingUserId);
        if (!current.getStatus().canTransitionTo(EngagementStatus.CANCELLED)) {
            throw conflict(id, current.getStatus(), "cancelled");
        }
        int updated = write(() -> engagementJpaRepository.cancel(
                id, requestingUserId, EngagementStatus.PENDING, EngagementStatus.CANCELLED, clock.instant()));
        if (updated == 0) {
            throw conflict(id, currentStatus(id), "cancelled");
        }
        log.debug("Engagement {} cancelled by {}", id, requestingUserId);
        return findById(id).orElse(current);
    }

    @Override
    public Engagement reschedule(String id, String requestingUserId, Instant optimalTiming) {
        if (optimalTiming == null) {
            throw new ValidationException("optimalTiming is required");
        }
        Engagement current = requireOwned(id, requestingUserId);
        int updated = write(() -> engagementJpaRepository.reschedule(
                id, requestingUserId, EngagementStatus.PENDING, optimalTiming, clock.instant()));
        if (updated == 0) {
            throw conflict(id, currentStatus(id), "rescheduled");
        }
        return findById(id).orElse(current);
    }

    @Override
    public List<Engagement> claimDue(Instant now, int limit) {
        if (now == null || limit <= 0) {
            return Collections.emptyList();
        }
        List<EngagementEntity> candidates = read(() -> engagementJpaRepository
                .findByStatusAndOptimalTimingLessThanEqualOrderByOptimalTimingAsc(
                        EngagementStatus.PENDING, now, PageRequest.of(0, limit)));
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> claimedIds = new ArrayList<>(candidates.size());
        for (EngagementEntity candidate : candidates) {
            try {
                Integer updated = writeTransaction.execute(status -> engagementJpaRepository.claim(
                        candidate.getId(), EngagementStatus.PENDING, EngagementStatus.PROCESSING, now));
                if (updated != null && updated == 1) {
                    claimedIds.add(candidate.getId());
                }
            } catch (PessimisticLockingFailureException ex) {
                log.debug("Engagement {} is being claimed elsewhere, skipping", candidate.getId());
            } catch (DataAccessException ex) {
                log.warn("Claim of engagement {} failed, keeping {} claimed rows", candidate.getId(), claimedIds.size(), ex);
                break;
            }
        }
        if (claimedIds.isEmpty()) {
            return Collections.emptyList();
        }

        return read(() -> engagementJpaRepository.findAllById(claimedIds).stream()
                .map(mapper::toDomain)
                .sorted(Comparator.comparing(Engagement::getOptimalTiming))
                .toList());
    }

    @Override
    public boolean markDelivered(String id) {
        return write(() -> engagementJpaRepository.markDelivered(
                id, EngagementStatus.PROCESSING, EngagementStatus.DELIVERED, clock.instant())) == 1;
    }

    @Override
    public boolean markFailed(String id, String reason) {
        return write(() -> engagementJpaRepository.markFailed(
                id, EngagementStatus.PROCESSING, EngagementStatus.FAILED, truncate(reason), clock.instant())) == 1;
    }

    @Override
    public boolean release(String id, String error) {
        Instant now = clock.instant();
        if (error == null) {
            return write(() -> engagementJpaRepository.release(
                    id, EngagementStatus.PROCESSING, EngagementStatus.PENDING, now)) == 1;
        }
        return write(() -> engagementJpaRepository.releaseWithError(
                id, EngagementStatus.PROCESSING, EngagementStatus.PENDING, truncate(error), now)) == 1;
    }

    @Override
    public int releaseStaleClaims(Instant claimedBefore) {
        if (claimedBefore == null) {
            return 0;
        }
        return write(() -> engagementJpaRepository.releaseStale(
                EngagementStatus.PROCESSING, EngagementStatus.PENDING, claimedBefore, clock.instant()));
    }

    @Override
    public int expirePending(Instant optimalTimingBefore, String reason) {
        if (optimalTimingBefore == null) {
            return 0;
        }
        return write(() -> engagementJpaRepository.expirePending(
                EngagementStatus.PENDING, EngagementStatus.FAILED, truncate(reason), optimalTimingBefore, clock.instant()));
    }

    @Override
    public List<Engagement> findPending(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Collections.emptyList();
        }
        return read(() -> engagementJpaRepository
                .findByUserIdAndStatusOrderByOptimalTimingAsc(userId, EngagementStatus.PENDING).stream()
                .map(mapper::toDomain)
                .toList());
    }

    @Override
    public List<Engagement> findHistory(String userId, int limit) {
        if (!StringUtils.hasText(userId) || limit <= 0) {
            return Collections.emptyList();
        }
        return read(() -> engagementJpaRepository
                .findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit)).stream()
                .map(mapper::toDomain)
                .toList());
    }

    private Engagement insert(Engagement draft, EngagementStatus status) {
        Instant now = clock.instant();
        Engagement engagement = draft.toBuilder()
                .id(StringUtils.hasText(draft.getId()) ? draft.getId() : UUID.randomUUID().toString())
                .status(status)
                .attempts(0)
                .lastError(null)
                .claimedAt(null)
                .deliveredAt(status == EngagementStatus.DELIVERED ? now : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
        EngagementEntity saved = write(() -> engagementJpaRepository.save(mapper.toEntity(engagement)));
        return mapper.toDomain(saved);
    }

    private Engagement requireOwned(String id, String requestingUserId) {
        Engagement engagement = findById(id)
                .orElseThrow(() -> new NotFoundException("Engagement not found: " + id));
        if (!engagement.getUserId().equals(requestingUserId)) {
            throw new OwnershipException("Engagement not found: " + id);
        }
        return engagement;
    }

    private EngagementStatus currentStatus(String id) {
        return findById(id).map(Engagement::getStatus).orElse(null);
    }

    private ConflictException conflict(String id, EngagementStatus status, String action) {
        if (status == null) {
            return new ConflictException("Engagement " + id + " cannot be " + action + " while missing");
        }
        String allowed = status.allowedTransitions().stream()
                .map(EngagementStatus::value)
                .sorted()
                .collect(Collectors.joining(", "));
        return new ConflictException("Engagement " + id + " cannot be " + action + " while " + status.value()
                + (allowed.isEmpty() ? " (terminal)" : " (allowed: " + allowed + ")"));
    }

    private void validateDraft(Engagement draft) {
        if (draft == null) {
            throw new ValidationException("Engagement is required");
        }
        if (!StringUtils.hasText(draft.getUserId())) {
            throw new ValidationException("userId is required");
        }
        if (!StringUtils.hasText(draft.getContent())) {
            throw new ValidationException("content must not be empty");
        }
        if (draft.getOptimalTiming() == null) {
            throw new ValidationException("optimalTiming is required");
        }
        Double confidence = draft.getConfidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new ValidationException("confidence must be within [0, 1]");
        }
    }

    private String truncate(String value) {
        if (value == null || value.length() <= 1024) {
            return value;
        }
        return value.substring(0, 1024);
    }

    private <T> T write(Supplier<T> action) {
        try {
            return writeTransaction.execute(status -> action.get());
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Engagement store write failed", ex);
        }
    }

    private <T> T read(Supplier<T> action) {
        try {
            return readTransaction.execute(status -> action.get());
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Engagement store read failed", ex);
        }
    }
}
