package com.example.engage.persistence;

import com.example.engage.domain.Commitment;
import com.example.engage.domain.CommitmentStatus;
import com.example.engage.service.CommitmentStore;
import com.example.engage.service.exception.ConflictException;
import com.example.engage.service.exception.PersistenceFailureException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Repository
@Primary
@RequiredArgsConstructor
public class JpaCommitmentStore implements CommitmentStore {

    private final CommitmentJpaRepository commitmentJpaRepository;
    private final CommitmentEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional
    public Commitment save(Commitment commitment) {
        Instant now = clock.instant();
        if (!StringUtils.hasText(commitment.getId())) {
            commitment.setId(UUID.randomUUID().toString());
        }
        if (commitment.getAssignedAt() == null) {
            commitment.setAssignedAt(now);
        }
        commitment.setUpdatedAt(now);
        try {
            CommitmentEntity saved = commitmentJpaRepository.saveAndFlush(mapper.toEntity(commitment));
            return mapper.toDomain(saved);
        } catch (OptimisticLockingFailureException ex) {
            throw new ConflictException("Commitment " + commitment.getId() + " was modified concurrently", ex);
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Unable to save commitment " + commitment.getId(), ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Commitment> findById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return commitmentJpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Commitment> findByUser(String userId, String chatId, Collection<CommitmentStatus> statuses) {
        if (!StringUtils.hasText(userId) || CollectionUtils.isEmpty(statuses)) {
            return Collections.emptyList();
        }
        return commitmentJpaRepository.findForUser(userId, blankToNull(chatId), statuses).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Commitment> findHistory(String userId, String chatId, int limit) {
        if (!StringUtils.hasText(userId) || limit <= 0) {
            return Collections.emptyList();
        }
        return commitmentJpaRepository.findHistory(userId, blankToNull(chatId), PageRequest.of(0, limit)).stream()
                .map(mapper::toDomain)
                .toList();
    }

    private String blankToNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }
}
