package com.example.engage.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.engage.domain.Commitment;
import com.example.engage.domain.CommitmentStatus;
import com.example.engage.domain.VerificationOutcome;
import com.example.engage.service.exception.ConflictException;
import java.time.Instant;
import java.util.EnumSet;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest
@Import({JpaCommitmentStore.class, CommitmentEntityMapper.class, StoreTestConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaCommitmentStoreTest {

    @Autowired
    private JpaCommitmentStore store;

    @Autowired
    private CommitmentJpaRepository repository;

    @Autowired
    private DataSource dataSource;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    void savesAndReloadsAllFields() {
        Commitment saved = store.save(commitment("u1", "c1", CommitmentStatus.NEEDS_REVISION));

        Commitment loaded = store.findById(saved.getId()).orElseThrow();
        assertThat(loaded.getStatus()).isEqualTo(CommitmentStatus.NEEDS_REVISION);
        assertThat(loaded.getVerificationDecision()).isEqualTo(VerificationOutcome.NEEDS_REVISION);
        assertThat(loaded.getRevisionCount()).isEqualTo(1);
        assertThat(loaded.getVersion()).isNotNull();
    }

    @Test
    void statusIsStoredAsLowercaseValue() {
        Commitment saved = store.save(commitment("u1", "c1", CommitmentStatus.NEEDS_REVISION));

        String raw = new JdbcTemplate(dataSource).queryForObject(
                "select status from commitments where id = ?", String.class, saved.getId());
        assertThat(raw).isEqualTo("needs_revision");
    }

    @Test
    void staleWriteIsAConflict() {
        Commitment saved = store.save(commitment("u1", "c1", CommitmentStatus.ACTIVE));
        Commitment copyA = store.findById(saved.getId()).orElseThrow();
        Commitment copyB = store.findById(saved.getId()).orElseThrow();

        copyA.setStatus(CommitmentStatus.SUBMITTED);
        store.save(copyA);

        copyB.setStatus(CommitmentStatus.CANCELLED);
        assertThatThrownBy(() -> store.save(copyB)).isInstanceOf(ConflictException.class);
        assertThat(store.findById(saved.getId()).orElseThrow().getStatus()).isEqualTo(CommitmentStatus.SUBMITTED);
    }

    @Test
    void listingsFilterByUserChatAndStatus() {
        store.save(commitment("u1", "c1", CommitmentStatus.ACTIVE));
        store.save(commitment("u1", "c2", CommitmentStatus.ACTIVE));
        store.save(commitment("u1", "c1", CommitmentStatus.COMPLETED));
        store.save(commitment("u2", "c1", CommitmentStatus.ACTIVE));

        assertThat(store.findByUser("u1", "c1", EnumSet.of(CommitmentStatus.ACTIVE))).hasSize(1);
        assertThat(store.findByUser("u1", null, EnumSet.of(CommitmentStatus.ACTIVE))).hasSize(2);
        assertThat(store.findHistory("u1", "c1", 10)).hasSize(2);
        assertThat(store.findHistory("u1", null, 2)).hasSize(2);
        assertThat(store.findHistory("u3", null, 10)).isEmpty();
    }

    private Commitment commitment(String userId, String chatId, CommitmentStatus status) {
        return Commitment.builder()
                .userId(userId)
                .chatId(chatId)
                .characterId("char-1")
                .description("Practice guitar for 20 minutes")
                .type("habit")
                .status(status)
                .verificationDecision(status == CommitmentStatus.NEEDS_REVISION ? VerificationOutcome.NEEDS_REVISION : null)
                .revisionCount(status == CommitmentStatus.NEEDS_REVISION ? 1 : 0)
                .assignedAt(Instant.now())
                .build();
    }
}
