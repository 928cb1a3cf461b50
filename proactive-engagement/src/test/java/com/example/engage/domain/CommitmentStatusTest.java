package com.example.engage.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CommitmentStatusTest {

    @Test
    void onlyActiveAndNeedsRevisionAcceptSubmissions() {
        for (CommitmentStatus status : CommitmentStatus.values()) {
            boolean expected = status == CommitmentStatus.ACTIVE || status == CommitmentStatus.NEEDS_REVISION;
            assertThat(status.acceptsSubmission()).as(status.value()).isEqualTo(expected);
        }
    }

    @Test
    void verificationOutcomesMapOntoSubmittedExits() {
        for (VerificationOutcome outcome : VerificationOutcome.values()) {
            assertThat(CommitmentStatus.SUBMITTED.canTransitionTo(outcome.resultingStatus())).isTrue();
        }
        assertThat(VerificationOutcome.APPROVED.resultingStatus()).isEqualTo(CommitmentStatus.COMPLETED);
        assertThat(VerificationOutcome.fromValue("needs_revision")).isEqualTo(VerificationOutcome.NEEDS_REVISION);
    }

    @Test
    void outcomesOtherThanRevisionAreTerminal() {
        assertThat(CommitmentStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(CommitmentStatus.REJECTED.isTerminal()).isTrue();
        assertThat(CommitmentStatus.NOT_VERIFIABLE.isTerminal()).isTrue();
        assertThat(CommitmentStatus.NEEDS_REVISION.isTerminal()).isFalse();
        assertThat(CommitmentStatus.ACTIVE.canTransitionTo(CommitmentStatus.COMPLETED)).isFalse();
    }
}
