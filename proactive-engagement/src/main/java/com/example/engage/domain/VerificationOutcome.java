package com.example.engage.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Judgment returned by the verifier for a submitted commitment.
 */
public enum VerificationOutcome {
    APPROVED("approved", CommitmentStatus.COMPLETED),
    NEEDS_REVISION("needs_revision", CommitmentStatus.NEEDS_REVISION),
    REJECTED("rejected", CommitmentStatus.REJECTED),
    NOT_VERIFIABLE("not_verifiable", CommitmentStatus.NOT_VERIFIABLE);

    private final String value;
    private final CommitmentStatus resultingStatus;

    VerificationOutcome(String value, CommitmentStatus resultingStatus) {
        this.value = value;
        this.resultingStatus = resultingStatus;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public CommitmentStatus resultingStatus() {
        return resultingStatus;
    }

    @JsonCreator
    public static VerificationOutcome fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (VerificationOutcome outcome : values()) {
            if (outcome.value.equals(normalized)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown verification outcome: " + value);
    }
}
