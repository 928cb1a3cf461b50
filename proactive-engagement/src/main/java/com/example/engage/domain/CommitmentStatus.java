package com.example.engage.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a commitment. Verification moves a {@code submitted} commitment to one of the
 * outcome states; {@code needs_revision} is the only outcome that accepts a new submission.
 */
public enum CommitmentStatus {
    ACTIVE("active"),
    SUBMITTED("submitted"),
    NEEDS_REVISION("needs_revision"),
    COMPLETED("completed"),
    REJECTED("rejected"),
    NOT_VERIFIABLE("not_verifiable"),
    CANCELLED("cancelled");

    private static final Map<CommitmentStatus, Set<CommitmentStatus>> TRANSITIONS =
            new EnumMap<>(CommitmentStatus.class);

    static {
        TRANSITIONS.put(ACTIVE, EnumSet.of(SUBMITTED, CANCELLED));
        TRANSITIONS.put(SUBMITTED, EnumSet.of(COMPLETED, REJECTED, NOT_VERIFIABLE, NEEDS_REVISION));
        TRANSITIONS.put(NEEDS_REVISION, EnumSet.of(SUBMITTED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(CommitmentStatus.class));
        TRANSITIONS.put(REJECTED, EnumSet.noneOf(CommitmentStatus.class));
        TRANSITIONS.put(NOT_VERIFIABLE, EnumSet.noneOf(CommitmentStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(CommitmentStatus.class));
    }

    private final String value;

    CommitmentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean canTransitionTo(CommitmentStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean acceptsSubmission() {
        return canTransitionTo(SUBMITTED);
    }

    @JsonCreator
    public static CommitmentStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CommitmentStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown commitment status: " + value);
    }
}
