package com.example.engage.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a proactive engagement.
 *
 * <pre>
 * pending    -&gt; processing | cancelled | failed
 * processing -&gt; delivered | pending | failed
 * delivered, cancelled, failed: terminal
 * </pre>
 *
 * {@code processing} marks a row claimed by a scheduler tick. A claim is either completed
 * (delivered / failed) or released back to {@code pending}; nothing re-enters {@code pending}
 * from a terminal state.
 */
public enum EngagementStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    DELIVERED("delivered"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private static final Map<EngagementStatus, Set<EngagementStatus>> TRANSITIONS =
            new EnumMap<>(EngagementStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(PROCESSING, CANCELLED, FAILED));
        TRANSITIONS.put(PROCESSING, EnumSet.of(DELIVERED, PENDING, FAILED));
        TRANSITIONS.put(DELIVERED, EnumSet.noneOf(EngagementStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(EngagementStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(EngagementStatus.class));
    }

    private final String value;

    EngagementStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean canTransitionTo(EngagementStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<EngagementStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    @JsonCreator
    public static EngagementStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EngagementStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown engagement status: " + value);
    }
}
