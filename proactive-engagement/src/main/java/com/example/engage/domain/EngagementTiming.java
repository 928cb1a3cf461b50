package com.example.engage.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * When a positive engagement decision should reach the user.
 */
public sealed interface EngagementTiming permits EngagementTiming.Immediate, EngagementTiming.DelayedBy {

    Map<String, Long> ORACLE_DELAYS = Map.of(
            "immediate", 0L,
            "wait_30_seconds", 30L,
            "wait_2_minutes", 120L,
            "wait_5_minutes", 300L,
            "wait_later", 600L);

    Instant resolve(Instant now);

    static EngagementTiming immediate() {
        return Immediate.INSTANCE;
    }

    static EngagementTiming delayedBy(long seconds) {
        if (seconds <= 0) {
            return Immediate.INSTANCE;
        }
        return new DelayedBy(seconds);
    }

    /**
     * Maps the oracle's timing vocabulary. Unknown values and {@code none} yield empty.
     */
    static Optional<EngagementTiming> fromOracleValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Long seconds = ORACLE_DELAYS.get(value.trim().toLowerCase(Locale.ROOT));
        if (seconds == null) {
            return Optional.empty();
        }
        return Optional.of(delayedBy(seconds));
    }

    final class Immediate implements EngagementTiming {

        private static final Immediate INSTANCE = new Immediate();

        private Immediate() {}

        @Override
        public Instant resolve(Instant now) {
            return now;
        }

        @Override
        public String toString() {
            return "Immediate";
        }
    }

    record DelayedBy(long seconds) implements EngagementTiming {

        public DelayedBy {
            if (seconds <= 0) {
                throw new IllegalArgumentException("Delay must be positive: " + seconds);
            }
        }

        @Override
        public Instant resolve(Instant now) {
            return now.plus(Duration.ofSeconds(seconds));
        }
    }
}
