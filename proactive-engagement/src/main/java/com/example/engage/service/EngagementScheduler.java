package com.example.engage.service;

import com.example.engage.config.EngageProperties;
import com.example.engage.domain.Engagement;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Periodic delivery loop. Each tick releases abandoned claims, claims a batch of due rows and
 * hands each to the {@link DeliveryCoordinator}, then expires rows whose recipient never came back.
 *
 * <p>Ticks never overlap: a tick (scheduled or {@link #runOnce()}) that starts while another is
 * in progress returns a skipped report. Failures are contained per item.
 */
@Slf4j
@Component
public class EngagementScheduler {

    static final String EXPIRED_REASON = "expired";

    private final EngagementStore engagementStore;
    private final DeliveryCoordinator deliveryCoordinator;
    private final EngageProperties engageProperties;
    private final Clock clock;

    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;

    public EngagementScheduler(
            EngagementStore engagementStore,
            DeliveryCoordinator deliveryCoordinator,
            EngageProperties engageProperties,
            Clock clock) {
        this.engagementStore = engagementStore;
        this.deliveryCoordinator = deliveryCoordinator;
        this.engageProperties = engageProperties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (engageProperties.getScheduler().isEnabled()) {
            start();
        } else {
            log.info("Engagement scheduler disabled");
        }
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        Duration interval = engageProperties.getScheduler().getInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("engage.scheduler.interval must be positive");
        }
        executor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("engagement-scheduler-"));
        task = executor.scheduleWithFixedDelay(this::tick, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Engagement scheduler started (interval {}, batch size {})",
                interval, engageProperties.getScheduler().getBatchSize());
    }

    @PreDestroy
    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        executor.shutdown();
        Duration timeout = engageProperties.getScheduler().getShutdownTimeout();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Engagement scheduler tick still running after {}, interrupting", timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Engagement scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    public boolean isTickInProgress() {
        return tickInProgress.get();
    }

    public TickReport runOnce() {
        if (!tickInProgress.compareAndSet(false, true)) {
            log.debug("Previous engagement tick still running, skipping");
            return TickReport.SKIPPED;
        }
        try {
            return process(clock.instant());
        } finally {
            tickInProgress.set(false);
        }
    }

    private void tick() {
        try {
            TickReport report = runOnce();
            if (report.claimed() > 0 || report.staleReleased() > 0 || report.expired() > 0) {
                log.info("Engagement tick: {}", report);
            }
        } catch (Exception ex) {
            log.error("Engagement tick failed", ex);
        }
    }

    private TickReport process(Instant now) {
        TickReport.Builder report = new TickReport.Builder();

        try {
            Duration claimTimeout = engageProperties.getScheduler().getClaimTimeout();
            if (isPositive(claimTimeout)) {
                report.staleReleased = engagementStore.releaseStaleClaims(now.minus(claimTimeout));
            }
        } catch (Exception ex) {
            report.errors++;
            log.warn("Failed to release stale engagement claims", ex);
        }

        List<Engagement> claimed;
        try {
            claimed = engagementStore.claimDue(now, engageProperties.getScheduler().getBatchSize());
        } catch (Exception ex) {
            report.errors++;
            log.warn("Failed to claim due engagements", ex);
            return report.build();
        }
        report.claimed = claimed.size();

        for (Engagement engagement : claimed) {
            try {
                switch (deliveryCoordinator.deliverDue(engagement)) {
                    case DELIVERED -> report.delivered++;
                    case RELEASED -> report.released++;
                    case RETRY -> report.retried++;
                    case FAILED -> report.failed++;
                    case LOST -> report.errors++;
                }
            } catch (Exception ex) {
                report.errors++;
                log.warn("Failed to deliver engagement {}", engagement.getId(), ex);
            }
        }

        // after delivery, so only rows this tick could not hand over are dead-lettered
        try {
            Duration maxPendingAge = engageProperties.getDelivery().getMaxPendingAge();
            if (isPositive(maxPendingAge)) {
                report.expired = engagementStore.expirePending(now.minus(maxPendingAge), EXPIRED_REASON);
            }
        } catch (Exception ex) {
            report.errors++;
            log.warn("Failed to expire old pending engagements", ex);
        }
        return report.build();
    }

    private boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    public record TickReport(
            boolean skipped,
            int claimed,
            int delivered,
            int released,
            int retried,
            int failed,
            int errors,
            int staleReleased,
            int expired) {

        static final TickReport SKIPPED = new TickReport(true, 0, 0, 0, 0, 0, 0, 0, 0);

        static final class Builder {
            private int claimed;
            private int delivered;
            private int released;
            private int retried;
            private int failed;
            private int errors;
            private int staleReleased;
            private int expired;

            TickReport build() {
                return new TickReport(false, claimed, delivered, released, retried, failed, errors, staleReleased, expired);
            }
        }
    }
}
