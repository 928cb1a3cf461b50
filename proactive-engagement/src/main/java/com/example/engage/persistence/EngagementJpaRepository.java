package com.example.engage.persistence;

import com.example.engage.domain.EngagementStatus;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EngagementJpaRepository extends JpaRepository<EngagementEntity, String> {

    List<EngagementEntity> findByStatusAndOptimalTimingLessThanEqualOrderByOptimalTimingAsc(
            EngagementStatus status, Instant optimalTiming, Pageable pageable);

    List<EngagementEntity> findByUserIdAndStatusOrderByOptimalTimingAsc(String userId, EngagementStatus status);

    List<EngagementEntity> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :claimed, e.claimedAt = :now, e.updatedAt = :now "
                    + "where e.id = :id and e.status = :pending")
    int claim(
            @Param("id") String id,
            @Param("pending") EngagementStatus pending,
            @Param("claimed") EngagementStatus claimed,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :delivered, e.deliveredAt = :now, e.claimedAt = null, "
                    + "e.updatedAt = :now where e.id = :id and e.status = :claimed")
    int markDelivered(
            @Param("id") String id,
            @Param("claimed") EngagementStatus claimed,
            @Param("delivered") EngagementStatus delivered,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :failed, e.attempts = e.attempts + 1, e.lastError = :reason, "
                    + "e.claimedAt = null, e.updatedAt = :now where e.id = :id and e.status = :claimed")
    int markFailed(
            @Param("id") String id,
            @Param("claimed") EngagementStatus claimed,
            @Param("failed") EngagementStatus failed,
            @Param("reason") String reason,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :pending, e.claimedAt = null, e.updatedAt = :now "
                    + "where e.id = :id and e.status = :claimed")
    int release(
            @Param("id") String id,
            @Param("claimed") EngagementStatus claimed,
            @Param("pending") EngagementStatus pending,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :pending, e.attempts = e.attempts + 1, e.lastError = :error, "
                    + "e.claimedAt = null, e.updatedAt = :now where e.id = :id and e.status = :claimed")
    int releaseWithError(
            @Param("id") String id,
            @Param("claimed") EngagementStatus claimed,
            @Param("pending") EngagementStatus pending,
            @Param("error") String error,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :pending, e.claimedAt = null, e.updatedAt = :now "
                    + "where e.status = :claimed and e.claimedAt < :cutoff")
    int releaseStale(
            @Param("claimed") EngagementStatus claimed,
            @Param("pending") EngagementStatus pending,
            @Param("cutoff") Instant cutoff,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :failed, e.lastError = :reason, e.updatedAt = :now "
                    + "where e.status = :pending and e.optimalTiming < :cutoff and e.createdAt < :cutoff")
    int expirePending(
            @Param("pending") EngagementStatus pending,
            @Param("failed") EngagementStatus failed,
            @Param("reason") String reason,
            @Param("cutoff") Instant cutoff,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.status = :cancelled, e.updatedAt = :now "
                    + "where e.id = :id and e.userId = :userId and e.status = :pending")
    int cancel(
            @Param("id") String id,
            @Param("userId") String userId,
            @Param("pending") EngagementStatus pending,
            @Param("cancelled") EngagementStatus cancelled,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EngagementEntity e set e.optimalTiming = :timing, e.updatedAt = :now "
                    + "where e.id = :id and e.userId = :userId and e.status = :pending")
    int reschedule(
            @Param("id") String id,
            @Param("userId") String userId,
            @Param("pending") EngagementStatus pending,
            @Param("timing") Instant timing,
            @Param("now") Instant now);
}
