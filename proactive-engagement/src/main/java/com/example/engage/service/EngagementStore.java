package com.example.engage.service;

import com.example.engage.domain.Engagement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of proactive engagements and the only writer of their status.
 *
 * <p>Every transition is a conditional update on the current status, so concurrent callers
 * (scheduler instances, API cancels) never both win the same row.
 */
public interface EngagementStore {

    /**
     * Persists a new {@code pending} engagement. The id is generated when the draft has none.
     */
    Engagement create(Engagement draft);

    /**
     * Persists an audit record for a message already pushed to a live connection.
     */
    Engagement recordDelivered(Engagement draft);

    Optional<Engagement> findById(String id);

    Engagement cancel(String id, String requestingUserId);

    Engagement reschedule(String id, String requestingUserId, Instant optimalTiming);

    /**
     * Moves due {@code pending} rows to {@code processing} and returns only the rows this
     * caller won, ascending by optimal timing.
     */
    List<Engagement> claimDue(Instant now, int limit);

    boolean markDelivered(String id);

    /**
     * Terminal failure of a claimed row; the failed send that led here is counted.
     */
    boolean markFailed(String id, String reason);

    /**
     * Returns a claimed row to {@code pending}. A non-null error counts as a failed attempt.
     */
    boolean release(String id, String error);

    int releaseStaleClaims(Instant claimedBefore);

    /**
     * Fails pending rows that were both created and due before {@code cutoff}, so a row is
     * only expired after it has actually waited that long.
     */
    int expirePending(Instant cutoff, String reason);

    List<Engagement> findPending(String userId);

    List<Engagement> findHistory(String userId, int limit);
}
