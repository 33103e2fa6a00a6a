package com.knotcore.repository;

import com.knotcore.model.entity.Notification;
import com.knotcore.model.enums.NotificationStatus;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Repository for the notification queue.
 *
 * Every status change is a conditional update on the current status; a result of 0 means
 * another worker or request already moved the row.
 */
@Repository
public interface NotificationRepository extends ReactiveCrudRepository<Notification, UUID> {

    Flux<Notification> findByMilestoneId(UUID milestoneId);

    Mono<Long> countByStatus(NotificationStatus status);

    /**
     * Pending rows that are due, oldest first.
     */
    @Query("SELECT * FROM notification_queue WHERE status = 'PENDING' AND scheduled_for <= :now " +
            "ORDER BY scheduled_for ASC LIMIT :limit")
    Flux<Notification> findDue(Instant now, int limit);

    @Modifying
    @Query("UPDATE notification_queue SET scheduled_for = :scheduledFor, updated_at = NOW() " +
            "WHERE id = :id AND status = 'PENDING'")
    Mono<Integer> reschedule(UUID id, Instant scheduledFor);

    @Modifying
    @Query("UPDATE notification_queue SET status = 'CANCELLED', updated_at = NOW() " +
            "WHERE id = :id AND status = 'PENDING'")
    Mono<Integer> cancelIfPending(UUID id);

    @Modifying
    @Query("UPDATE notification_queue SET status = 'CANCELLED', updated_at = NOW() " +
            "WHERE milestone_id = :milestoneId AND status = 'PENDING'")
    Mono<Integer> cancelPendingByMilestoneId(UUID milestoneId);

    @Modifying
    @Query("UPDATE notification_queue SET status = 'CANCELLED', updated_at = NOW() " +
            "WHERE user_id = :userId AND status = 'PENDING'")
    Mono<Integer> cancelPendingByUserId(UUID userId);

    @Modifying
    @Query("UPDATE notification_queue SET status = 'CLAIMED', claimed_at = :claimedAt, updated_at = NOW() " +
            "WHERE id = :id AND status = 'PENDING'")
    Mono<Integer> claim(UUID id, Instant claimedAt);

    @Modifying
    @Query("UPDATE notification_queue SET status = 'SENT', sent_at = :sentAt, " +
            "recommendation_ids = :recommendationIds, updated_at = NOW() " +
            "WHERE id = :id AND status = 'CLAIMED'")
    Mono<Integer> markSent(UUID id, Instant sentAt, UUID[] recommendationIds);

    @Modifying
    @Query("UPDATE notification_queue SET status = 'FAILED', failure_reason = :reason, updated_at = NOW() " +
            "WHERE id = :id AND status = 'CLAIMED'")
    Mono<Integer> markFailed(UUID id, String reason);

    @Modifying
    @Query("UPDATE notification_queue SET status = 'CANCELLED', updated_at = NOW() " +
            "WHERE id = :id AND status = 'CLAIMED'")
    Mono<Integer> cancelClaimed(UUID id);

    /**
     * Hand a claimed row back to the queue with a new due instant (quiet-hours deferral).
     */
    @Modifying
    @Query("UPDATE notification_queue SET status = 'PENDING', claimed_at = NULL, scheduled_for = :scheduledFor, " +
            "updated_at = NOW() WHERE id = :id AND status = 'CLAIMED'")
    Mono<Integer> release(UUID id, Instant scheduledFor);

    /**
     * Fail claims whose holder did not finish within the lease.
     *
     * @return The rows moved to FAILED
     */
    @Query("UPDATE notification_queue SET status = 'FAILED', failure_reason = :reason, updated_at = NOW() " +
            "WHERE status = 'CLAIMED' AND claimed_at < :cutoff RETURNING *")
    Flux<Notification> expireClaims(Instant cutoff, String reason);

    @Modifying
    @Query("UPDATE notification_queue SET viewed_at = :viewedAt, updated_at = NOW() " +
            "WHERE id = :id AND user_id = :userId AND status = 'SENT' AND viewed_at IS NULL")
    Mono<Integer> markViewed(UUID id, UUID userId, Instant viewedAt);
}
