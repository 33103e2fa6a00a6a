package com.knotcore.service.scheduling;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.model.dto.NotificationHistoryItem;
import com.knotcore.model.enums.MilestoneType;
import com.knotcore.model.enums.NotificationStatus;
import com.knotcore.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Read side of the notification queue for the app's history screen.
 */
@Service
@RequiredArgsConstructor
public class NotificationHistoryService {

    private static final String HISTORY_SQL =
            "SELECT n.id, n.milestone_id, n.days_before, n.occurrence_date, n.scheduled_for, n.status, " +
            "n.sent_at, n.viewed_at, n.failure_reason, " +
            "m.milestone_name, m.milestone_type, m.milestone_date, " +
            "(SELECT COUNT(*) FROM recommendations r WHERE r.milestone_id = n.milestone_id) AS recommendations_count " +
            "FROM notification_queue n JOIN partner_milestones m ON m.id = n.milestone_id " +
            "WHERE n.user_id = :userId AND n.status = :status " +
            "ORDER BY COALESCE(n.sent_at, n.scheduled_for) DESC " +
            "LIMIT :limit OFFSET :offset";

    private final DatabaseClient databaseClient;
    private final NotificationRepository notificationRepository;
    private final Clock clock;

    /**
     * Notifications of a user with their milestone details, newest first.
     *
     * @param userId User ID
     * @param status Status filter
     * @param limit Page size
     * @param offset Rows to skip
     */
    public Flux<NotificationHistoryItem> history(UUID userId, NotificationStatus status, int limit, int offset) {
        return databaseClient.sql(HISTORY_SQL)
                .bind("userId", userId)
                .bind("status", status.name())
                .bind("limit", limit)
                .bind("offset", offset)
                .map((row, metadata) -> NotificationHistoryItem.builder()
                        .id(row.get("id", UUID.class))
                        .milestoneId(row.get("milestone_id", UUID.class))
                        .milestoneName(row.get("milestone_name", String.class))
                        .milestoneType(MilestoneType.valueOf(row.get("milestone_type", String.class)))
                        .milestoneDate(row.get("milestone_date", LocalDate.class))
                        .daysBefore(row.get("days_before", Integer.class))
                        .occurrenceDate(row.get("occurrence_date", LocalDate.class))
                        .scheduledFor(row.get("scheduled_for", Instant.class))
                        .status(NotificationStatus.valueOf(row.get("status", String.class)))
                        .sentAt(row.get("sent_at", Instant.class))
                        .viewedAt(row.get("viewed_at", Instant.class))
                        .failureReason(row.get("failure_reason", String.class))
                        .recommendationsCount(row.get("recommendations_count", Long.class))
                        .build())
                .all();
    }

    /**
     * Stamp a sent notification as viewed. Viewing twice keeps the first timestamp.
     */
    public Mono<Void> markViewed(UUID notificationId, UUID userId) {
        return notificationRepository.markViewed(notificationId, userId, clock.instant())
                .flatMap(updated -> updated > 0
                        ? Mono.<Void>empty()
                        : notificationRepository.findById(notificationId)
                                .filter(row -> row.getUserId().equals(userId) && row.getStatus() == NotificationStatus.SENT)
                                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Notification", notificationId)))
                                .then());
    }
}
