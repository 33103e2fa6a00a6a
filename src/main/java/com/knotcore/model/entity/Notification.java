package com.knotcore.model.entity;

import com.knotcore.model.enums.NotificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Queued reminder for one lead time of one milestone occurrence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("notification_queue")
public class Notification {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("milestone_id")
    private UUID milestoneId;

    @Column("days_before")
    private int daysBefore;

    @Column("occurrence_date")
    private LocalDate occurrenceDate;

    @Column("scheduled_for")
    private Instant scheduledFor;

    @Column("status")
    private NotificationStatus status;

    @Column("claimed_at")
    private Instant claimedAt;

    @Column("sent_at")
    private Instant sentAt;

    @Column("viewed_at")
    private Instant viewedAt;

    @Column("failure_reason")
    private String failureReason;

    @Column("recommendation_ids")
    private List<UUID> recommendationIds;

    @Column("created_at")
    private Instant createdAt;
}
