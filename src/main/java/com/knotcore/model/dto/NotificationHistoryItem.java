package com.knotcore.model.dto;

import com.knotcore.model.enums.MilestoneType;
import com.knotcore.model.enums.NotificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Notification history entry joined with its milestone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationHistoryItem {
    private UUID id;
    private UUID milestoneId;
    private String milestoneName;
    private MilestoneType milestoneType;
    private LocalDate milestoneDate;
    private int daysBefore;
    private LocalDate occurrenceDate;
    private Instant scheduledFor;
    private NotificationStatus status;
    private Instant sentAt;
    private Instant viewedAt;
    private String failureReason;
    private long recommendationsCount;
}
