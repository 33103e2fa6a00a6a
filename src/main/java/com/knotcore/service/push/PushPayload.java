package com.knotcore.service.push;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Content of a milestone reminder push.
 */
@Value
@Builder
public class PushPayload {
    UUID notificationId;
    UUID milestoneId;
    String title;
    String body;
    int daysBefore;
    List<UUID> recommendationIds;
}
