package com.knotcore.controller;

import com.knotcore.model.dto.NotificationHistoryItem;
import com.knotcore.model.enums.NotificationStatus;
import com.knotcore.service.scheduling.NotificationHistoryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Controller for notification history.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationHistoryService notificationHistoryService;

    @GetMapping("/users/{userId}/notifications")
    public Flux<NotificationHistoryItem> history(
            @PathVariable UUID userId,
            @RequestParam(defaultValue = "SENT") NotificationStatus status,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        return notificationHistoryService.history(userId, status, limit, offset);
    }

    @PostMapping("/notifications/{notificationId}/viewed")
    public Mono<Map<String, Boolean>> markViewed(
            @PathVariable UUID notificationId,
            @RequestParam UUID userId) {
        return notificationHistoryService.markViewed(notificationId, userId)
                .thenReturn(Map.of("viewed", true));
    }
}
