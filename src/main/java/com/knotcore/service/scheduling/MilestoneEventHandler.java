package com.knotcore.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Keeps the notification queue in step with milestone changes. Runs inside the caller's
 * reactive chain, so a deletion cancels its pending notifications before the delete is issued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MilestoneEventHandler {

    private final NotificationScheduler notificationScheduler;

    public Mono<Void> handle(MilestoneChangedEvent event) {
        log.debug("Milestone {} {}", event.getMilestone().getId(), event.getKind());
        switch (event.getKind()) {
            case CREATED:
            case UPDATED:
                return notificationScheduler.scheduleFor(event.getMilestone()).then();
            case DELETED:
                return notificationScheduler.cancelFor(event.getMilestone().getId()).then();
            default:
                return Mono.empty();
        }
    }
}
