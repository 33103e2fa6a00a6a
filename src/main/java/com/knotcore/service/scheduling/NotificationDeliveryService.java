package com.knotcore.service.scheduling;

import com.knotcore.model.domain.DeliveryTarget;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.entity.Notification;
import com.knotcore.model.entity.UserAccount;
import com.knotcore.model.enums.NotificationStatus;
import com.knotcore.model.enums.Recurrence;
import com.knotcore.repository.MilestoneRepository;
import com.knotcore.repository.NotificationRepository;
import com.knotcore.service.push.PushDeliveryClient;
import com.knotcore.service.push.PushPayload;
import com.knotcore.service.scoring.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Delivers claimed notifications. Never retries: a failed push ends in FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

    private static final int SENT_WRITE_RETRIES = 2;

    private final NotificationRepository notificationRepository;
    private final MilestoneRepository milestoneRepository;
    private final DeliveryTargetResolver deliveryTargetResolver;
    private final DeliveryTimeCalculator deliveryTimeCalculator;
    private final NotificationScheduler notificationScheduler;
    private final RecommendationService recommendationService;
    private final PushDeliveryClient pushDeliveryClient;
    private final Clock clock;

    @Value("${knot.push.timeout:PT10S}")
    private Duration pushTimeout;

    @Value("${knot.scheduler.recommendations-per-notification:3}")
    private int recommendationsPerNotification;

    /**
     * Deliver a notification the caller has claimed.
     *
     * @param notification Claimed notification
     * @return Resulting status: SENT, FAILED, CANCELLED, or PENDING when deferred out of quiet hours
     */
    public Mono<NotificationStatus> deliver(Notification notification) {
        return milestoneRepository.findById(notification.getMilestoneId())
                .flatMap(milestone -> deliveryTargetResolver.forMilestone(milestone)
                        .flatMap(target -> deliver(notification, milestone, target)))
                .switchIfEmpty(Mono.defer(() -> fail(notification, "Milestone no longer exists")))
                .onErrorResume(error -> {
                    log.error("Delivery of notification {} failed: {}", notification.getId(), error.getMessage());
                    return fail(notification, "Delivery error: " + error.getMessage());
                });
    }

    private Mono<NotificationStatus> deliver(Notification notification, Milestone milestone, DeliveryTarget target) {
        UserAccount user = target.getUser();
        if (!user.isNotificationsEnabled()) {
            log.info("Notifications disabled for user {}, cancelling notification {}", user.getId(), notification.getId());
            return transition(notification, NotificationStatus.CANCELLED, notificationRepository.cancelClaimed(notification.getId()))
                    .flatMap(status -> replan(milestone, target, status));
        }

        Instant now = clock.instant();
        if (target.getQuietHours().contains(now.atZone(target.getZone()).getHour())) {
            Instant resumeAt = deliveryTimeCalculator.nextAllowed(now, target.getZone(), target.getQuietHours());
            log.info("Notification {} reached quiet hours, deferring to {}", notification.getId(), resumeAt);
            return transition(notification, NotificationStatus.PENDING,
                    notificationRepository.release(notification.getId(), resumeAt));
        }

        if (user.getDeviceToken() == null || user.getDeviceToken().isBlank() || user.getDevicePlatform() == null) {
            return fail(notification, "No device registered")
                    .flatMap(status -> replan(milestone, target, status));
        }

        return fanOut(milestone)
                .flatMap(recommendationIds -> push(notification, milestone, target, recommendationIds)
                        .flatMap(failure -> failure.isPresent()
                                ? fail(notification, failure.get())
                                : markSent(notification, recommendationIds)))
                .flatMap(status -> replan(milestone, target, status));
    }

    /**
     * Score and persist recommendations to attach. Best effort: the reminder goes out without them on failure.
     */
    private Mono<List<UUID>> fanOut(Milestone milestone) {
        return recommendationService.recommendForMilestone(milestone, recommendationsPerNotification)
                .onErrorResume(error -> {
                    log.warn("Recommendation fan-out failed for milestone {}: {}", milestone.getId(), error.getMessage());
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }

    /**
     * @return Failure reason, or empty on success
     */
    private Mono<Optional<String>> push(Notification notification, Milestone milestone, DeliveryTarget target,
                                        List<UUID> recommendationIds) {
        PushPayload payload = PushPayload.builder()
                .notificationId(notification.getId())
                .milestoneId(milestone.getId())
                .daysBefore(notification.getDaysBefore())
                .title(milestone.getName())
                .body(body(notification, milestone, target, recommendationIds.size()))
                .recommendationIds(recommendationIds)
                .build();

        return pushDeliveryClient.send(target.getUser().getDeviceToken(), target.getUser().getDevicePlatform(), payload)
                .timeout(pushTimeout)
                .then(Mono.just(Optional.<String>empty()))
                .onErrorResume(error -> Mono.just(Optional.of(error instanceof TimeoutException
                        ? "Push delivery timed out after " + pushTimeout
                        : "Push delivery failed: " + error.getMessage())));
    }

    private static String body(Notification notification, Milestone milestone, DeliveryTarget target, int ideas) {
        String partner = target.getVault() != null && target.getVault().getPartnerName() != null
                ? target.getVault().getPartnerName()
                : "your partner";
        String text = String.format("%s is in %d days.", milestone.getName(), notification.getDaysBefore());
        return ideas > 0
                ? text + String.format(" We picked %d ideas for %s.", ideas, partner)
                : text;
    }

    /**
     * Record a delivered push. The push already went out, so a failing write is logged and never
     * turned into FAILED; the row stays claimed until the lease expires.
     */
    private Mono<NotificationStatus> markSent(Notification notification, List<UUID> recommendationIds) {
        Mono<Integer> update = notificationRepository.markSent(
                        notification.getId(), clock.instant(), recommendationIds.toArray(new UUID[0]))
                .retry(SENT_WRITE_RETRIES);
        return transition(notification, NotificationStatus.SENT, update)
                .onErrorResume(error -> {
                    log.error("Notification {} was pushed but could not be marked sent: {}",
                            notification.getId(), error.getMessage());
                    return Mono.just(NotificationStatus.SENT);
                });
    }

    private Mono<NotificationStatus> fail(Notification notification, String reason) {
        log.warn("Notification {} failed: {}", notification.getId(), reason);
        return transition(notification, NotificationStatus.FAILED, notificationRepository.markFailed(notification.getId(), reason));
    }

    private Mono<NotificationStatus> transition(Notification notification, NotificationStatus status, Mono<Integer> update) {
        return update.map(updated -> {
            if (updated == 0) {
                log.info("Notification {} was no longer claimed, skipping transition to {}", notification.getId(), status);
            }
            return status;
        });
    }

    /**
     * After a terminal state, yearly milestones get their next occurrence planned.
     */
    private Mono<NotificationStatus> replan(Milestone milestone, DeliveryTarget target, NotificationStatus status) {
        if (milestone.getRecurrence() != Recurrence.YEARLY) {
            return Mono.just(status);
        }
        return notificationScheduler.scheduleFor(milestone, target)
                .onErrorResume(error -> {
                    log.error("Re-scheduling milestone {} failed: {}", milestone.getId(), error.getMessage());
                    return Mono.just(List.of());
                })
                .thenReturn(status);
    }
}
