package com.knotcore.service.scheduling;

import com.knotcore.model.domain.DeliveryTarget;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.entity.Notification;
import com.knotcore.model.enums.NotificationStatus;
import com.knotcore.model.enums.Recurrence;
import com.knotcore.repository.MilestoneRepository;
import com.knotcore.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps the notification queue in line with milestones: one pending reminder per lead time
 * for the next reachable occurrence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationScheduler {

    /**
     * Lead times in days before an occurrence.
     */
    public static final List<Integer> LEAD_DAYS = List.of(14, 7, 3);

    static final String CLAIM_EXPIRED = "Delivery did not finish within the claim lease";

    private final NotificationRepository notificationRepository;
    private final MilestoneRepository milestoneRepository;
    private final DeliveryTargetResolver deliveryTargetResolver;
    private final DeliveryTimeCalculator deliveryTimeCalculator;
    private final Clock clock;

    /**
     * Schedule a milestone by ID; a missing milestone is a no-op.
     */
    public Mono<List<Notification>> scheduleFor(UUID milestoneId) {
        return milestoneRepository.findById(milestoneId)
                .flatMap(this::scheduleFor)
                .defaultIfEmpty(List.of());
    }

    public Mono<List<Notification>> scheduleFor(Milestone milestone) {
        return deliveryTargetResolver.forMilestone(milestone)
                .flatMap(target -> scheduleFor(milestone, target));
    }

    /**
     * Bring the live rows of a milestone in line with its next reachable occurrence. Idempotent:
     * unchanged inputs leave the queue untouched.
     *
     * @param milestone Milestone
     * @param target Recipient with zone and quiet hours
     * @return Live rows of the milestone after this pass
     */
    public Mono<List<Notification>> scheduleFor(Milestone milestone, DeliveryTarget target) {
        Instant now = clock.instant();
        return notificationRepository.findByMilestoneId(milestone.getId())
                .collectList()
                .flatMap(existing -> {
                    Optional<LocalDate> occurrence = chooseOccurrence(milestone, target, existing, now);
                    List<Mono<Notification>> steps = new ArrayList<>();

                    // Pending rows announcing another occurrence are stale
                    for (Notification row : existing) {
                        if (row.getStatus() == NotificationStatus.PENDING
                                && (occurrence.isEmpty() || !row.getOccurrenceDate().equals(occurrence.get()))) {
                            steps.add(notificationRepository.cancelIfPending(row.getId()).then(Mono.<Notification>empty()));
                        }
                    }
                    if (occurrence.isPresent()) {
                        for (int leadDays : LEAD_DAYS) {
                            steps.add(planLead(milestone, target, occurrence.get(), leadDays, existing, now));
                        }
                    }
                    return Flux.concat(steps).collectList();
                })
                .doOnNext(live -> log.debug("Milestone {} has {} live notifications", milestone.getId(), live.size()));
    }

    /**
     * Cancel every pending notification of a milestone.
     *
     * @return Number of rows cancelled
     */
    public Mono<Integer> cancelFor(UUID milestoneId) {
        return notificationRepository.cancelPendingByMilestoneId(milestoneId)
                .doOnNext(cancelled -> log.info("Cancelled {} pending notifications of milestone {}", cancelled, milestoneId));
    }

    /**
     * Pending rows due at {@code now}, oldest first.
     */
    public Flux<Notification> dueNotifications(Instant now, int limit) {
        return notificationRepository.findDue(now, limit);
    }

    /**
     * Try to take ownership of a pending row. Only one caller wins.
     */
    public Mono<Boolean> claim(Notification notification) {
        return notificationRepository.claim(notification.getId(), clock.instant())
                .map(updated -> updated > 0);
    }

    /**
     * Fail claims older than the lease and re-plan their yearly milestones.
     *
     * @param cutoff Claims taken before this instant are expired
     * @return Number of expired claims
     */
    public Mono<Long> expireStaleClaims(Instant cutoff) {
        return notificationRepository.expireClaims(cutoff, CLAIM_EXPIRED)
                .doOnNext(row -> log.warn("Notification {} failed: claim lease expired", row.getId()))
                .concatMap(row -> milestoneRepository.findById(row.getMilestoneId())
                        .filter(milestone -> milestone.getRecurrence() == Recurrence.YEARLY)
                        .flatMap(this::scheduleFor)
                        .onErrorResume(error -> {
                            log.error("Re-scheduling milestone {} failed: {}", row.getMilestoneId(), error.getMessage());
                            return Mono.empty();
                        })
                        .thenReturn(row))
                .count();
    }

    /**
     * Earliest occurrence with at least one reachable lead time. A lead is reachable when its
     * delivery instant is in the future and it was not already sent or failed for that occurrence.
     */
    private Optional<LocalDate> chooseOccurrence(Milestone milestone, DeliveryTarget target,
                                                 List<Notification> existing, Instant now) {
        LocalDate today = now.atZone(target.getZone()).toLocalDate();
        Optional<LocalDate> candidate = MilestoneOccurrences.next(milestone, today);
        // A yearly milestone is always reachable within two occurrences
        for (int attempt = 0; attempt < 2 && candidate.isPresent(); attempt++) {
            LocalDate occurrence = candidate.get();
            for (int leadDays : LEAD_DAYS) {
                if (isReachable(occurrence, leadDays, target, existing, now)) {
                    return candidate;
                }
            }
            if (milestone.getRecurrence() != Recurrence.YEARLY) {
                return Optional.empty();
            }
            candidate = MilestoneOccurrences.next(milestone, occurrence.plusDays(1));
        }
        return Optional.empty();
    }

    private boolean isReachable(LocalDate occurrence, int leadDays, DeliveryTarget target,
                                List<Notification> existing, Instant now) {
        if (alreadyDelivered(occurrence, leadDays, existing)) {
            return false;
        }
        // A pending row that is already due still counts until the worker picks it up
        if (liveRow(occurrence, leadDays, existing).isPresent()) {
            return true;
        }
        Instant at = deliveryTimeCalculator.deliveryInstant(occurrence, leadDays, target.getZone(), target.getQuietHours());
        return at.isAfter(now);
    }

    private Mono<Notification> planLead(Milestone milestone, DeliveryTarget target, LocalDate occurrence,
                                        int leadDays, List<Notification> existing, Instant now) {
        if (alreadyDelivered(occurrence, leadDays, existing)) {
            return Mono.empty();
        }
        Instant at = deliveryTimeCalculator.deliveryInstant(occurrence, leadDays, target.getZone(), target.getQuietHours());

        Optional<Notification> live = existing.stream()
                .filter(row -> row.getStatus().isLive() && row.getDaysBefore() == leadDays)
                .findFirst();
        if (live.isPresent()) {
            Notification row = live.get();
            if (row.getStatus() == NotificationStatus.CLAIMED) {
                // Being delivered; re-planned once it reaches a terminal state
                return Mono.just(row);
            }
            if (occurrence.equals(row.getOccurrenceDate())) {
                if (at.equals(row.getScheduledFor()) || !at.isAfter(now)) {
                    return Mono.just(row);
                }
                log.debug("Rescheduling notification {} from {} to {}", row.getId(), row.getScheduledFor(), at);
                return notificationRepository.reschedule(row.getId(), at)
                        .map(updated -> {
                            row.setScheduledFor(at);
                            return row;
                        });
            }
            // A row for another occurrence was cancelled above
        }
        if (!at.isAfter(now)) {
            // Never backdate
            return Mono.empty();
        }

        Notification fresh = Notification.builder()
                .userId(target.getUser().getId())
                .milestoneId(milestone.getId())
                .daysBefore(leadDays)
                .occurrenceDate(occurrence)
                .scheduledFor(at)
                .status(NotificationStatus.PENDING)
                .createdAt(now)
                .build();
        return notificationRepository.save(fresh)
                .doOnNext(saved -> log.info("Scheduled {}-day notification {} for milestone {} at {}",
                        leadDays, saved.getId(), milestone.getId(), at))
                .onErrorResume(DuplicateKeyException.class, e -> {
                    log.debug("Concurrent pass already queued the {}-day notification of milestone {}",
                            leadDays, milestone.getId());
                    return concurrentLiveRow(milestone.getId(), leadDays);
                });
    }

    /**
     * Live row written by a scheduling pass that won the insert race.
     */
    private Mono<Notification> concurrentLiveRow(UUID milestoneId, int leadDays) {
        return notificationRepository.findByMilestoneId(milestoneId)
                .filter(row -> row.getStatus().isLive() && row.getDaysBefore() == leadDays)
                .next();
    }

    private static boolean alreadyDelivered(LocalDate occurrence, int leadDays, List<Notification> existing) {
        return existing.stream().anyMatch(row -> row.getStatus().isDelivered()
                && row.getDaysBefore() == leadDays
                && occurrence.equals(row.getOccurrenceDate()));
    }

    private static Optional<Notification> liveRow(LocalDate occurrence, int leadDays, List<Notification> existing) {
        return existing.stream()
                .filter(row -> row.getStatus().isLive()
                        && row.getDaysBefore() == leadDays
                        && occurrence.equals(row.getOccurrenceDate()))
                .findFirst();
    }
}
