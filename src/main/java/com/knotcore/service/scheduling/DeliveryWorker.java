package com.knotcore.service.scheduling;

import com.knotcore.model.enums.NotificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic delivery tick: expires stale claims, then claims and delivers due notifications
 * with bounded parallelism. Safe to run on several instances; each row is delivered by the claim winner only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryWorker {

    private final NotificationScheduler notificationScheduler;
    private final NotificationDeliveryService notificationDeliveryService;
    private final Clock clock;

    @Value("${knot.scheduler.batch-size:100}")
    private int batchSize;

    @Value("${knot.scheduler.worker-concurrency:4}")
    private int concurrency;

    @Value("${knot.scheduler.claim-lease:PT10M}")
    private Duration claimLease;

    @Scheduled(fixedDelayString = "${knot.scheduler.tick-interval-ms:60000}")
    public void tick() {
        try {
            Map<NotificationStatus, Integer> outcome = runOnce().block(claimLease);
            if (outcome != null && !outcome.isEmpty()) {
                log.info("Delivery tick finished: {}", outcome);
            }
        } catch (Exception e) {
            log.error("Delivery tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One delivery pass.
     *
     * @return Count of processed notifications per resulting status
     */
    public Mono<Map<NotificationStatus, Integer>> runOnce() {
        Instant now = clock.instant();
        return notificationScheduler.expireStaleClaims(now.minus(claimLease))
                .onErrorResume(error -> {
                    log.error("Expiring stale claims failed: {}", error.getMessage());
                    return Mono.just(0L);
                })
                .thenMany(notificationScheduler.dueNotifications(now, batchSize))
                .flatMap(notification -> notificationScheduler.claim(notification)
                        .filter(Boolean::booleanValue)
                        .flatMap(won -> notificationDeliveryService.deliver(notification))
                        .onErrorResume(error -> {
                            log.error("Processing notification {} failed: {}", notification.getId(), error.getMessage());
                            return Mono.empty();
                        }), concurrency)
                .collectList()
                .map(DeliveryWorker::tally);
    }

    private static Map<NotificationStatus, Integer> tally(List<NotificationStatus> statuses) {
        Map<NotificationStatus, Integer> counts = new EnumMap<>(NotificationStatus.class);
        statuses.forEach(status -> counts.merge(status, 1, Integer::sum));
        return counts;
    }
}
