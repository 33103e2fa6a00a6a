package com.knotcore.service.scheduling;

import com.knotcore.model.entity.Notification;
import com.knotcore.model.enums.NotificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DeliveryWorker.
 */
@ExtendWith(MockitoExtension.class)
class DeliveryWorkerTest {

    private static final Instant NOW = Instant.parse("2025-05-27T13:00:00Z");

    @Mock
    private NotificationScheduler notificationScheduler;

    @Mock
    private NotificationDeliveryService notificationDeliveryService;

    private DeliveryWorker worker;

    @BeforeEach
    void setUp() {
        worker = new DeliveryWorker(notificationScheduler, notificationDeliveryService, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(worker, "batchSize", 10);
        ReflectionTestUtils.setField(worker, "concurrency", 2);
        ReflectionTestUtils.setField(worker, "claimLease", Duration.ofMinutes(10));
    }

    private static Notification due() {
        return Notification.builder().id(UUID.randomUUID()).status(NotificationStatus.PENDING).build();
    }

    @Test
    void runOnce_DeliversOnlyClaimedRows() {
        Notification won = due();
        Notification lost = due();
        when(notificationScheduler.expireStaleClaims(NOW.minus(Duration.ofMinutes(10)))).thenReturn(Mono.just(0L));
        when(notificationScheduler.dueNotifications(NOW, 10)).thenReturn(Flux.just(won, lost));
        when(notificationScheduler.claim(won)).thenReturn(Mono.just(true));
        when(notificationScheduler.claim(lost)).thenReturn(Mono.just(false));
        when(notificationDeliveryService.deliver(won)).thenReturn(Mono.just(NotificationStatus.SENT));

        StepVerifier.create(worker.runOnce())
                .assertNext(outcome -> assertThat(outcome).containsEntry(NotificationStatus.SENT, 1).hasSize(1))
                .verifyComplete();

        verify(notificationDeliveryService, never()).deliver(lost);
    }

    @Test
    void runOnce_OneFailureDoesNotStopTheTick() {
        Notification broken = due();
        Notification failing = due();
        Notification fine = due();
        when(notificationScheduler.expireStaleClaims(any())).thenReturn(Mono.just(0L));
        when(notificationScheduler.dueNotifications(NOW, 10)).thenReturn(Flux.just(broken, failing, fine));
        when(notificationScheduler.claim(any())).thenReturn(Mono.just(true));
        when(notificationDeliveryService.deliver(broken)).thenReturn(Mono.error(new IllegalStateException("db down")));
        when(notificationDeliveryService.deliver(failing)).thenReturn(Mono.just(NotificationStatus.FAILED));
        when(notificationDeliveryService.deliver(fine)).thenReturn(Mono.just(NotificationStatus.SENT));

        StepVerifier.create(worker.runOnce())
                .assertNext(outcome -> assertThat(outcome)
                        .containsEntry(NotificationStatus.SENT, 1)
                        .containsEntry(NotificationStatus.FAILED, 1))
                .verifyComplete();
    }

    @Test
    void runOnce_ClaimExpiryErrorStillDelivers() {
        Notification row = due();
        when(notificationScheduler.expireStaleClaims(any())).thenReturn(Mono.error(new IllegalStateException("boom")));
        when(notificationScheduler.dueNotifications(NOW, 10)).thenReturn(Flux.just(row));
        when(notificationScheduler.claim(row)).thenReturn(Mono.just(true));
        when(notificationDeliveryService.deliver(row)).thenReturn(Mono.just(NotificationStatus.PENDING));

        StepVerifier.create(worker.runOnce())
                .assertNext(outcome -> assertThat(outcome).containsEntry(NotificationStatus.PENDING, 1))
                .verifyComplete();
    }

    @Test
    void tick_QueryFailureIsLogged() {
        when(notificationScheduler.expireStaleClaims(any())).thenReturn(Mono.just(0L));
        when(notificationScheduler.dueNotifications(NOW, 10)).thenReturn(Flux.error(new IllegalStateException("db down")));

        worker.tick();

        verify(notificationDeliveryService, never()).deliver(any());
    }
}
