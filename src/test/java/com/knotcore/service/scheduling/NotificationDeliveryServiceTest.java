package com.knotcore.service.scheduling;

import com.knotcore.model.domain.DeliveryTarget;
import com.knotcore.model.domain.QuietHours;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.entity.Notification;
import com.knotcore.model.entity.UserAccount;
import com.knotcore.model.entity.Vault;
import com.knotcore.model.enums.BudgetTier;
import com.knotcore.model.enums.DevicePlatform;
import com.knotcore.model.enums.MilestoneType;
import com.knotcore.model.enums.NotificationStatus;
import com.knotcore.model.enums.Recurrence;
import com.knotcore.repository.MilestoneRepository;
import com.knotcore.repository.NotificationRepository;
import com.knotcore.service.push.PushDeliveryClient;
import com.knotcore.service.push.PushPayload;
import com.knotcore.service.scoring.RecommendationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for NotificationDeliveryService.
 */
@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private MilestoneRepository milestoneRepository;

    @Mock
    private DeliveryTargetResolver deliveryTargetResolver;

    @Mock
    private NotificationScheduler notificationScheduler;

    @Mock
    private RecommendationService recommendationService;

    @Mock
    private PushDeliveryClient pushDeliveryClient;

    private UserAccount user;
    private Milestone milestone;
    private Notification notification;
    private DeliveryTarget target;

    @BeforeEach
    void setUp() {
        user = UserAccount.builder()
                .id(UUID.randomUUID())
                .deviceToken("device-token")
                .devicePlatform(DevicePlatform.IOS)
                .notificationsEnabled(true)
                .build();
        Vault vault = Vault.builder().id(UUID.randomUUID()).userId(user.getId()).partnerName("Alex").build();
        milestone = Milestone.builder()
                .id(UUID.randomUUID())
                .vaultId(vault.getId())
                .type(MilestoneType.BIRTHDAY)
                .name("Alex's Birthday")
                .date(LocalDate.of(1995, 6, 10))
                .recurrence(Recurrence.YEARLY)
                .budgetTier(BudgetTier.MAJOR_MILESTONE)
                .build();
        notification = Notification.builder()
                .id(UUID.randomUUID())
                .userId(user.getId())
                .milestoneId(milestone.getId())
                .daysBefore(14)
                .occurrenceDate(LocalDate.of(2025, 6, 10))
                .scheduledFor(Instant.parse("2025-05-27T13:00:00Z"))
                .status(NotificationStatus.CLAIMED)
                .build();
        target = DeliveryTarget.builder()
                .user(user)
                .vault(vault)
                .zone(NEW_YORK)
                .quietHours(QuietHours.DEFAULT)
                .build();

        lenient().when(milestoneRepository.findById(milestone.getId())).thenReturn(Mono.just(milestone));
        lenient().when(deliveryTargetResolver.forMilestone(milestone)).thenReturn(Mono.just(target));
        lenient().when(notificationScheduler.scheduleFor(any(Milestone.class), any(DeliveryTarget.class)))
                .thenReturn(Mono.just(List.of()));
    }

    private NotificationDeliveryService serviceAt(String instant, Duration pushTimeout) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        NotificationDeliveryService service = new NotificationDeliveryService(notificationRepository,
                milestoneRepository, deliveryTargetResolver, new DeliveryTimeCalculator(9), notificationScheduler,
                recommendationService, pushDeliveryClient, clock);
        ReflectionTestUtils.setField(service, "pushTimeout", pushTimeout);
        ReflectionTestUtils.setField(service, "recommendationsPerNotification", 3);
        return service;
    }

    @Test
    void deliver_SendsWithAttachedRecommendations() {
        UUID recommendationId = UUID.randomUUID();
        when(recommendationService.recommendForMilestone(milestone, 3)).thenReturn(Mono.just(List.of(recommendationId)));
        when(pushDeliveryClient.send(eq("device-token"), eq(DevicePlatform.IOS), any())).thenReturn(Mono.empty());
        when(notificationRepository.markSent(eq(notification.getId()), any(), any())).thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofSeconds(5)).deliver(notification))
                .expectNext(NotificationStatus.SENT)
                .verifyComplete();

        ArgumentCaptor<PushPayload> payload = ArgumentCaptor.forClass(PushPayload.class);
        verify(pushDeliveryClient).send(eq("device-token"), eq(DevicePlatform.IOS), payload.capture());
        assertThat(payload.getValue().getRecommendationIds()).containsExactly(recommendationId);
        assertThat(payload.getValue().getBody()).contains("14 days").contains("Alex");
        verify(notificationRepository).markSent(eq(notification.getId()), eq(Instant.parse("2025-05-27T13:00:00Z")),
                argThat(ids -> ids.length == 1 && ids[0].equals(recommendationId)));
        verify(notificationScheduler).scheduleFor(milestone, target);
    }

    @Test
    void deliver_PushTimeoutMarksFailed() {
        when(recommendationService.recommendForMilestone(milestone, 3)).thenReturn(Mono.just(List.of()));
        when(pushDeliveryClient.send(any(), any(), any())).thenReturn(Mono.never());
        when(notificationRepository.markFailed(eq(notification.getId()), startsWith("Push delivery timed out")))
                .thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofMillis(50)).deliver(notification))
                .expectNext(NotificationStatus.FAILED)
                .verifyComplete();

        verify(notificationRepository, never()).markSent(any(), any(), any());
    }

    @Test
    void deliver_PushErrorMarksFailed() {
        when(recommendationService.recommendForMilestone(milestone, 3)).thenReturn(Mono.just(List.of()));
        when(pushDeliveryClient.send(any(), any(), any()))
                .thenReturn(Mono.error(new IllegalStateException("token unregistered")));
        when(notificationRepository.markFailed(notification.getId(), "Push delivery failed: token unregistered"))
                .thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofSeconds(5)).deliver(notification))
                .expectNext(NotificationStatus.FAILED)
                .verifyComplete();
    }

    @Test
    void deliver_FanOutFailureStillSends() {
        when(recommendationService.recommendForMilestone(milestone, 3))
                .thenReturn(Mono.error(new IllegalStateException("scorer down")));
        when(pushDeliveryClient.send(any(), any(), any())).thenReturn(Mono.empty());
        when(notificationRepository.markSent(eq(notification.getId()), any(), any())).thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofSeconds(5)).deliver(notification))
                .expectNext(NotificationStatus.SENT)
                .verifyComplete();

        verify(notificationRepository).markSent(eq(notification.getId()), any(), argThat(ids -> ids.length == 0));
    }

    @Test
    void deliver_NotificationsDisabledCancels() {
        user.setNotificationsEnabled(false);
        when(notificationRepository.cancelClaimed(notification.getId())).thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofSeconds(5)).deliver(notification))
                .expectNext(NotificationStatus.CANCELLED)
                .verifyComplete();

        verify(pushDeliveryClient, never()).send(any(), any(), any());
        verify(recommendationService, never()).recommendForMilestone(any(), anyInt());
    }

    @Test
    void deliver_InsideQuietHoursDefersToWindowEnd() {
        // 23:00 in New York
        when(notificationRepository.release(notification.getId(), Instant.parse("2025-05-28T12:00:00Z")))
                .thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-28T03:00:00Z", Duration.ofSeconds(5)).deliver(notification))
                .expectNext(NotificationStatus.PENDING)
                .verifyComplete();

        verify(pushDeliveryClient, never()).send(any(), any(), any());
        verify(notificationScheduler, never()).scheduleFor(any(Milestone.class), any(DeliveryTarget.class));
    }

    @Test
    void deliver_NoDeviceMarksFailed() {
        user.setDeviceToken(null);
        when(notificationRepository.markFailed(notification.getId(), "No device registered")).thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofSeconds(5)).deliver(notification))
                .expectNext(NotificationStatus.FAILED)
                .verifyComplete();
    }

    @Test
    void deliver_MissingMilestoneMarksFailed() {
        Notification orphan = Notification.builder()
                .id(UUID.randomUUID())
                .milestoneId(UUID.randomUUID())
                .daysBefore(7)
                .status(NotificationStatus.CLAIMED)
                .build();
        when(milestoneRepository.findById(orphan.getMilestoneId())).thenReturn(Mono.empty());
        when(notificationRepository.markFailed(orphan.getId(), "Milestone no longer exists")).thenReturn(Mono.just(1));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofSeconds(5)).deliver(orphan))
                .expectNext(NotificationStatus.FAILED)
                .verifyComplete();
    }

    @Test
    void deliver_SentWriteFailureAfterPushStaysSent() {
        AtomicInteger attempts = new AtomicInteger();
        when(recommendationService.recommendForMilestone(milestone, 3)).thenReturn(Mono.just(List.of()));
        when(pushDeliveryClient.send(eq("device-token"), eq(DevicePlatform.IOS), any())).thenReturn(Mono.empty());
        when(notificationRepository.markSent(eq(notification.getId()), any(), any())).thenReturn(Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new IllegalStateException("connection reset"));
        }));

        StepVerifier.create(serviceAt("2025-05-27T13:00:00Z", Duration.ofSeconds(5)).deliver(notification))
                .expectNext(NotificationStatus.SENT)
                .verifyComplete();

        assertThat(attempts.get()).isEqualTo(3);
        verify(notificationRepository, never()).markFailed(any(), any());
    }
}
