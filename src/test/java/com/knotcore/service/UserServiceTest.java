package com.knotcore.service;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.exception.ValidationException;
import com.knotcore.model.dto.DeviceTokenRequest;
import com.knotcore.model.dto.NotificationPreferencesRequest;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.entity.UserAccount;
import com.knotcore.model.entity.Vault;
import com.knotcore.model.enums.DevicePlatform;
import com.knotcore.model.enums.MilestoneType;
import com.knotcore.repository.MilestoneRepository;
import com.knotcore.repository.UserAccountRepository;
import com.knotcore.repository.VaultRepository;
import com.knotcore.service.scheduling.NotificationScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for UserService.
 */
@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final Instant NOW = Instant.parse("2025-05-01T12:00:00Z");

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private VaultRepository vaultRepository;

    @Mock
    private MilestoneRepository milestoneRepository;

    @Mock
    private NotificationScheduler notificationScheduler;

    private UserService userService;
    private UserAccount user;
    private Vault vault;

    @BeforeEach
    void setUp() {
        userService = new UserService(userAccountRepository, vaultRepository, milestoneRepository,
                notificationScheduler, Clock.fixed(NOW, ZoneOffset.UTC));
        user = UserAccount.builder()
                .id(UUID.randomUUID())
                .email("sam@example.com")
                .timezone("America/New_York")
                .build();
        vault = Vault.builder().id(UUID.randomUUID()).userId(user.getId()).build();

        lenient().when(userAccountRepository.findById(user.getId())).thenReturn(Mono.just(user));
        lenient().when(userAccountRepository.save(any(UserAccount.class)))
                .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(vaultRepository.findByUserId(user.getId())).thenReturn(Mono.just(vault));
    }

    private Milestone milestone(String name) {
        return Milestone.builder()
                .id(UUID.randomUUID())
                .vaultId(vault.getId())
                .type(MilestoneType.BIRTHDAY)
                .name(name)
                .date(LocalDate.of(1995, 6, 10))
                .build();
    }

    @Test
    void getPreferences_ReturnsDefaultsForNewUser() {
        StepVerifier.create(userService.getPreferences(user.getId()))
                .assertNext(preferences -> {
                    assertThat(preferences.isNotificationsEnabled()).isTrue();
                    assertThat(preferences.getQuietHoursStart()).isEqualTo(22);
                    assertThat(preferences.getQuietHoursEnd()).isEqualTo(8);
                    assertThat(preferences.getTimezone()).isEqualTo("America/New_York");
                })
                .verifyComplete();
    }

    @Test
    void getPreferences_UnknownUserFails() {
        UUID missing = UUID.randomUUID();
        when(userAccountRepository.findById(missing)).thenReturn(Mono.empty());

        StepVerifier.create(userService.getPreferences(missing))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void updatePreferences_TogglePreservesOtherFieldsWithoutReplanning() {
        NotificationPreferencesRequest request = NotificationPreferencesRequest.builder()
                .notificationsEnabled(false)
                .build();

        StepVerifier.create(userService.updatePreferences(user.getId(), request))
                .assertNext(preferences -> {
                    assertThat(preferences.isNotificationsEnabled()).isFalse();
                    assertThat(preferences.getQuietHoursStart()).isEqualTo(22);
                    assertThat(preferences.getQuietHoursEnd()).isEqualTo(8);
                    assertThat(preferences.getTimezone()).isEqualTo("America/New_York");
                })
                .verifyComplete();

        assertThat(user.getUpdatedAt()).isEqualTo(NOW);
        verify(vaultRepository, never()).findByUserId(any());
        verify(notificationScheduler, never()).scheduleFor(any(Milestone.class));
    }

    @Test
    void updatePreferences_ZoneChangeReplansEveryMilestone() {
        Milestone birthday = milestone("Birthday");
        Milestone anniversary = milestone("Anniversary");
        when(milestoneRepository.findByVaultIdOrderByDateAsc(vault.getId()))
                .thenReturn(Flux.just(birthday, anniversary));
        when(notificationScheduler.scheduleFor(any(Milestone.class))).thenReturn(Mono.just(List.of()));

        NotificationPreferencesRequest request = NotificationPreferencesRequest.builder()
                .timezone("Asia/Tokyo")
                .build();

        StepVerifier.create(userService.updatePreferences(user.getId(), request))
                .assertNext(preferences -> assertThat(preferences.getTimezone()).isEqualTo("Asia/Tokyo"))
                .verifyComplete();

        ArgumentCaptor<Milestone> replanned = ArgumentCaptor.forClass(Milestone.class);
        verify(notificationScheduler, times(2)).scheduleFor(replanned.capture());
        assertThat(replanned.getAllValues()).containsExactly(birthday, anniversary);
    }

    @Test
    void updatePreferences_QuietHoursChangeReplansAndSurvivesOneFailure() {
        Milestone birthday = milestone("Birthday");
        Milestone anniversary = milestone("Anniversary");
        when(milestoneRepository.findByVaultIdOrderByDateAsc(vault.getId()))
                .thenReturn(Flux.just(birthday, anniversary));
        when(notificationScheduler.scheduleFor(birthday)).thenReturn(Mono.error(new IllegalStateException("db down")));
        when(notificationScheduler.scheduleFor(anniversary)).thenReturn(Mono.just(List.of()));

        NotificationPreferencesRequest request = NotificationPreferencesRequest.builder()
                .quietHoursStart(23)
                .quietHoursEnd(7)
                .build();

        StepVerifier.create(userService.updatePreferences(user.getId(), request))
                .assertNext(preferences -> {
                    assertThat(preferences.getQuietHoursStart()).isEqualTo(23);
                    assertThat(preferences.getQuietHoursEnd()).isEqualTo(7);
                })
                .verifyComplete();

        verify(notificationScheduler).scheduleFor(anniversary);
    }

    @Test
    void updatePreferences_SameValuesDoNotReplan() {
        NotificationPreferencesRequest request = NotificationPreferencesRequest.builder()
                .quietHoursStart(22)
                .timezone("America/New_York")
                .build();

        StepVerifier.create(userService.updatePreferences(user.getId(), request))
                .expectNextCount(1)
                .verifyComplete();

        verify(notificationScheduler, never()).scheduleFor(any(Milestone.class));
    }

    @Test
    void updatePreferences_InvalidZoneRejectedWithoutSaving() {
        NotificationPreferencesRequest request = NotificationPreferencesRequest.builder()
                .timezone("Mars/Olympus_Mons")
                .build();

        StepVerifier.create(userService.updatePreferences(user.getId(), request))
                .expectError(ValidationException.class)
                .verify();

        verify(userAccountRepository, never()).save(any());
    }

    @Test
    void updatePreferences_OutOfRangeQuietHoursRejectedWithoutSaving() {
        NotificationPreferencesRequest request = NotificationPreferencesRequest.builder()
                .quietHoursStart(24)
                .build();

        StepVerifier.create(userService.updatePreferences(user.getId(), request))
                .expectError(ValidationException.class)
                .verify();

        verify(userAccountRepository, never()).save(any());
        verify(notificationScheduler, never()).scheduleFor(any(Milestone.class));
    }

    @Test
    void registerDevice_FirstTokenIsRegistered() {
        DeviceTokenRequest request = DeviceTokenRequest.builder()
                .deviceToken("  abc123  ")
                .platform(DevicePlatform.ANDROID)
                .build();

        StepVerifier.create(userService.registerDevice(user.getId(), request))
                .assertNext(response -> {
                    assertThat(response.getStatus()).isEqualTo("registered");
                    assertThat(response.getDeviceToken()).isEqualTo("abc123");
                    assertThat(response.getPlatform()).isEqualTo(DevicePlatform.ANDROID);
                })
                .verifyComplete();

        assertThat(user.getDeviceToken()).isEqualTo("abc123");
        assertThat(user.getDevicePlatform()).isEqualTo(DevicePlatform.ANDROID);
    }

    @Test
    void registerDevice_ReplacingTokenIsUpdatedAndDefaultsToIos() {
        user.setDeviceToken("old-token");
        user.setDevicePlatform(DevicePlatform.ANDROID);
        DeviceTokenRequest request = DeviceTokenRequest.builder()
                .deviceToken("new-token")
                .platform(null)
                .build();

        StepVerifier.create(userService.registerDevice(user.getId(), request))
                .assertNext(response -> {
                    assertThat(response.getStatus()).isEqualTo("updated");
                    assertThat(response.getPlatform()).isEqualTo(DevicePlatform.IOS);
                })
                .verifyComplete();

        assertThat(user.getDeviceToken()).isEqualTo("new-token");
    }
}
