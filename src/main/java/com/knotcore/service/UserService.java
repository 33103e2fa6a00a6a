package com.knotcore.service;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.exception.ValidationException;
import com.knotcore.model.domain.QuietHours;
import com.knotcore.model.dto.DeviceTokenRequest;
import com.knotcore.model.dto.DeviceTokenResponse;
import com.knotcore.model.dto.NotificationPreferencesRequest;
import com.knotcore.model.dto.NotificationPreferencesResponse;
import com.knotcore.model.entity.UserAccount;
import com.knotcore.model.enums.DevicePlatform;
import com.knotcore.repository.MilestoneRepository;
import com.knotcore.repository.UserAccountRepository;
import com.knotcore.repository.VaultRepository;
import com.knotcore.service.scheduling.NotificationScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Notification settings and device registration of a user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserAccountRepository userAccountRepository;
    private final VaultRepository vaultRepository;
    private final MilestoneRepository milestoneRepository;
    private final NotificationScheduler notificationScheduler;
    private final Clock clock;

    public Mono<UserAccount> getUser(UUID userId) {
        return userAccountRepository.findById(userId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", userId)));
    }

    public Mono<NotificationPreferencesResponse> getPreferences(UUID userId) {
        return getUser(userId).map(NotificationPreferencesResponse::from);
    }

    /**
     * Apply a partial settings update. A new zone or quiet-hours window moves the user's
     * pending reminders to their new delivery instants.
     *
     * @param userId User ID
     * @param request Fields to change; null fields keep their value
     * @return Settings after the update
     */
    public Mono<NotificationPreferencesResponse> updatePreferences(UUID userId, NotificationPreferencesRequest request) {
        return getUser(userId)
                .flatMap(user -> {
                    String previousZone = user.getTimezone();
                    int previousStart = user.getQuietHoursStart();
                    int previousEnd = user.getQuietHoursEnd();

                    if (request.getNotificationsEnabled() != null) {
                        user.setNotificationsEnabled(request.getNotificationsEnabled());
                    }
                    if (request.getQuietHoursStart() != null) {
                        user.setQuietHoursStart(request.getQuietHoursStart());
                    }
                    if (request.getQuietHoursEnd() != null) {
                        user.setQuietHoursEnd(request.getQuietHoursEnd());
                    }
                    if (request.getTimezone() != null) {
                        user.setTimezone(validZone(request.getTimezone()));
                    }
                    new QuietHours(user.getQuietHoursStart(), user.getQuietHoursEnd());
                    user.setUpdatedAt(clock.instant());

                    boolean timingChanged = !Objects.equals(previousZone, user.getTimezone())
                            || previousStart != user.getQuietHoursStart()
                            || previousEnd != user.getQuietHoursEnd();
                    return userAccountRepository.save(user)
                            .flatMap(saved -> timingChanged
                                    ? rescheduleMilestones(saved).thenReturn(saved)
                                    : Mono.just(saved));
                })
                .map(NotificationPreferencesResponse::from);
    }

    /**
     * Store the push token of the user's device, replacing any previous one.
     */
    public Mono<DeviceTokenResponse> registerDevice(UUID userId, DeviceTokenRequest request) {
        String token = request.getDeviceToken().trim();
        DevicePlatform platform = request.getPlatform() != null ? request.getPlatform() : DevicePlatform.IOS;
        return getUser(userId)
                .flatMap(user -> {
                    String status = user.getDeviceToken() == null || user.getDeviceToken().isBlank()
                            ? "registered"
                            : "updated";
                    user.setDeviceToken(token);
                    user.setDevicePlatform(platform);
                    user.setUpdatedAt(clock.instant());
                    return userAccountRepository.save(user)
                            .doOnNext(saved -> log.info("Device token {} for user {} ({})", status, userId, platform))
                            .thenReturn(DeviceTokenResponse.builder()
                                    .status(status)
                                    .deviceToken(token)
                                    .platform(platform)
                                    .build());
                });
    }

    private Mono<Void> rescheduleMilestones(UserAccount user) {
        return vaultRepository.findByUserId(user.getId())
                .flatMapMany(vault -> milestoneRepository.findByVaultIdOrderByDateAsc(vault.getId()))
                .concatMap(milestone -> notificationScheduler.scheduleFor(milestone)
                        .onErrorResume(error -> {
                            log.error("Re-scheduling milestone {} after a settings change failed: {}",
                                    milestone.getId(), error.getMessage());
                            return Mono.just(List.of());
                        }))
                .count()
                .doOnNext(count -> log.info("Re-planned {} milestones of user {} for new delivery settings", count, user.getId()))
                .then();
    }

    private static String validZone(String timezone) {
        String trimmed = timezone.trim();
        try {
            return ZoneId.of(trimmed).getId();
        } catch (DateTimeException e) {
            throw new ValidationException("timezone", timezone, "is not a valid IANA time zone");
        }
    }
}
