package com.knotcore.controller;

import com.knotcore.model.dto.DeviceTokenRequest;
import com.knotcore.model.dto.DeviceTokenResponse;
import com.knotcore.model.dto.NotificationPreferencesRequest;
import com.knotcore.model.dto.NotificationPreferencesResponse;
import com.knotcore.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for a user's notification settings and push device.
 */
@RestController
@RequestMapping("/v1/users/{userId}")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping("/notification-preferences")
    public Mono<NotificationPreferencesResponse> getPreferences(@PathVariable UUID userId) {
        return userService.getPreferences(userId);
    }

    @PutMapping("/notification-preferences")
    public Mono<NotificationPreferencesResponse> updatePreferences(
            @PathVariable UUID userId,
            @Valid @RequestBody NotificationPreferencesRequest request) {
        return userService.updatePreferences(userId, request);
    }

    @PostMapping("/device-token")
    public Mono<DeviceTokenResponse> registerDevice(
            @PathVariable UUID userId,
            @Valid @RequestBody DeviceTokenRequest request) {
        return userService.registerDevice(userId, request);
    }
}
