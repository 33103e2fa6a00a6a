package com.knotcore.controller;

import com.knotcore.model.enums.NotificationStatus;
import com.knotcore.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoints. Dependency health is reported by Actuator under /actuator/health.
 */
@Slf4j
@RestController
@RequestMapping
@RequiredArgsConstructor
public class HealthController {

    private static final String VERSION = "1.0.0";

    private final NotificationRepository notificationRepository;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", "Knot Core",
            "version", VERSION
        ));
    }

    /**
     * Service status plus the notification backlog. A failing queue read reports "degraded".
     */
    @GetMapping("/v1/health")
    public Mono<Map<String, Object>> health() {
        return Mono.zip(
                notificationRepository.countByStatus(NotificationStatus.PENDING),
                notificationRepository.countByStatus(NotificationStatus.CLAIMED))
            .map(counts -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", "healthy");
                body.put("version", VERSION);
                body.put("pendingNotifications", counts.getT1());
                body.put("claimedNotifications", counts.getT2());
                return body;
            })
            .onErrorResume(error -> {
                log.warn("Notification queue unavailable: {}", error.getMessage());
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", "degraded");
                body.put("version", VERSION);
                return Mono.just(body);
            });
    }
}
