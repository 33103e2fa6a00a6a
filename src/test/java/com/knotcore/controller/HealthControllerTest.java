package com.knotcore.controller;

import com.knotcore.model.enums.NotificationStatus;
import com.knotcore.repository.NotificationRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.when;

/**
 * Integration tests for HealthController.
 */
@WebFluxTest(controllers = HealthController.class)
class HealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private NotificationRepository notificationRepository;

    @Test
    void root_ReturnsServiceInfo() {
        webTestClient.get()
                .uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("Knot Core")
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void health_ReportsQueueBacklog() {
        when(notificationRepository.countByStatus(NotificationStatus.PENDING)).thenReturn(Mono.just(12L));
        when(notificationRepository.countByStatus(NotificationStatus.CLAIMED)).thenReturn(Mono.just(2L));

        webTestClient.get()
                .uri("/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.version").isEqualTo("1.0.0")
                .jsonPath("$.pendingNotifications").isEqualTo(12)
                .jsonPath("$.claimedNotifications").isEqualTo(2);
    }

    @Test
    void health_QueueUnavailable_ReportsDegraded() {
        when(notificationRepository.countByStatus(NotificationStatus.PENDING))
                .thenReturn(Mono.error(new IllegalStateException("connection refused")));
        when(notificationRepository.countByStatus(NotificationStatus.CLAIMED)).thenReturn(Mono.just(0L));

        webTestClient.get()
                .uri("/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded")
                .jsonPath("$.pendingNotifications").doesNotExist();
    }
}
