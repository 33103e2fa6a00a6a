package com.knotcore.controller;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.model.dto.FeedbackRequest;
import com.knotcore.model.dto.FeedbackResponse;
import com.knotcore.model.dto.RecommendationRequest;
import com.knotcore.model.dto.RecommendationResponse;
import com.knotcore.model.enums.FeedbackAction;
import com.knotcore.model.enums.RecommendationType;
import com.knotcore.model.enums.VibeTag;
import com.knotcore.service.learning.FeedbackService;
import com.knotcore.service.scoring.RecommendationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Integration tests for RecommendationController.
 */
@WebFluxTest(controllers = RecommendationController.class)
class RecommendationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RecommendationService recommendationService;

    @MockBean
    private FeedbackService feedbackService;

    @Test
    void generateRecommendations_ReturnsRankedList() {
        UUID vaultId = UUID.randomUUID();
        RecommendationResponse first = RecommendationResponse.builder()
                .id(UUID.randomUUID())
                .vaultId(vaultId)
                .type(RecommendationType.EXPERIENCE)
                .title("Pasta-making class")
                .finalScore(0.82)
                .build();
        RecommendationResponse second = RecommendationResponse.builder()
                .id(UUID.randomUUID())
                .vaultId(vaultId)
                .type(RecommendationType.GIFT)
                .title("Chef's knife")
                .finalScore(0.61)
                .build();
        when(recommendationService.generate(eq(vaultId), any(RecommendationRequest.class)))
                .thenReturn(Flux.just(first, second));

        webTestClient.post()
                .uri("/v1/vaults/{vaultId}/recommendations", vaultId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"limit\":2,\"vibeOverride\":[\"romantic\"]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].title").isEqualTo("Pasta-making class")
                .jsonPath("$[1].type").isEqualTo("GIFT");

        ArgumentCaptor<RecommendationRequest> captor = ArgumentCaptor.forClass(RecommendationRequest.class);
        verify(recommendationService).generate(eq(vaultId), captor.capture());
        assertThat(captor.getValue().getLimit()).isEqualTo(2);
        assertThat(captor.getValue().getVibeOverride()).containsExactly(VibeTag.ROMANTIC);
    }

    @Test
    void generateRecommendations_LimitOutOfRangeRejected() {
        webTestClient.post()
                .uri("/v1/vaults/{vaultId}/recommendations", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"limit\":11}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").value(detail -> assertThat((String) detail).contains("limit"));

        verify(recommendationService, never()).generate(any(), any());
    }

    @Test
    void selectRecommendation_UnknownId_NotFound() {
        UUID recommendationId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        when(recommendationService.confirmSelection(recommendationId, userId))
                .thenReturn(Mono.error(new ResourceNotFoundException("Recommendation", recommendationId)));

        webTestClient.post()
                .uri("/v1/recommendations/{id}/select", recommendationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":\"" + userId + "\"}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.traceId").exists();
    }

    @Test
    void recordFeedback_Created() {
        UUID recommendationId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        FeedbackResponse response = FeedbackResponse.builder()
                .id(UUID.randomUUID())
                .recommendationId(recommendationId)
                .action(FeedbackAction.RATED)
                .rating(5)
                .build();
        when(feedbackService.record(eq(recommendationId), any(FeedbackRequest.class))).thenReturn(Mono.just(response));

        webTestClient.post()
                .uri("/v1/recommendations/{id}/feedback", recommendationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":\"" + userId + "\",\"action\":\"RATED\",\"rating\":5}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.action").isEqualTo("RATED")
                .jsonPath("$.rating").isEqualTo(5);
    }

    @Test
    void recordFeedback_RatingOutOfRangeRejected() {
        webTestClient.post()
                .uri("/v1/recommendations/{id}/feedback", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":\"" + UUID.randomUUID() + "\",\"action\":\"RATED\",\"rating\":9}")
                .exchange()
                .expectStatus().isBadRequest();

        verify(feedbackService, never()).record(any(), any());
    }
}
