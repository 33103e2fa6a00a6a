package com.knotcore.service.learning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knotcore.model.entity.Feedback;
import com.knotcore.model.entity.Recommendation;
import com.knotcore.model.enums.FeedbackAction;
import com.knotcore.model.enums.RecommendationType;
import com.knotcore.repository.FeedbackRepository;
import com.knotcore.repository.PreferenceWeightsRepository;
import com.knotcore.repository.RecommendationRepository;
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
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FeedbackAnalysisService with the real learner and weight serialization.
 */
@ExtendWith(MockitoExtension.class)
class FeedbackAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2025-05-05T03:00:00Z");

    @Mock
    private FeedbackRepository feedbackRepository;

    @Mock
    private RecommendationRepository recommendationRepository;

    @Mock
    private PreferenceWeightsRepository preferenceWeightsRepository;

    private FeedbackAnalysisService service;
    private UUID userId;
    private Recommendation recommendation;

    @BeforeEach
    void setUp() {
        PreferenceWeightsService weightsService = new PreferenceWeightsService(preferenceWeightsRepository, new ObjectMapper());
        service = new FeedbackAnalysisService(feedbackRepository, recommendationRepository,
                new PreferenceWeightLearner(1.0, 3.0), weightsService, Clock.fixed(NOW, ZoneOffset.UTC));
        userId = UUID.randomUUID();
        recommendation = Recommendation.builder()
                .id(UUID.randomUUID())
                .type(RecommendationType.EXPERIENCE)
                .title("Pasta class")
                .matchedInterests(List.of("COOKING"))
                .matchedVibes(List.of("BOHEMIAN"))
                .matchedLoveLanguages(List.of("QUALITY_TIME"))
                .build();
    }

    private Feedback feedback(FeedbackAction action) {
        return Feedback.builder()
                .id(UUID.randomUUID())
                .recommendationId(recommendation.getId())
                .userId(userId)
                .action(action)
                .build();
    }

    @Test
    void analyzeUser_StoresLearnedSnapshot() {
        when(feedbackRepository.findByUserId(userId)).thenReturn(Flux.just(
                feedback(FeedbackAction.SELECTED), feedback(FeedbackAction.SAVED), feedback(FeedbackAction.SHARED)));
        when(recommendationRepository.findAllById(any(Iterable.class))).thenReturn(Flux.just(recommendation));
        when(preferenceWeightsRepository.upsertIfNewer(eq(userId), anyString(), anyString(), anyString(), anyString(),
                eq(3), eq(NOW))).thenReturn(Mono.just(1));

        StepVerifier.create(service.analyzeUser(userId))
                .assertNext(result -> {
                    assertThat(result.isApplied()).isTrue();
                    assertThat(result.getFeedbackCount()).isEqualTo(3);
                    assertThat(result.getAnalyzedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

        ArgumentCaptor<String> interests = ArgumentCaptor.forClass(String.class);
        verify(preferenceWeightsRepository).upsertIfNewer(eq(userId), anyString(), interests.capture(), anyString(),
                anyString(), eq(3), eq(NOW));
        assertThat(interests.getValue()).isEqualTo("{\"COOKING\":1.5}");
    }

    @Test
    void analyzeUser_NewerSnapshotWins() {
        when(feedbackRepository.findByUserId(userId)).thenReturn(Flux.just(feedback(FeedbackAction.SELECTED)));
        when(recommendationRepository.findAllById(any(Iterable.class))).thenReturn(Flux.just(recommendation));
        when(preferenceWeightsRepository.upsertIfNewer(any(), any(), any(), any(), any(), anyInt(), any()))
                .thenReturn(Mono.just(0));

        StepVerifier.create(service.analyzeUser(userId))
                .assertNext(result -> assertThat(result.isApplied()).isFalse())
                .verifyComplete();
    }

    @Test
    void analyzeAll_CountsFailuresAndContinues() {
        UUID broken = UUID.randomUUID();
        when(feedbackRepository.findUserIdsWithFeedback()).thenReturn(Flux.just(broken, userId));
        when(feedbackRepository.findByUserId(broken)).thenReturn(Flux.error(new IllegalStateException("db down")));
        when(feedbackRepository.findByUserId(userId)).thenReturn(Flux.just(feedback(FeedbackAction.SELECTED)));
        when(recommendationRepository.findAllById(any(Iterable.class))).thenReturn(Flux.just(recommendation));
        when(preferenceWeightsRepository.upsertIfNewer(any(), any(), any(), any(), any(), anyInt(), any()))
                .thenReturn(Mono.just(1));

        StepVerifier.create(service.analyzeAll())
                .assertNext(summary -> {
                    assertThat(summary.getApplied()).isEqualTo(1);
                    assertThat(summary.getRejected()).isZero();
                    assertThat(summary.getFailed()).isEqualTo(1);
                })
                .verifyComplete();
    }
}
