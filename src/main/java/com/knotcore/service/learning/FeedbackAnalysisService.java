package com.knotcore.service.learning;

import com.knotcore.model.domain.FeedbackSignal;
import com.knotcore.model.domain.WeightSnapshot;
import com.knotcore.model.dto.AnalysisResult;
import com.knotcore.model.dto.AnalysisSummary;
import com.knotcore.model.entity.Feedback;
import com.knotcore.model.entity.Recommendation;
import com.knotcore.repository.FeedbackRepository;
import com.knotcore.repository.RecommendationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Batch recomputation of learned weights from the feedback stream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackAnalysisService {

    private final FeedbackRepository feedbackRepository;
    private final RecommendationRepository recommendationRepository;
    private final PreferenceWeightLearner learner;
    private final PreferenceWeightsService preferenceWeightsService;
    private final Clock clock;

    /**
     * Recompute the snapshot of one user from all of their feedback.
     *
     * @param userId User ID
     * @return Outcome; {@code applied} is false when a newer snapshot was already stored
     */
    public Mono<AnalysisResult> analyzeUser(UUID userId) {
        Instant runAt = clock.instant();
        return feedbackRepository.findByUserId(userId)
                .collectList()
                .flatMap(feedback -> loadRecommendations(feedback)
                        .map(recommendations -> toSignals(feedback, recommendations)))
                .flatMap(signals -> {
                    WeightSnapshot snapshot = learner.learn(signals, runAt);
                    return preferenceWeightsService.replaceSnapshot(userId, snapshot)
                            .map(applied -> {
                                if (!applied) {
                                    log.info("Weight snapshot for user {} rejected, a newer one exists", userId);
                                }
                                return AnalysisResult.builder()
                                        .userId(userId)
                                        .applied(applied)
                                        .feedbackCount(snapshot.getFeedbackCount())
                                        .analyzedAt(runAt)
                                        .build();
                            });
                });
    }

    /**
     * Recompute snapshots for every user with feedback. A failing user is counted and skipped.
     */
    public Mono<AnalysisSummary> analyzeAll() {
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        return feedbackRepository.findUserIdsWithFeedback()
                .concatMap(userId -> analyzeUser(userId)
                        .doOnNext(result -> (result.isApplied() ? applied : rejected).incrementAndGet())
                        .onErrorResume(error -> {
                            log.error("Feedback analysis failed for user {}: {}", userId, error.getMessage());
                            failed.incrementAndGet();
                            return Mono.empty();
                        }))
                .then(Mono.fromSupplier(() -> AnalysisSummary.builder()
                        .applied(applied.get())
                        .rejected(rejected.get())
                        .failed(failed.get())
                        .build()));
    }

    private Mono<Map<UUID, Recommendation>> loadRecommendations(List<Feedback> feedback) {
        Set<UUID> ids = feedback.stream()
                .map(Feedback::getRecommendationId)
                .collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Mono.just(Map.of());
        }
        return recommendationRepository.findAllById(ids)
                .collectMap(Recommendation::getId, Function.identity());
    }

    private static List<FeedbackSignal> toSignals(List<Feedback> feedback, Map<UUID, Recommendation> recommendations) {
        return feedback.stream()
                .map(event -> {
                    Recommendation recommendation = recommendations.get(event.getRecommendationId());
                    FeedbackSignal.FeedbackSignalBuilder signal = FeedbackSignal.builder()
                            .action(event.getAction())
                            .rating(event.getRating());
                    if (recommendation != null) {
                        signal.recommendationType(recommendation.getType() != null
                                        ? recommendation.getType().name() : null)
                                .interests(recommendation.getMatchedInterests())
                                .vibes(recommendation.getMatchedVibes())
                                .loveLanguages(recommendation.getMatchedLoveLanguages());
                    }
                    return signal.build();
                })
                .collect(Collectors.toList());
    }
}
