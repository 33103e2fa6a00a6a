package com.knotcore.service.scoring;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.model.domain.Candidate;
import com.knotcore.model.domain.ScoredCandidate;
import com.knotcore.model.domain.SimilarHint;
import com.knotcore.model.domain.SimilarityQuery;
import com.knotcore.model.domain.VaultProfile;
import com.knotcore.model.dto.RecommendationRequest;
import com.knotcore.model.dto.RecommendationResponse;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.entity.Recommendation;
import com.knotcore.model.enums.FeedbackAction;
import com.knotcore.model.enums.VibeTag;
import com.knotcore.repository.HintRepository;
import com.knotcore.repository.MilestoneRepository;
import com.knotcore.repository.RecommendationRepository;
import com.knotcore.service.VaultService;
import com.knotcore.service.embedding.EmbeddingClient;
import com.knotcore.service.embedding.EmbeddingStore;
import com.knotcore.service.learning.FeedbackService;
import com.knotcore.service.learning.PreferenceWeightsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Ranks candidates for a vault and persists the chosen recommendations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private static final int CONTEXT_CONCURRENCY = 4;

    private final VaultService vaultService;
    private final PreferenceWeightsService preferenceWeightsService;
    private final EmbeddingStore embeddingStore;
    private final EmbeddingClient embeddingClient;
    private final RecommendationScorer scorer;
    private final CandidateProvider candidateProvider;
    private final RecommendationRepository recommendationRepository;
    private final MilestoneRepository milestoneRepository;
    private final HintRepository hintRepository;
    private final FeedbackService feedbackService;
    private final Clock clock;

    @Value("${knot.scoring.context-threshold:0.75}")
    private double contextThreshold;

    @Value("${knot.scoring.context-hints-per-candidate:5}")
    private int contextHintsPerCandidate;

    /**
     * Rank candidates for a vault. Reads only; nothing is persisted and no hint is marked used.
     *
     * @param vaultId Vault ID
     * @param candidates Candidates to rank
     * @param vibeOverride Vibes replacing the vault's vibes for this call only; null or empty keeps them
     * @return Ranked candidates, best first
     */
    public Mono<List<ScoredCandidate>> rank(UUID vaultId, List<Candidate> candidates, Set<VibeTag> vibeOverride) {
        return vaultService.loadProfile(vaultId)
                .flatMap(profile -> rank(profile, candidates, vibeOverride));
    }

    private Mono<List<ScoredCandidate>> rank(VaultProfile vaultProfile, List<Candidate> candidates,
                                             Set<VibeTag> vibeOverride) {
        VaultProfile profile = vibeOverride == null || vibeOverride.isEmpty()
                ? vaultProfile
                : vaultProfile.withVibes(vibeOverride);
        return Mono.zip(
                        preferenceWeightsService.snapshotFor(profile.getUserId()),
                        contextFor(profile.getVaultId(), candidates))
                .map(tuple -> scorer.rank(profile, tuple.getT1(), candidates, tuple.getT2()));
    }

    /**
     * Rank the provider's candidates and persist the best ones.
     *
     * @param vaultId Vault ID
     * @param request Milestone, vibe override and result count
     * @return Persisted recommendations in rank order
     */
    public Flux<RecommendationResponse> generate(UUID vaultId, RecommendationRequest request) {
        Mono<Milestone> milestone = request.getMilestoneId() == null
                ? Mono.empty()
                : milestoneRepository.findById(request.getMilestoneId())
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Milestone", request.getMilestoneId())));

        return milestone.map(List::of)
                .defaultIfEmpty(List.of())
                .flatMapMany(found -> generateAndStore(vaultId, found.isEmpty() ? null : found.get(0),
                        request.getVibeOverride(), request.getLimit()))
                .map(RecommendationResponse::from);
    }

    /**
     * Fan-out for a milestone notification: persist the top recommendations and return their IDs.
     */
    public Mono<List<UUID>> recommendForMilestone(Milestone milestone, int limit) {
        return generateAndStore(milestone.getVaultId(), milestone, null, limit)
                .map(Recommendation::getId)
                .collectList();
    }

    /**
     * Confirm that the user picked a recommendation: its context hints are marked used and a
     * SELECTED feedback event is appended.
     *
     * @param recommendationId Recommendation ID
     * @param userId User ID
     * @return The selected recommendation
     */
    public Mono<RecommendationResponse> confirmSelection(UUID recommendationId, UUID userId) {
        return recommendationRepository.findById(recommendationId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Recommendation", recommendationId)))
                .flatMap(recommendation -> {
                    List<UUID> hintIds = recommendation.getContextHintIds();
                    Mono<Integer> markHints = hintIds == null || hintIds.isEmpty()
                            ? Mono.just(0)
                            : hintRepository.markUsed(hintIds);
                    return markHints
                            .then(feedbackService.append(recommendationId, userId, FeedbackAction.SELECTED, null, null))
                            .thenReturn(recommendation);
                })
                .map(RecommendationResponse::from);
    }

    private Flux<Recommendation> generateAndStore(UUID vaultId, Milestone milestone, Set<VibeTag> vibeOverride, int limit) {
        return vaultService.loadProfile(vaultId)
                .flatMap(profile -> candidateProvider.candidatesFor(profile, milestone)
                        .collectList()
                        .flatMap(candidates -> rank(profile, candidates, vibeOverride)))
                .flatMapMany(ranked -> {
                    Instant now = clock.instant();
                    List<Recommendation> top = ranked.stream()
                            .limit(limit)
                            .map(scored -> toEntity(vaultId, milestone, scored, now))
                            .collect(Collectors.toList());
                    return Flux.fromIterable(top).concatMap(recommendationRepository::save);
                });
    }

    /**
     * Unused hints similar to each candidate's description, keyed by candidate id.
     * Context is optional: a candidate without an embedding or a failed lookup gets none.
     */
    private Mono<Map<String, List<SimilarHint>>> contextFor(UUID vaultId, List<Candidate> candidates) {
        return Flux.fromIterable(candidates)
                .filter(candidate -> candidate.getId() != null)
                .flatMap(candidate -> candidateEmbedding(candidate)
                        .flatMap(vector -> embeddingStore.findSimilar(SimilarityQuery.builder()
                                        .vector(vector)
                                        .vaultId(vaultId)
                                        .limit(contextHintsPerCandidate)
                                        .minSimilarity(contextThreshold)
                                        .unusedOnly(true)
                                        .build())
                                .collectList())
                        .onErrorResume(error -> {
                            log.warn("Hint context lookup failed for candidate {}: {}", candidate.getId(), error.getMessage());
                            return Mono.empty();
                        })
                        .map(hints -> Tuples.of(candidate.getId(), hints)), CONTEXT_CONCURRENCY)
                .collectMap(Tuple2::getT1, Tuple2::getT2);
    }

    private Mono<float[]> candidateEmbedding(Candidate candidate) {
        if (candidate.getEmbedding() != null) {
            return Mono.just(candidate.getEmbedding());
        }
        String text = candidate.getDescription() != null
                ? candidate.getTitle() + ". " + candidate.getDescription()
                : candidate.getTitle();
        return text == null ? Mono.empty() : embeddingClient.embed(text);
    }

    private static Recommendation toEntity(UUID vaultId, Milestone milestone, ScoredCandidate scored, Instant now) {
        Candidate candidate = scored.getCandidate();
        return Recommendation.builder()
                .vaultId(vaultId)
                .milestoneId(milestone != null ? milestone.getId() : null)
                .candidateId(candidate.getId())
                .type(candidate.getType())
                .title(candidate.getTitle())
                .description(candidate.getDescription())
                .externalUrl(candidate.getExternalUrl())
                .priceCents(candidate.getPriceCents())
                .merchantName(candidate.getMerchantName())
                .matchedInterests(names(scored.getMatchedInterests()))
                .matchedVibes(names(scored.getMatchedVibes()))
                .matchedLoveLanguages(names(scored.getMatchedLoveLanguages()))
                .contextHintIds(scored.getContextHintIds())
                .interestScore(scored.getInterestScore())
                .vibeScore(scored.getVibeScore())
                .loveLanguageScore(scored.getLoveLanguageScore())
                .finalScore(scored.getFinalScore())
                .createdAt(now)
                .build();
    }

    private static List<String> names(Set<? extends Enum<?>> values) {
        return values.stream().map(Enum::name).sorted().collect(Collectors.toList());
    }
}
