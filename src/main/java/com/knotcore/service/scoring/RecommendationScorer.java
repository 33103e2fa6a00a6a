package com.knotcore.service.scoring;

import com.knotcore.model.domain.Candidate;
import com.knotcore.model.domain.CandidateAttributes;
import com.knotcore.model.domain.ScoredCandidate;
import com.knotcore.model.domain.SimilarHint;
import com.knotcore.model.domain.VaultProfile;
import com.knotcore.model.domain.WeightDimension;
import com.knotcore.model.domain.WeightSnapshot;
import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.VibeTag;
import com.knotcore.service.learning.PreferenceWeightLearner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Scores and ranks candidates against a vault profile, learned weights and hint context.
 * Side-effect free.
 *
 * <pre>
 * dimension = sum of weights of matched values / (attainable matches * max weight)
 * final     = (c_interest * interest + c_vibe * vibe + c_ll * loveLanguage) * typeWeight + contextBonus
 * </pre>
 */
@Slf4j
@Component
public class RecommendationScorer {

    // Primary plus secondary
    private static final int LOVE_LANGUAGE_SLOTS = 2;

    static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::getFinalScore).reversed()
            .thenComparing(Comparator.comparingDouble(ScoredCandidate::getLoveLanguageScore).reversed())
            .thenComparing(scored -> scored.getCandidate().getId(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final CandidateAttributeResolver attributeResolver;
    private final double interestCoefficient;
    private final double vibeCoefficient;
    private final double loveLanguageCoefficient;
    private final double contextThreshold;
    private final double contextBonus;

    public RecommendationScorer(
            CandidateAttributeResolver attributeResolver,
            @Value("${knot.scoring.interest-coefficient:0.5}") double interestCoefficient,
            @Value("${knot.scoring.vibe-coefficient:0.3}") double vibeCoefficient,
            @Value("${knot.scoring.love-language-coefficient:0.2}") double loveLanguageCoefficient,
            @Value("${knot.scoring.context-threshold:0.75}") double contextThreshold,
            @Value("${knot.scoring.context-bonus:0.1}") double contextBonus) {
        double sum = interestCoefficient + vibeCoefficient + loveLanguageCoefficient;
        if (Math.abs(sum - 1.0) > 1e-9) {
            throw new IllegalArgumentException("Scoring coefficients must sum to 1, got " + sum);
        }
        this.attributeResolver = attributeResolver;
        this.interestCoefficient = interestCoefficient;
        this.vibeCoefficient = vibeCoefficient;
        this.loveLanguageCoefficient = loveLanguageCoefficient;
        this.contextThreshold = contextThreshold;
        this.contextBonus = contextBonus;
    }

    /**
     * Rank candidates, best first. Candidates matching a disliked interest are dropped.
     *
     * @param profile Vault profile (vibes possibly overridden for this call)
     * @param weights Learned weight snapshot
     * @param candidates Candidates to score
     * @param context Similar hints per candidate id; missing entries mean no context
     * @return Ranked candidates
     */
    public List<ScoredCandidate> rank(VaultProfile profile, WeightSnapshot weights, List<Candidate> candidates,
                                      Map<String, List<SimilarHint>> context) {
        List<ScoredCandidate> scored = new ArrayList<>();
        for (Candidate candidate : candidates) {
            CandidateAttributes attributes = attributeResolver.resolve(candidate);
            if (attributes.getInterests().stream().anyMatch(profile.getDislikes()::contains)) {
                log.debug("Candidate {} vetoed by a disliked interest", candidate.getId());
                continue;
            }
            scored.add(score(profile, weights, candidate, attributes,
                    context.getOrDefault(candidate.getId(), List.of())));
        }
        scored.sort(RANKING);
        return scored;
    }

    private ScoredCandidate score(VaultProfile profile, WeightSnapshot weights, Candidate candidate,
                                  CandidateAttributes attributes, List<SimilarHint> hints) {
        Set<InterestCategory> matchedInterests = intersect(attributes.getInterests(), profile.getLikes(), InterestCategory.class);
        Set<VibeTag> matchedVibes = intersect(attributes.getVibes(), profile.getVibes(), VibeTag.class);
        Set<LoveLanguage> matchedLoveLanguages = intersect(attributes.getLoveLanguages(), profile.loveLanguages(), LoveLanguage.class);

        double interestScore = dimensionScore(weights, WeightDimension.INTEREST, matchedInterests, profile.getLikes().size());
        double vibeScore = dimensionScore(weights, WeightDimension.VIBE, matchedVibes, profile.getVibes().size());
        double loveLanguageScore = dimensionScore(weights, WeightDimension.LOVE_LANGUAGE, matchedLoveLanguages, LOVE_LANGUAGE_SLOTS);

        double typeWeight = candidate.getType() != null
                ? weights.weight(WeightDimension.TYPE, candidate.getType())
                : WeightSnapshot.NEUTRAL;

        List<UUID> contextHintIds = hints.stream()
                .filter(match -> !match.getHint().isUsed() && match.getSimilarity() > contextThreshold)
                .map(match -> match.getHint().getId())
                .distinct()
                .collect(Collectors.toList());
        double bonus = contextHintIds.isEmpty() ? 0.0 : contextBonus;

        double base = interestCoefficient * interestScore
                + vibeCoefficient * vibeScore
                + loveLanguageCoefficient * loveLanguageScore;

        return ScoredCandidate.builder()
                .candidate(candidate)
                .matchedInterests(matchedInterests)
                .matchedVibes(matchedVibes)
                .matchedLoveLanguages(matchedLoveLanguages)
                .interestScore(interestScore)
                .vibeScore(vibeScore)
                .loveLanguageScore(loveLanguageScore)
                .typeWeight(typeWeight)
                .contextBonus(bonus)
                .finalScore(base * typeWeight + bonus)
                .contextHintIds(contextHintIds)
                .build();
    }

    private static double dimensionScore(WeightSnapshot weights, WeightDimension dimension,
                                         Collection<? extends Enum<?>> matched, int attainable) {
        if (attainable == 0 || matched.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Enum<?> value : matched) {
            sum += weights.weight(dimension, value);
        }
        // Largest weighted sum the dimension can reach, so learned weights never saturate
        return sum / (attainable * PreferenceWeightLearner.MAX_WEIGHT);
    }

    private static <E extends Enum<E>> Set<E> intersect(Set<E> a, Set<E> b, Class<E> type) {
        Set<E> result = EnumSet.noneOf(type);
        for (E value : a) {
            if (b.contains(value)) {
                result.add(value);
            }
        }
        return result;
    }
}
