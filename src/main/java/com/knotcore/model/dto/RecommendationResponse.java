package com.knotcore.model.dto;

import com.knotcore.model.entity.Recommendation;
import com.knotcore.model.enums.RecommendationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a persisted recommendation with its score breakdown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {
    private UUID id;
    private UUID vaultId;
    private UUID milestoneId;
    private RecommendationType type;
    private String title;
    private String description;
    private String externalUrl;
    private Integer priceCents;
    private String merchantName;
    private List<String> matchedInterests;
    private List<String> matchedVibes;
    private List<String> matchedLoveLanguages;
    private double interestScore;
    private double vibeScore;
    private double loveLanguageScore;
    private double finalScore;
    private Instant createdAt;

    public static RecommendationResponse from(Recommendation recommendation) {
        return RecommendationResponse.builder()
                .id(recommendation.getId())
                .vaultId(recommendation.getVaultId())
                .milestoneId(recommendation.getMilestoneId())
                .type(recommendation.getType())
                .title(recommendation.getTitle())
                .description(recommendation.getDescription())
                .externalUrl(recommendation.getExternalUrl())
                .priceCents(recommendation.getPriceCents())
                .merchantName(recommendation.getMerchantName())
                .matchedInterests(recommendation.getMatchedInterests())
                .matchedVibes(recommendation.getMatchedVibes())
                .matchedLoveLanguages(recommendation.getMatchedLoveLanguages())
                .interestScore(recommendation.getInterestScore())
                .vibeScore(recommendation.getVibeScore())
                .loveLanguageScore(recommendation.getLoveLanguageScore())
                .finalScore(recommendation.getFinalScore())
                .createdAt(recommendation.getCreatedAt())
                .build();
    }
}
