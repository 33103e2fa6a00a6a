package com.knotcore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for learned preference weights. Absent keys are neutral (1.0).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferenceWeightsResponse {
    private UUID userId;
    private Map<String, Double> vibeWeights;
    private Map<String, Double> interestWeights;
    private Map<String, Double> typeWeights;
    private Map<String, Double> loveLanguageWeights;
    private int feedbackCount;
    private Instant lastAnalyzedAt;
}
