package com.knotcore.model.dto;

import com.knotcore.model.enums.VibeTag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.UUID;

/**
 * Request DTO for generating recommendations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

    private UUID milestoneId;

    // Replaces the vault's vibes for this request only
    private Set<VibeTag> vibeOverride;

    @Builder.Default
    @Min(value = 1, message = "Limit must be at least 1")
    @Max(value = 10, message = "Limit cannot exceed 10")
    private int limit = 3;
}
