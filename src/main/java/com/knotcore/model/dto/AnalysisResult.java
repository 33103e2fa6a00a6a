package com.knotcore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of recomputing one user's weights.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {
    private UUID userId;
    // False when a newer snapshot was already stored
    private boolean applied;
    private int feedbackCount;
    private Instant analyzedAt;
}
