package com.knotcore.model.domain;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Nearest-neighbour query over hint embeddings.
 */
@Value
@Builder
public class SimilarityQuery {
    float[] vector;
    // Restrict to one vault; null searches all vaults
    UUID vaultId;
    @Builder.Default
    int limit = 10;
    // Inclusive lower bound on similarity
    @Builder.Default
    double minSimilarity = 0.0;
    boolean unusedOnly;
}
