package com.knotcore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Response DTO for semantic hint search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HintSearchResponse {
    private UUID vaultId;
    private String query;
    // False when the query could not be embedded; results are then empty
    private boolean embedded;
    private List<HintSearchResult> results;
}
