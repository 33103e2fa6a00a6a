package com.knotcore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single hint search hit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HintSearchResult {
    private HintResponse hint;
    private double similarity;
}
