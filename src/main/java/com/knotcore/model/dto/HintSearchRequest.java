package com.knotcore.model.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for semantic hint search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HintSearchRequest {

    @NotBlank(message = "Query is required")
    private String query;

    @Builder.Default
    @Min(value = 1, message = "Limit must be at least 1")
    @Max(value = 50, message = "Limit cannot exceed 50")
    private Integer limit = 5;

    @Builder.Default
    @DecimalMin(value = "0.0", message = "Minimum similarity must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Minimum similarity must be between 0 and 1")
    private Double minSimilarity = 0.0;

    private boolean unusedOnly;
}
