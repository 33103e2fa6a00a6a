package com.knotcore.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for setting the budget of one occasion tier. Amounts are in cents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetRequest {

    @NotNull(message = "Minimum amount is required")
    @Min(value = 0, message = "Minimum amount cannot be negative")
    private Integer minAmount;

    @NotNull(message = "Maximum amount is required")
    private Integer maxAmount;

    @Builder.Default
    @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code")
    private String currency = "USD";
}
