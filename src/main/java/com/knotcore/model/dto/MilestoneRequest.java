package com.knotcore.model.dto;

import com.knotcore.model.enums.BudgetTier;
import com.knotcore.model.enums.MilestoneType;
import com.knotcore.model.enums.Recurrence;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for creating or updating a milestone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MilestoneRequest {

    @NotNull(message = "Milestone type is required")
    private MilestoneType type;

    @NotBlank(message = "Milestone name is required")
    @Size(max = 100, message = "Milestone name cannot exceed 100 characters")
    private String name;

    @NotNull(message = "Milestone date is required")
    private LocalDate date;

    // Defaults to YEARLY
    private Recurrence recurrence;

    // Defaults by type; required for CUSTOM
    private BudgetTier budgetTier;
}
