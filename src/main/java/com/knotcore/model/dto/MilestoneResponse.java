package com.knotcore.model.dto;

import com.knotcore.model.entity.Milestone;
import com.knotcore.model.enums.BudgetTier;
import com.knotcore.model.enums.MilestoneType;
import com.knotcore.model.enums.Recurrence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MilestoneResponse {
    private UUID id;
    private UUID vaultId;
    private MilestoneType type;
    private String name;
    private LocalDate date;
    private Recurrence recurrence;
    private BudgetTier budgetTier;

    public static MilestoneResponse from(Milestone milestone) {
        return MilestoneResponse.builder()
                .id(milestone.getId())
                .vaultId(milestone.getVaultId())
                .type(milestone.getType())
                .name(milestone.getName())
                .date(milestone.getDate())
                .recurrence(milestone.getRecurrence())
                .budgetTier(milestone.getBudgetTier())
                .build();
    }
}
