package com.knotcore.model.dto;

import com.knotcore.model.entity.Budget;
import com.knotcore.model.enums.BudgetTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetResponse {
    private UUID vaultId;
    private BudgetTier occasionType;
    private int minAmount;
    private int maxAmount;
    private String currency;

    public static BudgetResponse from(Budget budget) {
        return BudgetResponse.builder()
                .vaultId(budget.getVaultId())
                .occasionType(budget.getOccasionType())
                .minAmount(budget.getMinAmount())
                .maxAmount(budget.getMaxAmount())
                .currency(budget.getCurrency())
                .build();
    }
}
