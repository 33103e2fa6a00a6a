package com.knotcore.model.entity;

import com.knotcore.model.enums.BudgetTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Spending range for one occasion tier of a vault. Amounts are in minor units.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("partner_budgets")
public class Budget {

    @Id
    private UUID id;

    @Column("vault_id")
    private UUID vaultId;

    @Column("occasion_type")
    private BudgetTier occasionType;

    @Column("min_amount")
    private int minAmount;

    @Column("max_amount")
    private int maxAmount;

    @Column("currency")
    private String currency;

    @Column("created_at")
    private Instant createdAt;

    public boolean admits(Integer priceCents) {
        return priceCents == null || (priceCents >= minAmount && priceCents <= maxAmount);
    }
}
