package com.knotcore.model.entity;

import com.knotcore.model.enums.BudgetTier;
import com.knotcore.model.enums.MilestoneType;
import com.knotcore.model.enums.Recurrence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Dated event in a partner vault. For yearly milestones only month and day of
 * {@link #date} are significant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("partner_milestones")
public class Milestone {

    @Id
    private UUID id;

    @Column("vault_id")
    private UUID vaultId;

    @Column("milestone_type")
    private MilestoneType type;

    @Column("milestone_name")
    private String name;

    @Column("milestone_date")
    private LocalDate date;

    @Column("recurrence")
    private Recurrence recurrence;

    @Column("budget_tier")
    private BudgetTier budgetTier;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;
}
