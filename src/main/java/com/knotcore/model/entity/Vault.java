package com.knotcore.model.entity;

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
 * Partner vault. Exactly one per user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("partner_vaults")
public class Vault {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("partner_name")
    private String partnerName;

    @Column("relationship_tenure_months")
    private Integer relationshipTenureMonths;

    @Column("cohabitation_status")
    private String cohabitationStatus;

    @Column("location_city")
    private String locationCity;

    @Column("location_state")
    private String locationState;

    @Column("location_country")
    private String locationCountry;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;
}
