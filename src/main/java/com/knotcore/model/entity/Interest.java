package com.knotcore.model.entity;

import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.InterestPolarity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("partner_interests")
public class Interest {

    @Id
    private UUID id;

    @Column("vault_id")
    private UUID vaultId;

    @Column("interest_category")
    private InterestCategory category;

    @Column("interest_type")
    private InterestPolarity polarity;
}
