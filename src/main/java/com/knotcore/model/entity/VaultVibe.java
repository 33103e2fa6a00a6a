package com.knotcore.model.entity;

import com.knotcore.model.enums.VibeTag;
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
@Table("partner_vibes")
public class VaultVibe {

    @Id
    private UUID id;

    @Column("vault_id")
    private UUID vaultId;

    @Column("vibe_tag")
    private VibeTag vibe;
}
