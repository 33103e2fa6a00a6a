package com.knotcore.model.entity;

import com.knotcore.model.enums.HintSource;
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
 * Free-text hint about a partner.
 * Note: R2DBC has no pgvector codec, so the embedding column is not mapped here
 * and is read and written through {@code HintVectorRepository}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("hints")
public class Hint {

    @Id
    private UUID id;

    @Column("vault_id")
    private UUID vaultId;

    @Column("hint_text")
    private String text;

    @Column("source")
    private HintSource source;

    @Column("is_used")
    private boolean used;

    @Column("created_at")
    private Instant createdAt;
}
