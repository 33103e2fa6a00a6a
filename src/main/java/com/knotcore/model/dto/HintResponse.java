package com.knotcore.model.dto;

import com.knotcore.model.entity.Hint;
import com.knotcore.model.enums.HintSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HintResponse {
    private UUID id;
    private UUID vaultId;
    private String text;
    private HintSource source;
    private boolean used;
    private Instant createdAt;

    public static HintResponse from(Hint hint) {
        return HintResponse.builder()
                .id(hint.getId())
                .vaultId(hint.getVaultId())
                .text(hint.getText())
                .source(hint.getSource())
                .used(hint.isUsed())
                .createdAt(hint.getCreatedAt())
                .build();
    }
}
