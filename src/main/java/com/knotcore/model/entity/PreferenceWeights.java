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
 * Learned multiplier snapshot for one user. Written only by the feedback analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("user_preference_weights")
public class PreferenceWeights {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("vibe_weights")
    private String vibeWeights; // Stored as JSONB, read back as text

    @Column("interest_weights")
    private String interestWeights;

    @Column("type_weights")
    private String typeWeights;

    @Column("love_language_weights")
    private String loveLanguageWeights;

    @Column("feedback_count")
    private int feedbackCount;

    @Column("last_analyzed_at")
    private Instant lastAnalyzedAt;

    @Column("updated_at")
    private Instant updatedAt;
}
