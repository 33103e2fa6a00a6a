package com.knotcore.model.entity;

import com.knotcore.model.enums.RecommendationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted scoring result. Immutable once written; the matched dimension values are what
 * the weight learner later attributes feedback to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("recommendations")
public class Recommendation {

    @Id
    private UUID id;

    @Column("vault_id")
    private UUID vaultId;

    @Column("milestone_id")
    private UUID milestoneId;

    @Column("candidate_id")
    private String candidateId;

    @Column("recommendation_type")
    private RecommendationType type;

    @Column("title")
    private String title;

    @Column("description")
    private String description;

    @Column("external_url")
    private String externalUrl;

    @Column("price_cents")
    private Integer priceCents;

    @Column("merchant_name")
    private String merchantName;

    // Enum names, stored as text[]
    @Column("matched_interests")
    private List<String> matchedInterests;

    @Column("matched_vibes")
    private List<String> matchedVibes;

    @Column("matched_love_languages")
    private List<String> matchedLoveLanguages;

    @Column("context_hint_ids")
    private List<UUID> contextHintIds;

    @Column("interest_score")
    private double interestScore;

    @Column("vibe_score")
    private double vibeScore;

    @Column("love_language_score")
    private double loveLanguageScore;

    @Column("final_score")
    private double finalScore;

    @Column("created_at")
    private Instant createdAt;
}
