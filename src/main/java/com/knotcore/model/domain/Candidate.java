package com.knotcore.model.domain;

import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.RecommendationType;
import com.knotcore.model.enums.VibeTag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Recommendation candidate before scoring. Explicit tags are optional; missing ones are
 * inferred from title and description.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Candidate {
    private String id;
    private String title;
    private String description;
    private RecommendationType type;
    private Set<InterestCategory> interests;
    private Set<VibeTag> vibes;
    private Set<LoveLanguage> loveLanguages;
    private String externalUrl;
    private Integer priceCents;
    private String merchantName;
    // Embedding of the description, same dimension as hint embeddings
    private float[] embedding;
}
