package com.knotcore.model.domain;

import com.knotcore.model.entity.Hint;
import lombok.Value;

@Value
public class SimilarHint {
    Hint hint;
    // Cosine similarity clamped to [0, 1]
    double similarity;
}
