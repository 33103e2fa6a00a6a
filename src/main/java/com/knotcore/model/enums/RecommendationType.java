package com.knotcore.model.enums;

/**
 * Kind of recommendation produced by the scorer.
 */
public enum RecommendationType {
    GIFT, EXPERIENCE, DATE, IDEA
}
