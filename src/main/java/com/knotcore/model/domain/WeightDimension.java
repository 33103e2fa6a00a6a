package com.knotcore.model.domain;

/**
 * Dimensions the weight learner keeps a multiplier map for.
 */
public enum WeightDimension {
    VIBE,
    INTEREST,
    TYPE,
    LOVE_LANGUAGE
}
