package com.knotcore.model.enums;

public enum InterestPolarity {
    LIKE, DISLIKE
}
