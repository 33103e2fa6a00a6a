package com.knotcore.model.enums;

public enum LoveLanguageRank {
    PRIMARY, SECONDARY
}
