package com.knotcore.model.domain;

import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.VibeTag;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.UUID;

@Value
@Builder
public class ScoredCandidate {
    Candidate candidate;
    Set<InterestCategory> matchedInterests;
    Set<VibeTag> matchedVibes;
    Set<LoveLanguage> matchedLoveLanguages;
    double interestScore;
    double vibeScore;
    double loveLanguageScore;
    double typeWeight;
    double contextBonus;
    double finalScore;
    // Unused hints that triggered the context bonus
    List<UUID> contextHintIds;
}
