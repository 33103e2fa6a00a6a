package com.knotcore.model.domain;

import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.VibeTag;
import lombok.Value;

import java.util.Set;

@Value
public class CandidateAttributes {
    Set<InterestCategory> interests;
    Set<VibeTag> vibes;
    Set<LoveLanguage> loveLanguages;
}
