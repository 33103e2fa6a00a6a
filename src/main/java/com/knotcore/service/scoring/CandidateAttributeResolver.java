package com.knotcore.service.scoring;

import com.knotcore.model.domain.Candidate;
import com.knotcore.model.domain.CandidateAttributes;
import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.RecommendationType;
import com.knotcore.model.enums.VibeTag;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves the interest, vibe and love-language values of a candidate: explicit tags merged with
 * values inferred from title and description. Keywords match whole words, case-insensitively.
 */
@Component
public class CandidateAttributeResolver {

    private final Map<InterestCategory, Pattern> interestPatterns = new EnumMap<>(InterestCategory.class);
    private final Map<VibeTag, Pattern> vibePatterns = new EnumMap<>(VibeTag.class);
    private final Map<LoveLanguage, Pattern> loveLanguagePatterns = new EnumMap<>(LoveLanguage.class);

    public CandidateAttributeResolver() {
        for (InterestCategory category : InterestCategory.values()) {
            interestPatterns.put(category, wordPattern(List.of(category.getLabel())));
        }
        for (VibeTag vibe : VibeTag.values()) {
            vibePatterns.put(vibe, wordPattern(vibe.getKeywords()));
        }
        for (LoveLanguage language : LoveLanguage.values()) {
            if (!language.getKeywords().isEmpty()) {
                loveLanguagePatterns.put(language, wordPattern(language.getKeywords()));
            }
        }
    }

    public CandidateAttributes resolve(Candidate candidate) {
        String text = ((candidate.getTitle() != null ? candidate.getTitle() : "") + " "
                + (candidate.getDescription() != null ? candidate.getDescription() : "")).trim();

        Set<InterestCategory> interests = copy(candidate.getInterests(), InterestCategory.class);
        interestPatterns.forEach((category, pattern) -> {
            if (pattern.matcher(text).find()) {
                interests.add(category);
            }
        });

        Set<VibeTag> vibes = copy(candidate.getVibes(), VibeTag.class);
        vibePatterns.forEach((vibe, pattern) -> {
            if (pattern.matcher(text).find()) {
                vibes.add(vibe);
            }
        });

        Set<LoveLanguage> loveLanguages = copy(candidate.getLoveLanguages(), LoveLanguage.class);
        RecommendationType type = candidate.getType();
        if (type == RecommendationType.GIFT) {
            loveLanguages.add(LoveLanguage.RECEIVING_GIFTS);
        } else if (type == RecommendationType.EXPERIENCE || type == RecommendationType.DATE) {
            loveLanguages.add(LoveLanguage.QUALITY_TIME);
        }
        loveLanguagePatterns.forEach((language, pattern) -> {
            if (pattern.matcher(text).find()) {
                loveLanguages.add(language);
            }
        });

        return new CandidateAttributes(
                Collections.unmodifiableSet(interests),
                Collections.unmodifiableSet(vibes),
                Collections.unmodifiableSet(loveLanguages));
    }

    private static Pattern wordPattern(Collection<String> keywords) {
        String alternatives = keywords.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    private static <E extends Enum<E>> Set<E> copy(Set<E> values, Class<E> type) {
        return values == null || values.isEmpty() ? EnumSet.noneOf(type) : EnumSet.copyOf(values);
    }
}
