package com.knotcore.model.enums;

import java.util.List;

/**
 * The five love languages. Gifts and quality time are inferred from the recommendation type;
 * the others from keywords in the title or description.
 */
public enum LoveLanguage {
    WORDS_OF_AFFIRMATION("personalized", "custom", "portrait", "engraved", "sentimental", "monogram",
            "letter", "journal", "poem", "song"),
    ACTS_OF_SERVICE("tool", "kit", "repair", "practical", "organizer", "useful", "home", "cleaning", "service"),
    RECEIVING_GIFTS,
    QUALITY_TIME,
    PHYSICAL_TOUCH("couples", "massage", "spa", "dance class", "together", "two people", "for two");

    private final List<String> keywords;

    LoveLanguage(String... keywords) {
        this.keywords = List.of(keywords);
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
