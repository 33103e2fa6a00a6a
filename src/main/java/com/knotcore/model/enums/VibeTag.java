package com.knotcore.model.enums;

import java.util.List;

/**
 * Aesthetic tags describing a partner, with the keywords used to infer them from free text.
 */
public enum VibeTag {
    QUIET_LUXURY("luxury", "fine dining", "exclusive", "upscale", "boutique", "sommelier", "omakase", "artisan", "spa"),
    STREET_URBAN("street art", "urban", "underground", "food truck", "graffiti", "mural"),
    OUTDOORSY("outdoor", "kayak", "hiking", "climbing", "balloon", "nature", "trail"),
    VINTAGE("vintage", "antique", "classic", "retro", "prohibition", "speakeasy"),
    MINIMALIST("minimalist", "zen", "meditation", "tea ceremony", "mindfulness", "architecture"),
    BOHEMIAN("pottery", "indie", "tie-dye", "handmade", "craft", "workshop"),
    ROMANTIC("romantic", "candlelit", "sunset", "stargazing", "cruise", "couples"),
    ADVENTUROUS("adventure", "skydiving", "rafting", "escape room", "extreme", "thrill", "white water");

    private final List<String> keywords;

    VibeTag(String... keywords) {
        this.keywords = List.of(keywords);
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
