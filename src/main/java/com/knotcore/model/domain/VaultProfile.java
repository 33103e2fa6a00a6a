package com.knotcore.model.domain;

import com.knotcore.exception.ValidationException;
import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.VibeTag;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Static preference facts of a partner vault, as consumed by the scorer.
 */
@Value
public class VaultProfile {

    UUID vaultId;
    UUID userId;
    Set<InterestCategory> likes;
    Set<InterestCategory> dislikes;
    Set<VibeTag> vibes;
    LoveLanguage primaryLoveLanguage;
    LoveLanguage secondaryLoveLanguage;
    String locationState;

    @Builder
    public VaultProfile(UUID vaultId, UUID userId, Set<InterestCategory> likes, Set<InterestCategory> dislikes,
                        Set<VibeTag> vibes, LoveLanguage primaryLoveLanguage, LoveLanguage secondaryLoveLanguage,
                        String locationState) {
        this.vaultId = vaultId;
        this.userId = userId;
        this.likes = immutable(likes, InterestCategory.class);
        this.dislikes = immutable(dislikes, InterestCategory.class);
        this.vibes = immutable(vibes, VibeTag.class);
        this.primaryLoveLanguage = primaryLoveLanguage;
        this.secondaryLoveLanguage = secondaryLoveLanguage;
        this.locationState = locationState;

        for (InterestCategory category : this.likes) {
            if (this.dislikes.contains(category)) {
                throw new ValidationException("Interest " + category + " cannot be both liked and disliked");
            }
        }
        if (primaryLoveLanguage != null && primaryLoveLanguage == secondaryLoveLanguage) {
            throw new ValidationException("Primary and secondary love language must differ");
        }
    }

    /**
     * Love languages of the partner, primary first.
     */
    public Set<LoveLanguage> loveLanguages() {
        Set<LoveLanguage> result = EnumSet.noneOf(LoveLanguage.class);
        if (primaryLoveLanguage != null) {
            result.add(primaryLoveLanguage);
        }
        if (secondaryLoveLanguage != null) {
            result.add(secondaryLoveLanguage);
        }
        return result;
    }

    /**
     * Copy of this profile whose vibes are replaced for one ranking call.
     */
    public VaultProfile withVibes(Set<VibeTag> override) {
        return new VaultProfile(vaultId, userId, likes, dislikes, override, primaryLoveLanguage,
                secondaryLoveLanguage, locationState);
    }

    private static <E extends Enum<E>> Set<E> immutable(Set<E> values, Class<E> type) {
        if (values == null || values.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(type));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(values));
    }
}
