package com.knotcore.service.scoring;

import com.knotcore.model.domain.Candidate;
import com.knotcore.model.domain.CandidateAttributes;
import com.knotcore.model.enums.InterestCategory;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.RecommendationType;
import com.knotcore.model.enums.VibeTag;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateAttributeResolverTest {

    private final CandidateAttributeResolver resolver = new CandidateAttributeResolver();

    @Test
    void resolve_InfersFromTitleAndDescription() {
        Candidate candidate = Candidate.builder()
                .id("c1")
                .title("Street Art Mural Walk")
                .description("Guided urban tour through the graffiti district.")
                .type(RecommendationType.EXPERIENCE)
                .build();

        CandidateAttributes attributes = resolver.resolve(candidate);

        assertThat(attributes.getInterests()).contains(InterestCategory.ART);
        assertThat(attributes.getVibes()).containsExactly(VibeTag.STREET_URBAN);
        assertThat(attributes.getLoveLanguages()).containsExactly(LoveLanguage.QUALITY_TIME);
    }

    @Test
    void resolve_MatchesWholeWordsOnly() {
        Candidate candidate = Candidate.builder()
                .id("c2")
                .title("Artisan cheese board")
                .description("Hand-picked by a cheesemonger.")
                .type(RecommendationType.GIFT)
                .build();

        CandidateAttributes attributes = resolver.resolve(candidate);

        assertThat(attributes.getInterests()).doesNotContain(InterestCategory.ART);
        assertThat(attributes.getVibes()).containsExactly(VibeTag.QUIET_LUXURY);
        assertThat(attributes.getLoveLanguages()).containsExactly(LoveLanguage.RECEIVING_GIFTS);
    }

    @Test
    void resolve_MergesExplicitTags() {
        Candidate candidate = Candidate.builder()
                .id("c3")
                .title("Couples Massage")
                .description("Side by side at the day spa.")
                .type(RecommendationType.IDEA)
                .interests(Set.of(InterestCategory.YOGA))
                .loveLanguages(Set.of(LoveLanguage.WORDS_OF_AFFIRMATION))
                .build();

        CandidateAttributes attributes = resolver.resolve(candidate);

        assertThat(attributes.getInterests()).containsExactly(InterestCategory.YOGA);
        assertThat(attributes.getVibes()).contains(VibeTag.ROMANTIC, VibeTag.QUIET_LUXURY);
        assertThat(attributes.getLoveLanguages())
                .containsExactlyInAnyOrder(LoveLanguage.WORDS_OF_AFFIRMATION, LoveLanguage.PHYSICAL_TOUCH);
    }
}
