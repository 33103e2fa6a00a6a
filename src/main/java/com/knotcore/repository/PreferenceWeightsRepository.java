package com.knotcore.repository;

import com.knotcore.model.entity.PreferenceWeights;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Repository for learned weight snapshots.
 *
 * Note: JSONB columns are cast to text on read and from text on write,
 * since the entity carries them as JSON strings.
 */
@Repository
public interface PreferenceWeightsRepository extends ReactiveCrudRepository<PreferenceWeights, UUID> {

    @Query("SELECT id, user_id, vibe_weights::text AS vibe_weights, interest_weights::text AS interest_weights, " +
            "type_weights::text AS type_weights, love_language_weights::text AS love_language_weights, " +
            "feedback_count, last_analyzed_at, updated_at " +
            "FROM user_preference_weights WHERE user_id = :userId")
    Mono<PreferenceWeights> findByUserId(UUID userId);

    /**
     * Replace the snapshot of a user only if the stored one was analyzed earlier.
     *
     * @return 1 if written, 0 if a newer or equal snapshot already exists
     */
    @Modifying
    @Query("INSERT INTO user_preference_weights (user_id, vibe_weights, interest_weights, type_weights, " +
            "love_language_weights, feedback_count, last_analyzed_at, updated_at) " +
            "VALUES (:userId, CAST(:vibeWeights AS jsonb), CAST(:interestWeights AS jsonb), " +
            "CAST(:typeWeights AS jsonb), CAST(:loveLanguageWeights AS jsonb), :feedbackCount, :analyzedAt, NOW()) " +
            "ON CONFLICT (user_id) DO UPDATE SET " +
            "vibe_weights = EXCLUDED.vibe_weights, interest_weights = EXCLUDED.interest_weights, " +
            "type_weights = EXCLUDED.type_weights, love_language_weights = EXCLUDED.love_language_weights, " +
            "feedback_count = EXCLUDED.feedback_count, last_analyzed_at = EXCLUDED.last_analyzed_at, updated_at = NOW() " +
            "WHERE user_preference_weights.last_analyzed_at IS NULL " +
            "OR user_preference_weights.last_analyzed_at < EXCLUDED.last_analyzed_at")
    Mono<Integer> upsertIfNewer(UUID userId, String vibeWeights, String interestWeights, String typeWeights,
                                String loveLanguageWeights, int feedbackCount, Instant analyzedAt);
}
