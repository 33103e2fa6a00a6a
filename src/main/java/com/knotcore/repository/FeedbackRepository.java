package com.knotcore.repository;

import com.knotcore.model.entity.Feedback;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for the append-only feedback stream.
 */
@Repository
public interface FeedbackRepository extends ReactiveCrudRepository<Feedback, UUID> {

    Flux<Feedback> findByUserId(UUID userId);

    /**
     * Users with at least one feedback event.
     */
    @Query("SELECT DISTINCT user_id FROM recommendation_feedback")
    Flux<UUID> findUserIdsWithFeedback();
}
