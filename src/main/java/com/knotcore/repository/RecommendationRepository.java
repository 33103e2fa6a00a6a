package com.knotcore.repository;

import com.knotcore.model.entity.Recommendation;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for persisted recommendations.
 */
@Repository
public interface RecommendationRepository extends ReactiveCrudRepository<Recommendation, UUID> {

    Flux<Recommendation> findByMilestoneId(UUID milestoneId);
}
