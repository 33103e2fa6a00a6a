package com.knotcore.repository;

import com.knotcore.model.entity.Milestone;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for partner milestones.
 */
@Repository
public interface MilestoneRepository extends ReactiveCrudRepository<Milestone, UUID> {

    /**
     * Find all milestones of a vault ordered by calendar date.
     */
    Flux<Milestone> findByVaultIdOrderByDateAsc(UUID vaultId);
}
