package com.knotcore.repository;

import com.knotcore.model.entity.Hint;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.UUID;

/**
 * Repository for hint rows. Vector columns are handled by {@link HintVectorRepository}.
 */
@Repository
public interface HintRepository extends ReactiveCrudRepository<Hint, UUID> {

    Flux<Hint> findByVaultIdOrderByCreatedAtDesc(UUID vaultId);

    /**
     * Hints still waiting for an embedding, oldest first.
     */
    @Query("SELECT id, vault_id, hint_text, source, is_used, created_at FROM hints " +
            "WHERE embedding IS NULL ORDER BY created_at ASC LIMIT :limit")
    Flux<Hint> findMissingEmbedding(int limit);

    @Modifying
    @Query("UPDATE hints SET is_used = TRUE WHERE id IN (:ids)")
    Mono<Integer> markUsed(Collection<UUID> ids);
}
