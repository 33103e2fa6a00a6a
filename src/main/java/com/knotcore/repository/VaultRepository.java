package com.knotcore.repository;

import com.knotcore.model.entity.Vault;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for partner vaults.
 */
@Repository
public interface VaultRepository extends ReactiveCrudRepository<Vault, UUID> {

    Mono<Vault> findByUserId(UUID userId);
}
