package com.knotcore.repository;

import com.knotcore.model.entity.VaultVibe;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface VaultVibeRepository extends ReactiveCrudRepository<VaultVibe, UUID> {

    Flux<VaultVibe> findByVaultId(UUID vaultId);
}
