package com.knotcore.repository;

import com.knotcore.model.entity.VaultLoveLanguage;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface VaultLoveLanguageRepository extends ReactiveCrudRepository<VaultLoveLanguage, UUID> {

    Flux<VaultLoveLanguage> findByVaultId(UUID vaultId);
}
