package com.knotcore.repository;

import com.knotcore.model.entity.Budget;
import com.knotcore.model.enums.BudgetTier;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface BudgetRepository extends ReactiveCrudRepository<Budget, UUID> {

    Flux<Budget> findByVaultId(UUID vaultId);

    Mono<Budget> findByVaultIdAndOccasionType(UUID vaultId, BudgetTier occasionType);
}
