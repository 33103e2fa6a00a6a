package com.knotcore.repository;

import com.knotcore.model.entity.Interest;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface InterestRepository extends ReactiveCrudRepository<Interest, UUID> {

    Flux<Interest> findByVaultId(UUID vaultId);
}
