package com.knotcore.repository;

import com.knotcore.model.entity.UserAccount;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UserAccountRepository extends ReactiveCrudRepository<UserAccount, UUID> {
}
