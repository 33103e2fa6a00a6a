package com.knotcore.service;

import com.knotcore.exception.ValidationException;
import com.knotcore.model.dto.BudgetRequest;
import com.knotcore.model.dto.BudgetResponse;
import com.knotcore.model.entity.Budget;
import com.knotcore.model.enums.BudgetTier;
import com.knotcore.repository.BudgetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Comparator;
import java.util.UUID;

/**
 * Per-tier spending ranges of a vault.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetService {

    private final BudgetRepository budgetRepository;
    private final VaultService vaultService;
    private final Clock clock;

    /**
     * Create or replace the budget for one tier.
     *
     * @param vaultId Vault ID
     * @param tier Occasion tier
     * @param request Range in cents and currency
     * @return Stored budget
     */
    public Mono<BudgetResponse> setBudget(UUID vaultId, BudgetTier tier, BudgetRequest request) {
        if (request.getMaxAmount() < request.getMinAmount()) {
            return Mono.error(new ValidationException("maxAmount", request.getMaxAmount(),
                    "must be at least the minimum amount " + request.getMinAmount()));
        }
        String currency = request.getCurrency() != null ? request.getCurrency() : "USD";

        return vaultService.getVault(vaultId)
                .then(budgetRepository.findByVaultIdAndOccasionType(vaultId, tier))
                .defaultIfEmpty(Budget.builder()
                        .vaultId(vaultId)
                        .occasionType(tier)
                        .createdAt(clock.instant())
                        .build())
                .flatMap(budget -> {
                    budget.setMinAmount(request.getMinAmount());
                    budget.setMaxAmount(request.getMaxAmount());
                    budget.setCurrency(currency);
                    return budgetRepository.save(budget);
                })
                .doOnNext(saved -> log.info("Set {} budget for vault {}: {}-{} {}", tier, vaultId,
                        saved.getMinAmount(), saved.getMaxAmount(), saved.getCurrency()))
                .map(BudgetResponse::from);
    }

    public Flux<BudgetResponse> listBudgets(UUID vaultId) {
        return budgetRepository.findByVaultId(vaultId)
                .sort(Comparator.comparing(Budget::getOccasionType))
                .map(BudgetResponse::from);
    }

    /**
     * @return The tier's budget, or empty when the vault has none for it
     */
    public Mono<Budget> budgetFor(UUID vaultId, BudgetTier tier) {
        return budgetRepository.findByVaultIdAndOccasionType(vaultId, tier);
    }
}
