package com.knotcore.controller;

import com.knotcore.model.dto.BudgetRequest;
import com.knotcore.model.dto.BudgetResponse;
import com.knotcore.model.enums.BudgetTier;
import com.knotcore.service.BudgetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for vault budgets.
 */
@RestController
@RequestMapping("/v1/vaults/{vaultId}/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;

    @PutMapping("/{tier}")
    public Mono<BudgetResponse> setBudget(
            @PathVariable UUID vaultId,
            @PathVariable BudgetTier tier,
            @Valid @RequestBody BudgetRequest request) {
        return budgetService.setBudget(vaultId, tier, request);
    }

    @GetMapping
    public Flux<BudgetResponse> listBudgets(@PathVariable UUID vaultId) {
        return budgetService.listBudgets(vaultId);
    }
}
