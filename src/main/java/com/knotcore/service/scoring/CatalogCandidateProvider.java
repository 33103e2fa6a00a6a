package com.knotcore.service.scoring;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knotcore.model.domain.Candidate;
import com.knotcore.model.domain.VaultProfile;
import com.knotcore.model.entity.Budget;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.enums.BudgetTier;
import com.knotcore.service.BudgetService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Candidates from a static JSON catalog, loaded once at startup.
 *
 * Candidates priced outside the vault's budget for the occasion tier are dropped. Ad-hoc requests
 * use the JUST_BECAUSE tier; a tier without a budget admits everything.
 */
@Slf4j
@Component
public class CatalogCandidateProvider implements CandidateProvider {

    private static final TypeReference<List<Candidate>> CANDIDATE_LIST = new TypeReference<>() {
    };

    private final List<Candidate> catalog;
    private final BudgetService budgetService;

    public CatalogCandidateProvider(ObjectMapper objectMapper, ResourceLoader resourceLoader, BudgetService budgetService,
                                    @Value("${knot.scoring.catalog:classpath:catalog/candidates.json}") String location) {
        this.budgetService = budgetService;
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            this.catalog = List.copyOf(objectMapper.readValue(in, CANDIDATE_LIST));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load candidate catalog from " + location, e);
        }
        log.info("Loaded {} recommendation candidates from {}", catalog.size(), location);
    }

    @Override
    public Flux<Candidate> candidatesFor(VaultProfile profile, Milestone milestone) {
        BudgetTier tier = milestone != null && milestone.getBudgetTier() != null
                ? milestone.getBudgetTier()
                : BudgetTier.JUST_BECAUSE;
        Mono<Budget> budget = budgetService.budgetFor(profile.getVaultId(), tier);

        return budget.map(found -> Flux.fromIterable(catalog).filter(candidate -> found.admits(candidate.getPriceCents())))
                .defaultIfEmpty(Flux.fromIterable(catalog))
                .flatMapMany(candidates -> candidates)
                // Copies, so callers can attach embeddings without touching the catalog
                .map(candidate -> candidate.toBuilder().build());
    }
}
