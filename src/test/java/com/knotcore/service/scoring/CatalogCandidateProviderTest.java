package com.knotcore.service.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knotcore.model.domain.Candidate;
import com.knotcore.model.domain.VaultProfile;
import com.knotcore.model.entity.Budget;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.enums.BudgetTier;
import com.knotcore.service.BudgetService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.UncheckedIOException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CatalogCandidateProvider against the bundled catalog.
 */
@ExtendWith(MockitoExtension.class)
class CatalogCandidateProviderTest {

    private static final String CATALOG = "classpath:catalog/candidates.json";

    @Mock
    private BudgetService budgetService;

    private CatalogCandidateProvider provider;
    private VaultProfile profile;

    @BeforeEach
    void setUp() {
        provider = new CatalogCandidateProvider(new ObjectMapper(), new DefaultResourceLoader(), budgetService, CATALOG);
        profile = VaultProfile.builder().vaultId(UUID.randomUUID()).userId(UUID.randomUUID()).build();
    }

    @Test
    void candidatesFor_NoBudget_ReturnsWholeCatalog() {
        when(budgetService.budgetFor(profile.getVaultId(), BudgetTier.JUST_BECAUSE)).thenReturn(Mono.empty());

        StepVerifier.create(provider.candidatesFor(profile, null).collectList())
                .assertNext(candidates -> {
                    assertThat(candidates).hasSize(12);
                    assertThat(candidates).extracting(Candidate::getId).contains("cat-001", "cat-012");
                })
                .verifyComplete();
    }

    @Test
    void candidatesFor_MilestoneTierBudget_DropsOutOfRangePrices() {
        Milestone milestone = Milestone.builder()
                .id(UUID.randomUUID())
                .vaultId(profile.getVaultId())
                .budgetTier(BudgetTier.MINOR_OCCASION)
                .build();
        Budget budget = Budget.builder()
                .vaultId(profile.getVaultId())
                .occasionType(BudgetTier.MINOR_OCCASION)
                .minAmount(5000)
                .maxAmount(10000)
                .currency("USD")
                .build();
        when(budgetService.budgetFor(profile.getVaultId(), BudgetTier.MINOR_OCCASION)).thenReturn(Mono.just(budget));

        StepVerifier.create(provider.candidatesFor(profile, milestone).collectList())
                .assertNext(candidates -> assertThat(candidates)
                        .extracting(Candidate::getId)
                        .containsExactly("cat-003", "cat-008", "cat-010"))
                .verifyComplete();
    }

    @Test
    void candidatesFor_ReturnsCopies() {
        when(budgetService.budgetFor(profile.getVaultId(), BudgetTier.JUST_BECAUSE)).thenReturn(Mono.empty());

        Candidate first = provider.candidatesFor(profile, null).blockFirst();
        first.setEmbedding(new float[]{1f, 0f});

        Candidate again = provider.candidatesFor(profile, null).blockFirst();
        assertThat(again.getEmbedding()).isNull();
    }

    @Test
    void constructor_MissingCatalogFails() {
        assertThatThrownBy(() -> new CatalogCandidateProvider(new ObjectMapper(), new DefaultResourceLoader(),
                budgetService, "classpath:catalog/missing.json"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.json");
    }
}
