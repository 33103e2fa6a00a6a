package com.knotcore.service.embedding;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.model.domain.SimilarityQuery;
import com.knotcore.model.dto.HintCreateRequest;
import com.knotcore.model.dto.HintResponse;
import com.knotcore.model.dto.HintSearchRequest;
import com.knotcore.model.dto.HintSearchResponse;
import com.knotcore.model.dto.HintSearchResult;
import com.knotcore.model.entity.Hint;
import com.knotcore.model.enums.HintSource;
import com.knotcore.repository.HintRepository;
import com.knotcore.repository.VaultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Service for hint capture and semantic hint search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HintService {

    private final HintRepository hintRepository;
    private final VaultRepository vaultRepository;
    private final EmbeddingStore embeddingStore;
    private final EmbeddingClient embeddingClient;
    private final Clock clock;

    /**
     * Store a hint right away and embed it in the background.
     * The hint is searchable as soon as its vector arrives.
     *
     * @param vaultId Vault ID
     * @param request Hint request
     * @return Stored hint
     */
    public Mono<HintResponse> addHint(UUID vaultId, HintCreateRequest request) {
        return vaultRepository.existsById(vaultId)
                .flatMap(exists -> {
                    if (!exists) {
                        return Mono.error(new ResourceNotFoundException("Vault", vaultId));
                    }
                    Hint hint = Hint.builder()
                            .vaultId(vaultId)
                            .text(request.getText().trim())
                            .source(request.getSource() != null ? request.getSource() : HintSource.TEXT_INPUT)
                            .used(false)
                            .createdAt(clock.instant())
                            .build();
                    return embeddingStore.store(hint, null);
                })
                .doOnNext(this::embedInBackground)
                .map(HintResponse::from);
    }

    public Flux<HintResponse> listHints(UUID vaultId) {
        return hintRepository.findByVaultIdOrderByCreatedAtDesc(vaultId)
                .map(HintResponse::from);
    }

    public Mono<Void> deleteHint(UUID hintId) {
        return hintRepository.findById(hintId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Hint", hintId)))
                .flatMap(hintRepository::delete);
    }

    /**
     * Semantic search over the hints of a vault.
     *
     * @param vaultId Vault ID
     * @param request Search request
     * @return Search response; empty results when the query cannot be embedded
     */
    public Mono<HintSearchResponse> search(UUID vaultId, HintSearchRequest request) {
        return embeddingClient.embed(request.getQuery())
                .flatMap(vector -> embeddingStore.findSimilar(SimilarityQuery.builder()
                                .vector(vector)
                                .vaultId(vaultId)
                                .limit(request.getLimit() != null ? request.getLimit() : 5)
                                .minSimilarity(request.getMinSimilarity() != null ? request.getMinSimilarity() : 0.0)
                                .unusedOnly(request.isUnusedOnly())
                                .build())
                        .map(match -> HintSearchResult.builder()
                                .hint(HintResponse.from(match.getHint()))
                                .similarity(match.getSimilarity())
                                .build())
                        .collectList()
                        .map(results -> response(vaultId, request, true, results)))
                .switchIfEmpty(Mono.fromSupplier(() -> response(vaultId, request, false, List.of())));
    }

    /**
     * Embed hints that are still missing a vector, oldest first.
     *
     * @param limit Maximum number of hints to process
     * @return Number of hints that received a vector
     */
    public Mono<Long> embedPending(int limit) {
        return hintRepository.findMissingEmbedding(limit)
                .concatMap(hint -> embeddingClient.embed(hint.getText())
                        .flatMap(vector -> embeddingStore.attachVector(hint.getId(), vector)))
                .filter(Boolean::booleanValue)
                .count();
    }

    private void embedInBackground(Hint hint) {
        embeddingClient.embed(hint.getText())
                .flatMap(vector -> embeddingStore.attachVector(hint.getId(), vector))
                .subscribe(
                        attached -> log.debug("Embedding attached to hint {}", hint.getId()),
                        error -> log.warn("Failed to attach embedding to hint {}", hint.getId(), error));
    }

    private HintSearchResponse response(UUID vaultId, HintSearchRequest request, boolean embedded,
                                        List<HintSearchResult> results) {
        return HintSearchResponse.builder()
                .vaultId(vaultId)
                .query(request.getQuery())
                .embedded(embedded)
                .results(results)
                .build();
    }
}
