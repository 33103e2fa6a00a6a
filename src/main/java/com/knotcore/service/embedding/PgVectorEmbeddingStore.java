package com.knotcore.service.embedding;

import com.knotcore.exception.ValidationException;
import com.knotcore.model.domain.SimilarHint;
import com.knotcore.model.domain.SimilarityQuery;
import com.knotcore.model.entity.Hint;
import com.knotcore.repository.HintRepository;
import com.knotcore.repository.HintVectorRepository;
import com.knotcore.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.UUID;

/**
 * Embedding store on PostgreSQL/pgvector.
 *
 * Small scopes are answered by an exact scan in memory; once the number of embedded hints
 * in scope exceeds {@code knot.embedding.linear-scan-threshold} the query goes to the HNSW index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PgVectorEmbeddingStore implements EmbeddingStore {

    private final HintRepository hintRepository;
    private final HintVectorRepository hintVectorRepository;

    @Value("${knot.embedding.dimension:768}")
    private int dimension;

    @Value("${knot.embedding.linear-scan-threshold:1000}")
    private long linearScanThreshold;

    @Value("${knot.embedding.ef-search:64}")
    private int efSearch;

    @Override
    public Mono<Hint> store(Hint hint, float[] vector) {
        return Mono.defer(() -> {
            checkDimension(vector);
            return hintRepository.save(hint);
        }).flatMap(saved -> vector == null
                ? Mono.just(saved)
                : hintVectorRepository.updateEmbedding(saved.getId(), vector).thenReturn(saved));
    }

    @Override
    public Mono<Boolean> attachVector(UUID hintId, float[] vector) {
        return Mono.defer(() -> {
                    checkDimension(vector);
                    return hintVectorRepository.updateEmbedding(hintId, vector);
                })
                .map(updated -> updated > 0)
                .doOnNext(found -> {
                    if (!found) {
                        log.debug("Hint {} disappeared before its embedding was attached", hintId);
                    }
                });
    }

    @Override
    public Flux<SimilarHint> findSimilar(SimilarityQuery query) {
        if (query.getVector() == null) {
            return Flux.error(new ValidationException("Similarity query requires a vector"));
        }
        if (query.getVector().length != dimension) {
            return Flux.error(new ValidationException("query dimension", query.getVector().length,
                    "expected " + dimension));
        }
        if (query.getLimit() <= 0) {
            return Flux.empty();
        }
        return hintVectorRepository.countEmbedded(query.getVaultId())
                .defaultIfEmpty(0L)
                .flatMapMany(count -> count <= linearScanThreshold
                        ? linearScan(query)
                        : indexScan(query));
    }

    private Flux<SimilarHint> linearScan(SimilarityQuery query) {
        return hintVectorRepository.findEmbedded(query.getVaultId(), query.isUnusedOnly())
                .filter(row -> row.getVector() != null && row.getVector().length == query.getVector().length)
                .map(row -> new SimilarHint(row.getHint(), VectorMath.similarity(query.getVector(), row.getVector())))
                .filter(match -> match.getSimilarity() >= query.getMinSimilarity())
                .sort(Comparator.comparingDouble(SimilarHint::getSimilarity).reversed())
                .take(query.getLimit());
    }

    private Flux<SimilarHint> indexScan(SimilarityQuery query) {
        log.debug("Using HNSW index for similarity query (vault={}, limit={})", query.getVaultId(), query.getLimit());
        return hintVectorRepository.findNearest(query.getVector(), query.getVaultId(), query.isUnusedOnly(),
                        query.getLimit(), efSearch)
                .map(row -> new SimilarHint(row.getHint(),
                        VectorMath.clamp(row.getSimilarity() == null ? 0.0 : row.getSimilarity(), 0.0, 1.0)))
                .filter(match -> match.getSimilarity() >= query.getMinSimilarity());
    }

    private void checkDimension(float[] vector) {
        if (vector != null && vector.length != dimension) {
            throw new ValidationException("embedding dimension", vector.length, "expected " + dimension);
        }
    }
}
