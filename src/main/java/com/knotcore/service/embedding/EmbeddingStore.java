package com.knotcore.service.embedding;

import com.knotcore.model.domain.SimilarHint;
import com.knotcore.model.domain.SimilarityQuery;
import com.knotcore.model.entity.Hint;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Persistent index of hints and their embeddings, queried by cosine similarity.
 * Hints without a vector are stored but never returned by {@link #findSimilar}.
 */
public interface EmbeddingStore {

    /**
     * Persist a hint, optionally with its vector.
     *
     * @param hint Hint to store
     * @param vector Embedding, or null if not yet available
     * @return Stored hint with its generated ID
     */
    Mono<Hint> store(Hint hint, float[] vector);

    /**
     * Attach (or clear, with null) the vector of an existing hint. The hint becomes searchable
     * immediately; no rebuild is required.
     *
     * @return true if the hint exists
     */
    Mono<Boolean> attachVector(UUID hintId, float[] vector);

    /**
     * Hints most similar to the query vector, by descending similarity.
     */
    Flux<SimilarHint> findSimilar(SimilarityQuery query);
}
