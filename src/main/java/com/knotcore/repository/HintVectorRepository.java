package com.knotcore.repository;

import com.knotcore.model.entity.Hint;
import com.knotcore.model.enums.HintSource;
import com.knotcore.util.VectorMath;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Raw SQL access to the pgvector embedding column of {@code hints}.
 * R2DBC repository methods don't support vector types, so queries go through DatabaseClient.
 */
@Repository
@RequiredArgsConstructor
public class HintVectorRepository {

    private static final String HINT_COLUMNS = "id, vault_id, hint_text, source, is_used, created_at";

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;

    /**
     * Set or clear the embedding of a hint.
     *
     * @param hintId Hint ID
     * @param vector Embedding, or null to clear it
     * @return Number of rows updated
     */
    public Mono<Integer> updateEmbedding(UUID hintId, float[] vector) {
        DatabaseClient.GenericExecuteSpec spec = vector == null
                ? databaseClient.sql("UPDATE hints SET embedding = NULL WHERE id = :id")
                : databaseClient.sql("UPDATE hints SET embedding = CAST(:vector AS vector) WHERE id = :id")
                        .bind("vector", VectorMath.toLiteral(vector));
        return spec.bind("id", hintId)
                .fetch()
                .rowsUpdated()
                .map(Long::intValue);
    }

    /**
     * Count hints that carry an embedding.
     *
     * @param vaultId Vault scope, or null for all vaults
     */
    public Mono<Long> countEmbedded(UUID vaultId) {
        String sql = "SELECT COUNT(*) AS total FROM hints WHERE embedding IS NOT NULL";
        if (vaultId == null) {
            return databaseClient.sql(sql)
                    .map((row, metadata) -> row.get("total", Long.class))
                    .one();
        }
        return databaseClient.sql(sql + " AND vault_id = :vaultId")
                .bind("vaultId", vaultId)
                .map((row, metadata) -> row.get("total", Long.class))
                .one();
    }

    /**
     * Load hints with their vectors for an exact scan in memory.
     *
     * @param vaultId Vault scope, or null for all vaults
     * @param unusedOnly Skip hints already used in a confirmed recommendation
     */
    public Flux<EmbeddedHint> findEmbedded(UUID vaultId, boolean unusedOnly) {
        String sql = "SELECT " + HINT_COLUMNS + ", embedding::text AS embedding_text FROM hints " +
                "WHERE embedding IS NOT NULL" +
                (vaultId != null ? " AND vault_id = :vaultId" : "") +
                (unusedOnly ? " AND is_used = FALSE" : "");

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql);
        if (vaultId != null) {
            spec = spec.bind("vaultId", vaultId);
        }
        return spec.map((row, metadata) -> new EmbeddedHint(
                        mapHint(row),
                        VectorMath.fromLiteral(row.get("embedding_text", String.class))))
                .all();
    }

    /**
     * Approximate nearest neighbours through the HNSW index, by cosine distance.
     * {@code hnsw.ef_search} is set for the enclosing transaction only.
     *
     * @param efSearch Candidate list size of the index scan; higher means better recall
     */
    public Flux<ScoredHint> findNearest(float[] vector, UUID vaultId, boolean unusedOnly, int limit, int efSearch) {
        String sql = "SELECT " + HINT_COLUMNS + ", 1 - (embedding <=> CAST(:vector AS vector)) AS similarity " +
                "FROM hints WHERE embedding IS NOT NULL" +
                (vaultId != null ? " AND vault_id = :vaultId" : "") +
                (unusedOnly ? " AND is_used = FALSE" : "") +
                " ORDER BY embedding <=> CAST(:vector AS vector) LIMIT :limit";

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql)
                .bind("vector", VectorMath.toLiteral(vector))
                .bind("limit", limit);
        if (vaultId != null) {
            spec = spec.bind("vaultId", vaultId);
        }
        Flux<ScoredHint> query = spec.map((row, metadata) -> new ScoredHint(
                        mapHint(row),
                        row.get("similarity", Double.class)))
                .all();

        Mono<Void> tune = databaseClient.sql("SELECT set_config('hnsw.ef_search', :efSearch, true)")
                .bind("efSearch", String.valueOf(efSearch))
                .fetch()
                .first()
                .then();

        return transactionalOperator.transactional(tune.thenMany(query));
    }

    private static Hint mapHint(Row row) {
        String source = row.get("source", String.class);
        Boolean used = row.get("is_used", Boolean.class);
        return Hint.builder()
                .id(row.get("id", UUID.class))
                .vaultId(row.get("vault_id", UUID.class))
                .text(row.get("hint_text", String.class))
                .source(source != null ? HintSource.valueOf(source) : null)
                .used(Boolean.TRUE.equals(used))
                .createdAt(row.get("created_at", Instant.class))
                .build();
    }

    /**
     * Hint with its stored vector.
     */
    @Value
    public static class EmbeddedHint {
        Hint hint;
        float[] vector;
    }

    /**
     * Hint with the raw similarity computed by the database.
     */
    @Value
    public static class ScoredHint {
        Hint hint;
        Double similarity;
    }
}
