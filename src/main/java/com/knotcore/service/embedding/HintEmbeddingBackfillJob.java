package com.knotcore.service.embedding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retries embedding for hints stored while the embedding service was unavailable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HintEmbeddingBackfillJob {

    private final HintService hintService;

    @Value("${knot.embedding.backfill-batch-size:50}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${knot.embedding.backfill-interval-ms:300000}",
            initialDelayString = "${knot.embedding.backfill-interval-ms:300000}")
    public void backfill() {
        try {
            Long embedded = hintService.embedPending(batchSize).block(Duration.ofMinutes(5));
            if (embedded != null && embedded > 0) {
                log.info("Backfilled embeddings for {} hints", embedded);
            }
        } catch (Exception e) {
            log.error("Hint embedding backfill failed: {}", e.getMessage(), e);
        }
    }
}
