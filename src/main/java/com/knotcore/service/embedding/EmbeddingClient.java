package com.knotcore.service.embedding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible embeddings endpoint.
 * Failures never propagate: an unavailable embedding is an empty Mono and the hint keeps a null vector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingClient {

    private final WebClient.Builder webClientBuilder;

    @Value("${knot.embedding.api-url}")
    private String apiUrl;

    @Value("${knot.embedding.api-key:}")
    private String apiKey;

    @Value("${knot.embedding.model}")
    private String model;

    @Value("${knot.embedding.dimension:768}")
    private int dimension;

    @Value("${knot.embedding.timeout:PT8S}")
    private Duration timeout;

    /**
     * Generate embedding vector for text content.
     *
     * @param text Input text
     * @return Embedding vector, or empty when the service is unavailable or answers with a wrong dimension
     */
    public Mono<float[]> embed(String text) {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Embedding API key not configured, skipping embedding");
            return Mono.empty();
        }
        WebClient webClient = webClientBuilder.baseUrl(apiUrl).build();

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "input", text,
                "encoding_format", "float"
        );

        return webClient.post()
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(Map.class)
                .timeout(timeout)
                .map(this::extractEmbedding)
                .filter(vector -> {
                    if (vector.length != dimension) {
                        log.warn("Embedding API returned dimension {}, expected {}", vector.length, dimension);
                        return false;
                    }
                    return true;
                })
                .onErrorResume(error -> {
                    log.warn("Failed to generate embedding: {}", error.toString());
                    return Mono.empty();
                });
    }

    private float[] extractEmbedding(Map<?, ?> response) {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        if (data == null || data.isEmpty()) {
            throw new IllegalStateException("Invalid embedding response");
        }
        @SuppressWarnings("unchecked")
        List<Number> embedding = (List<Number>) data.get(0).get("embedding");
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = embedding.get(i).floatValue();
        }
        return vector;
    }
}
