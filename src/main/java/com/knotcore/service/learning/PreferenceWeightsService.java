package com.knotcore.service.learning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knotcore.model.domain.WeightDimension;
import com.knotcore.model.domain.WeightSnapshot;
import com.knotcore.model.dto.PreferenceWeightsResponse;
import com.knotcore.model.entity.PreferenceWeights;
import com.knotcore.repository.PreferenceWeightsRepository;
import com.knotcore.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Reads and writes learned weight snapshots. Weight maps are persisted as JSONB.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreferenceWeightsService {

    private static final TypeReference<Map<String, Double>> WEIGHT_MAP = new TypeReference<>() {
    };

    private final PreferenceWeightsRepository preferenceWeightsRepository;
    private final ObjectMapper objectMapper;

    /**
     * Latest committed snapshot of a user; neutral when nothing was learned yet.
     *
     * @param userId User ID
     * @return Weight snapshot
     */
    public Mono<WeightSnapshot> snapshotFor(UUID userId) {
        return preferenceWeightsRepository.findByUserId(userId)
                .map(this::toSnapshot)
                .defaultIfEmpty(WeightSnapshot.neutral());
    }

    public Mono<PreferenceWeightsResponse> getWeights(UUID userId) {
        return snapshotFor(userId)
                .map(snapshot -> PreferenceWeightsResponse.builder()
                        .userId(userId)
                        .vibeWeights(new TreeMap<>(snapshot.values(WeightDimension.VIBE)))
                        .interestWeights(new TreeMap<>(snapshot.values(WeightDimension.INTEREST)))
                        .typeWeights(new TreeMap<>(snapshot.values(WeightDimension.TYPE)))
                        .loveLanguageWeights(new TreeMap<>(snapshot.values(WeightDimension.LOVE_LANGUAGE)))
                        .feedbackCount(snapshot.getFeedbackCount())
                        .lastAnalyzedAt(snapshot.getAnalyzedAt())
                        .build());
    }

    /**
     * Replace the snapshot of a user unless a newer one was written meanwhile.
     * Values are clamped again before they reach storage.
     *
     * @param userId User ID
     * @param snapshot Freshly learned snapshot
     * @return true if written, false if rejected as stale
     */
    public Mono<Boolean> replaceSnapshot(UUID userId, WeightSnapshot snapshot) {
        return Mono.fromCallable(() -> new String[]{
                        serialize(snapshot.values(WeightDimension.VIBE)),
                        serialize(snapshot.values(WeightDimension.INTEREST)),
                        serialize(snapshot.values(WeightDimension.TYPE)),
                        serialize(snapshot.values(WeightDimension.LOVE_LANGUAGE))})
                .flatMap(json -> preferenceWeightsRepository.upsertIfNewer(userId, json[0], json[1], json[2], json[3],
                        snapshot.getFeedbackCount(), snapshot.getAnalyzedAt()))
                .map(updated -> updated > 0);
    }

    private WeightSnapshot toSnapshot(PreferenceWeights row) {
        Map<WeightDimension, Map<String, Double>> weights = new EnumMap<>(WeightDimension.class);
        weights.put(WeightDimension.VIBE, deserialize(row.getVibeWeights()));
        weights.put(WeightDimension.INTEREST, deserialize(row.getInterestWeights()));
        weights.put(WeightDimension.TYPE, deserialize(row.getTypeWeights()));
        weights.put(WeightDimension.LOVE_LANGUAGE, deserialize(row.getLoveLanguageWeights()));
        return new WeightSnapshot(weights, row.getFeedbackCount(), row.getLastAnalyzedAt());
    }

    /**
     * Serialize a weight map to JSON, clamping every value into the allowed range.
     */
    private String serialize(Map<String, Double> weights) throws JsonProcessingException {
        Map<String, Double> bounded = new TreeMap<>();
        weights.forEach((key, value) -> bounded.put(key,
                VectorMath.clamp(value, PreferenceWeightLearner.MIN_WEIGHT, PreferenceWeightLearner.MAX_WEIGHT)));
        return objectMapper.writeValueAsString(bounded);
    }

    /**
     * Deserialize JSON string to weight map. Unreadable maps are treated as neutral.
     */
    private Map<String, Double> deserialize(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, WEIGHT_MAP);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize weight map, using neutral weights", e);
            return Map.of();
        }
    }
}
