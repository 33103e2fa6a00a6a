package com.knotcore.model.domain;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only view of a user's learned multipliers. Missing values are neutral (1.0).
 */
@Value
public class WeightSnapshot {

    public static final double NEUTRAL = 1.0;

    Map<WeightDimension, Map<String, Double>> weights;
    int feedbackCount;
    Instant analyzedAt;

    public WeightSnapshot(Map<WeightDimension, Map<String, Double>> weights, int feedbackCount, Instant analyzedAt) {
        EnumMap<WeightDimension, Map<String, Double>> copy = new EnumMap<>(WeightDimension.class);
        for (WeightDimension dimension : WeightDimension.values()) {
            Map<String, Double> values = weights == null ? null : weights.get(dimension);
            copy.put(dimension, values == null ? Map.of() : Map.copyOf(values));
        }
        this.weights = Collections.unmodifiableMap(copy);
        this.feedbackCount = feedbackCount;
        this.analyzedAt = analyzedAt;
    }

    public static WeightSnapshot neutral() {
        return new WeightSnapshot(Map.of(), 0, null);
    }

    public double weight(WeightDimension dimension, Enum<?> value) {
        return weights.get(dimension).getOrDefault(value.name(), NEUTRAL);
    }

    public Map<String, Double> values(WeightDimension dimension) {
        return weights.get(dimension);
    }
}
