package com.knotcore.service.learning;

import com.knotcore.model.domain.FeedbackSignal;
import com.knotcore.model.domain.WeightDimension;
import com.knotcore.model.domain.WeightSnapshot;
import com.knotcore.util.VectorMath;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a user's feedback history into bounded per-dimension multipliers.
 *
 * For every dimension value seen in positive or negative feedback:
 * {@code multiplier = 1 + k * (pos - neg) / (pos + neg + smoothing)}, clamped to [0.5, 2.0].
 * Values that never received a signal are left out and read as neutral.
 */
@Component
public class PreferenceWeightLearner {

    public static final double MIN_WEIGHT = 0.5;
    public static final double MAX_WEIGHT = 2.0;

    private final double sensitivity;
    private final double smoothing;

    public PreferenceWeightLearner(
            @Value("${knot.learner.sensitivity:1.0}") double sensitivity,
            @Value("${knot.learner.smoothing:3.0}") double smoothing) {
        if (smoothing <= 0) {
            throw new IllegalArgumentException("Smoothing must be positive, got " + smoothing);
        }
        this.sensitivity = sensitivity;
        this.smoothing = smoothing;
    }

    /**
     * Compute a full weight snapshot from scratch.
     *
     * @param signals Every feedback event of the user
     * @param analyzedAt Instant of this run
     * @return Snapshot replacing any previous one
     */
    public WeightSnapshot learn(List<FeedbackSignal> signals, Instant analyzedAt) {
        Map<WeightDimension, Map<String, int[]>> tallies = new EnumMap<>(WeightDimension.class);
        for (WeightDimension dimension : WeightDimension.values()) {
            tallies.put(dimension, new HashMap<>());
        }

        for (FeedbackSignal signal : signals) {
            int polarity = signal.getAction().polarity(signal.getRating());
            if (polarity == 0) {
                continue;
            }
            tally(tallies.get(WeightDimension.VIBE), signal.getVibes(), polarity);
            tally(tallies.get(WeightDimension.INTEREST), signal.getInterests(), polarity);
            tally(tallies.get(WeightDimension.LOVE_LANGUAGE), signal.getLoveLanguages(), polarity);
            if (signal.getRecommendationType() != null) {
                tally(tallies.get(WeightDimension.TYPE), List.of(signal.getRecommendationType()), polarity);
            }
        }

        Map<WeightDimension, Map<String, Double>> weights = new EnumMap<>(WeightDimension.class);
        tallies.forEach((dimension, counts) -> {
            Map<String, Double> multipliers = new HashMap<>();
            counts.forEach((value, posNeg) -> multipliers.put(value, multiplier(posNeg[0], posNeg[1])));
            weights.put(dimension, multipliers);
        });
        return new WeightSnapshot(weights, signals.size(), analyzedAt);
    }

    /**
     * Multiplier for the given signal counts, always within [0.5, 2.0].
     */
    public double multiplier(int positive, int negative) {
        double raw = 1.0 + sensitivity * (positive - negative) / (positive + negative + smoothing);
        return VectorMath.clamp(raw, MIN_WEIGHT, MAX_WEIGHT);
    }

    private static void tally(Map<String, int[]> counts, Collection<String> values, int polarity) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            int[] posNeg = counts.computeIfAbsent(value, k -> new int[2]);
            posNeg[polarity > 0 ? 0 : 1]++;
        }
    }
}
