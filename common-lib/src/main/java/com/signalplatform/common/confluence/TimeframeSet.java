package com.signalplatform.common.confluence;

import com.signalplatform.common.model.Timeframe;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The timeframes the pipeline analyzes, each with a fixed weight, plus the subset treated
 * as "higher" timeframes for the confirmation boost.
 *
 * <p>Weights must sum to 1.0; anything else is a configuration error raised at construction.
 */
public record TimeframeSet(Map<Timeframe, Double> weights, List<Timeframe> higherTimeframes) {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    public TimeframeSet {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("At least one timeframe must be configured");
        }
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Timeframe weights must sum to 1.0 but sum to " + sum);
        }
        if (weights.values().stream().anyMatch(w -> w < 0.0)) {
            throw new IllegalArgumentException("Timeframe weights must not be negative: " + weights);
        }
        higherTimeframes = higherTimeframes == null ? List.of() : List.copyOf(higherTimeframes);
        for (Timeframe tf : higherTimeframes) {
            if (!weights.containsKey(tf)) {
                throw new IllegalArgumentException("Higher timeframe " + tf.label() + " is not configured");
            }
        }
        weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    /**
     * Builds a set whose higher timeframes are the {@code higherCount} longest configured ones.
     */
    public static TimeframeSet of(Map<Timeframe, Double> weights, int higherCount) {
        List<Timeframe> higher = weights.keySet().stream()
            .sorted(Comparator.comparing(Timeframe::duration).reversed())
            .limit(Math.max(0, higherCount))
            .sorted()
            .toList();
        return new TimeframeSet(weights, higher);
    }

    /** 5m, 15m, 30m, 1h, 4h, 1d; 4h and 1d are the higher timeframes. */
    public static TimeframeSet defaults() {
        Map<Timeframe, Double> weights = new EnumMap<>(Timeframe.class);
        weights.put(Timeframe.M5,  0.10);
        weights.put(Timeframe.M15, 0.15);
        weights.put(Timeframe.M30, 0.15);
        weights.put(Timeframe.H1,  0.20);
        weights.put(Timeframe.H4,  0.20);
        weights.put(Timeframe.D1,  0.20);
        return of(weights, 2);
    }

    public List<Timeframe> timeframes() {
        return List.copyOf(weights.keySet());
    }

    public double weightOf(Timeframe timeframe) {
        return weights.getOrDefault(timeframe, 0.0);
    }
}
