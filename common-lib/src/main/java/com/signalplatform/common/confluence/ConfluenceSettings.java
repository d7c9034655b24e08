package com.signalplatform.common.confluence;

/**
 * Tunables of {@link ConfluenceAggregator}.
 *
 * @param minConfluence             timeframes that must agree before a direction counts
 * @param strongConfluence          agreeing timeframes that earn the strong-confluence increment
 * @param higherTimeframeBoost      multiplier applied when every higher timeframe agrees
 * @param strongConfluenceIncrement added to confidence at strong confluence
 * @param confidenceCap             ceiling for confluence confidence
 */
public record ConfluenceSettings(
    int minConfluence,
    int strongConfluence,
    double higherTimeframeBoost,
    double strongConfluenceIncrement,
    double confidenceCap
) {
    public ConfluenceSettings {
        if (minConfluence < 1) {
            throw new IllegalArgumentException("minConfluence must be at least 1");
        }
        if (strongConfluence < minConfluence) {
            throw new IllegalArgumentException("strongConfluence must not be below minConfluence");
        }
        if (confidenceCap <= 0.0 || confidenceCap > 1.0) {
            throw new IllegalArgumentException("confidenceCap must be in (0, 1]");
        }
    }

    public static ConfluenceSettings defaults() {
        return new ConfluenceSettings(3, 5, 1.10, 0.05, 0.95);
    }
}
