package com.signalplatform.common.model;

import java.util.List;

/**
 * Cross-timeframe aggregate produced by the confluence aggregator.
 *
 * <p>{@code sufficient == false} means no direction cleared the confluence floor;
 * the pipeline turns that into NO_TRADE without consulting the judges.
 */
public record ConfluenceResult(
    BiasDirection direction,
    double confidence,
    int agreeingTimeframes,
    int analyzedTimeframes,
    int bullishCount,
    int bearishCount,
    int neutralCount,
    double weightedBullishScore,
    double weightedBearishScore,
    boolean higherTimeframesConfirmed,
    boolean sufficient,
    List<TimeframeBias> biases,
    String explanation
) {
    public ConfluenceResult {
        biases = biases == null ? List.of() : List.copyOf(biases);
    }
}
