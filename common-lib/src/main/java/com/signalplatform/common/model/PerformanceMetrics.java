package com.signalplatform.common.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of one calibration cycle. Percentages are on a 0-100 scale rounded to two decimals.
 *
 * @param winRate accuracy over directional (BUY/SELL) signals only
 */
public record PerformanceMetrics(
    Instant from,
    Instant to,
    int totalSignals,
    int correctSignals,
    double accuracy,
    double winRate,
    double avgConfidence,
    Map<TradeDecision, DecisionTypeMetrics> byDecision,
    CalibrationStatus status,
    long thresholdsVersion,
    Instant computedAt
) {
    public PerformanceMetrics {
        byDecision = byDecision == null || byDecision.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(byDecision));
    }

    public static PerformanceMetrics failed(DateRange range, long thresholdsVersion, Instant computedAt) {
        return new PerformanceMetrics(range.from(), range.to(), 0, 0, 0.0, 0.0, 0.0, Map.of(),
                                      CalibrationStatus.FAILED, thresholdsVersion, computedAt);
    }

    public PerformanceMetrics withOutcome(CalibrationStatus status, long thresholdsVersion) {
        return new PerformanceMetrics(from, to, totalSignals, correctSignals, accuracy, winRate,
                                      avgConfidence, byDecision, status, thresholdsVersion, computedAt);
    }
}
