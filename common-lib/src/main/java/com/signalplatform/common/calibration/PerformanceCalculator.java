package com.signalplatform.common.calibration;

import com.signalplatform.common.model.BacktestRecord;
import com.signalplatform.common.model.CalibrationStatus;
import com.signalplatform.common.model.DateRange;
import com.signalplatform.common.model.DecisionTypeMetrics;
import com.signalplatform.common.model.PerformanceMetrics;
import com.signalplatform.common.model.TradeDecision;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates back-test records into {@link PerformanceMetrics}.
 *
 * <p>The returned metrics carry {@link CalibrationStatus#UNCHANGED} and version 0;
 * the calibrator stamps the real outcome once thresholds have been adjusted.
 */
public final class PerformanceCalculator {

    private PerformanceCalculator() {}

    public static PerformanceMetrics calculate(List<BacktestRecord> records, DateRange range, Instant computedAt) {
        int total   = records.size();
        int correct = (int) records.stream().filter(BacktestRecord::correct).count();

        List<BacktestRecord> directional = records.stream()
            .filter(r -> r.decision().isDirectional())
            .toList();
        long directionalWins = directional.stream().filter(BacktestRecord::correct).count();

        double avgConfidence = records.stream().mapToDouble(BacktestRecord::confidence).average().orElse(0.0);

        Map<TradeDecision, DecisionTypeMetrics> byDecision = new EnumMap<>(TradeDecision.class);
        for (TradeDecision type : TradeDecision.values()) {
            List<BacktestRecord> ofType = records.stream().filter(r -> r.decision() == type).toList();
            if (ofType.isEmpty()) continue;
            long typeCorrect = ofType.stream().filter(BacktestRecord::correct).count();
            double typeConfidence = ofType.stream().mapToDouble(BacktestRecord::confidence).average().orElse(0.0);
            byDecision.put(type, new DecisionTypeMetrics(ofType.size(),
                                                         percent(typeCorrect, ofType.size()),
                                                         round2(typeConfidence)));
        }

        return new PerformanceMetrics(range.from(), range.to(), total, correct,
                                      percent(correct, total),
                                      percent(directionalWins, directional.size()),
                                      round2(avgConfidence), byDecision,
                                      CalibrationStatus.UNCHANGED, 0L, computedAt);
    }

    static double percent(long part, long whole) {
        return whole == 0 ? 0.0 : round2(part * 100.0 / whole);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
