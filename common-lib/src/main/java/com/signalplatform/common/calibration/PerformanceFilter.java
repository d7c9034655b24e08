package com.signalplatform.common.calibration;

import com.signalplatform.common.model.DecisionTypeMetrics;
import com.signalplatform.common.model.PerformanceMetrics;
import com.signalplatform.common.model.TradeDecision;

import java.util.Locale;
import java.util.Optional;

/**
 * Suppresses directional signals while recent back-test performance is poor.
 *
 * <pre>
 *   overall accuracy &lt; 60% and confidence &lt; 70         filter
 *   decision type accuracy &lt; 50% over more than 5 samples filter
 * </pre>
 * No metrics yet, or metrics from a failed/empty cycle, never filter.
 */
public final class PerformanceFilter {

    static final double POOR_ACCURACY           = 60.0;
    static final double REQUIRED_CONFIDENCE     = 70.0;
    static final double POOR_TYPE_ACCURACY      = 50.0;
    static final int    MIN_TYPE_SAMPLES        = 5;

    private PerformanceFilter() {}

    /**
     * @return the rejection reason, or empty when the signal may proceed
     */
    public static Optional<String> check(PerformanceMetrics latest, TradeDecision decision, double confidence) {
        if (latest == null || latest.totalSignals() == 0 || !decision.isDirectional()) {
            return Optional.empty();
        }
        if (latest.accuracy() < POOR_ACCURACY && confidence < REQUIRED_CONFIDENCE) {
            return Optional.of(String.format(Locale.ROOT,
                "Poor recent accuracy %.1f%% and confidence %.1f below %.0f",
                latest.accuracy(), confidence, REQUIRED_CONFIDENCE));
        }
        DecisionTypeMetrics type = latest.byDecision().get(decision);
        if (type != null && type.count() > MIN_TYPE_SAMPLES && type.accuracy() < POOR_TYPE_ACCURACY) {
            return Optional.of(String.format(Locale.ROOT,
                "Poor %s performance: %.1f%% over %d signals", decision, type.accuracy(), type.count()));
        }
        return Optional.empty();
    }
}
