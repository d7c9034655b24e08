package com.signalplatform.common.calibration;

import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.CalibrationStatus;
import com.signalplatform.common.model.PerformanceMetrics;

import java.time.Instant;

/**
 * Pure threshold adjustment rules.
 *
 * <pre>
 *   samples &lt; minSamples        no change (INSUFFICIENT_DATA)
 *   accuracy &lt; lowAccuracy      minConfidence + raiseStep (&lt;= max), consensusRequired = true,
 *                               agreement bonus - bonusStep (&gt;= 0)
 *   accuracy &gt; highAccuracy     minConfidence - relaxStep (&gt;= min),
 *                               agreement bonus + bonusStep (&lt;= maxAgreementBonus)
 *   otherwise                  no change
 * </pre>
 * A rule that fires but is already pinned at its bounds also reports UNCHANGED.
 */
public final class ThresholdAdjuster {

    private ThresholdAdjuster() {}

    public record Adjustment(CalibrationStatus status, AdaptiveThresholds thresholds) {}

    public static Adjustment adjust(PerformanceMetrics metrics, AdaptiveThresholds current,
                                    CalibrationSettings settings, Instant now) {
        if (metrics.totalSignals() < settings.minSamples()) {
            return new Adjustment(CalibrationStatus.INSUFFICIENT_DATA, current);
        }

        double accuracy = metrics.accuracy();
        AdaptiveThresholds candidate;
        if (accuracy < settings.lowAccuracy()) {
            candidate = current.next(
                Math.min(current.minConfidence() + settings.raiseStep(), settings.maxMinConfidence()),
                true,
                Math.max(current.consensusAgreementBonus() - settings.bonusStep(), 0.0),
                now);
        } else if (accuracy > settings.highAccuracy()) {
            candidate = current.next(
                Math.max(current.minConfidence() - settings.relaxStep(), settings.minMinConfidence()),
                current.consensusRequired(),
                Math.min(current.consensusAgreementBonus() + settings.bonusStep(), settings.maxAgreementBonus()),
                now);
        } else {
            return new Adjustment(CalibrationStatus.UNCHANGED, current);
        }

        if (candidate.sameValuesAs(current)) {
            return new Adjustment(CalibrationStatus.UNCHANGED, current);
        }
        return new Adjustment(CalibrationStatus.ADJUSTED, candidate);
    }
}
