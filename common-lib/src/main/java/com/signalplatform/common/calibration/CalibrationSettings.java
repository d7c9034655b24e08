package com.signalplatform.common.calibration;

import com.signalplatform.common.model.AdaptiveThresholds;

/**
 * Tunables of the adaptive calibration loop. Accuracy bounds are exclusive: accuracy
 * exactly at {@code lowAccuracy} or {@code highAccuracy} leaves thresholds unchanged.
 *
 * @param lookbackDays      default history window for a cycle
 * @param minMovePercent    price move (percent) below which the market counts as flat
 * @param minSamples        signals required before thresholds may move
 * @param raiseStep         minConfidence increase on poor accuracy
 * @param relaxStep         minConfidence decrease on strong accuracy
 * @param bonusStep         agreement-bonus change per adjustment
 */
public record CalibrationSettings(
    int lookbackDays,
    double minMovePercent,
    int minSamples,
    double lowAccuracy,
    double highAccuracy,
    double raiseStep,
    double relaxStep,
    double minMinConfidence,
    double maxMinConfidence,
    double bonusStep,
    double maxAgreementBonus
) {
    public CalibrationSettings {
        if (lowAccuracy >= highAccuracy) {
            throw new IllegalArgumentException("lowAccuracy must be below highAccuracy");
        }
        if (minMinConfidence > maxMinConfidence) {
            throw new IllegalArgumentException("minMinConfidence must not exceed maxMinConfidence");
        }
    }

    /**
     * Rejects starting thresholds the adjuster could never have produced.
     *
     * @return {@code thresholds}, unchanged
     * @throws IllegalArgumentException when minConfidence lies outside
     *         [minMinConfidence, maxMinConfidence] or the agreement bonus outside [0, maxAgreementBonus]
     */
    public AdaptiveThresholds requireWithinBounds(AdaptiveThresholds thresholds) {
        double minConfidence = thresholds.minConfidence();
        if (minConfidence < minMinConfidence || minConfidence > maxMinConfidence) {
            throw new IllegalArgumentException("minConfidence " + minConfidence + " outside ["
                                               + minMinConfidence + ", " + maxMinConfidence + "]");
        }
        double bonus = thresholds.consensusAgreementBonus();
        if (bonus < 0.0 || bonus > maxAgreementBonus) {
            throw new IllegalArgumentException("consensusAgreementBonus " + bonus + " outside [0, "
                                               + maxAgreementBonus + "]");
        }
        return thresholds;
    }

    public static CalibrationSettings defaults() {
        return new CalibrationSettings(7, 0.01, 20, 60.0, 80.0, 5.0, 2.0, 50.0, 80.0, 1.0, 5.0);
    }
}
