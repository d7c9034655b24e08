package com.signalplatform.common.calibration;

import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.CalibrationStatus;
import com.signalplatform.common.model.PerformanceMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdAdjusterTest {

    private static final double EPS = 1e-9;
    private static final Instant NOW = Instant.parse("2024-03-08T02:00:00Z");
    private static final CalibrationSettings SETTINGS = CalibrationSettings.defaults();

    private static PerformanceMetrics metrics(int samples, double accuracy) {
        return new PerformanceMetrics(Instant.EPOCH, NOW, samples, (int) Math.round(samples * accuracy / 100.0),
                                      accuracy, accuracy, 75.0, Map.of(), CalibrationStatus.UNCHANGED, 0L, NOW);
    }

    private static AdaptiveThresholds thresholds(double minConfidence, boolean consensusRequired, double bonus) {
        return AdaptiveThresholds.initial(minConfidence, consensusRequired, bonus, Instant.EPOCH);
    }

    // ── no-op paths ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("adjust(): no change")
    class NoChangeTests {

        @Test
        @DisplayName("fewer than minSamples → INSUFFICIENT_DATA, same instance")
        void insufficientData() {
            AdaptiveThresholds current = thresholds(70, true, 0);

            ThresholdAdjuster.Adjustment a = ThresholdAdjuster.adjust(metrics(19, 10.0), current, SETTINGS, NOW);

            assertEquals(CalibrationStatus.INSUFFICIENT_DATA, a.status());
            assertSame(current, a.thresholds());
        }

        @Test
        @DisplayName("accuracy exactly 60 or 80 → UNCHANGED (bounds exclusive)")
        void boundsExclusive() {
            AdaptiveThresholds current = thresholds(70, true, 0);

            assertEquals(CalibrationStatus.UNCHANGED,
                ThresholdAdjuster.adjust(metrics(50, 60.0), current, SETTINGS, NOW).status());
            assertEquals(CalibrationStatus.UNCHANGED,
                ThresholdAdjuster.adjust(metrics(50, 80.0), current, SETTINGS, NOW).status());
        }

        @Test
        @DisplayName("rule fires but everything already pinned → UNCHANGED")
        void pinnedAtBounds() {
            AdaptiveThresholds current = thresholds(80, true, 0);

            ThresholdAdjuster.Adjustment a = ThresholdAdjuster.adjust(metrics(50, 40.0), current, SETTINGS, NOW);

            assertEquals(CalibrationStatus.UNCHANGED, a.status());
            assertSame(current, a.thresholds());
        }
    }

    // ── adjustments ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("adjust(): changes")
    class ChangeTests {

        @Test
        @DisplayName("poor accuracy → stricter: +5 confidence, consensus required, bonus down")
        void poorAccuracy() {
            ThresholdAdjuster.Adjustment a = ThresholdAdjuster.adjust(
                metrics(40, 45.0), thresholds(70, false, 3), SETTINGS, NOW);

            assertEquals(CalibrationStatus.ADJUSTED, a.status());
            assertEquals(75.0, a.thresholds().minConfidence(), EPS);
            assertTrue(a.thresholds().consensusRequired());
            assertEquals(2.0, a.thresholds().consensusAgreementBonus(), EPS);
            assertEquals(2L, a.thresholds().version());
            assertEquals(NOW, a.thresholds().publishedAt());
        }

        @Test
        @DisplayName("raise is capped at maxMinConfidence")
        void raiseCapped() {
            ThresholdAdjuster.Adjustment a = ThresholdAdjuster.adjust(
                metrics(40, 45.0), thresholds(78, true, 0), SETTINGS, NOW);

            assertEquals(80.0, a.thresholds().minConfidence(), EPS);
        }

        @Test
        @DisplayName("perfect history → minConfidence decreased, bonus up, consensus flag kept")
        void perfectHistory() {
            ThresholdAdjuster.Adjustment a = ThresholdAdjuster.adjust(
                metrics(30, 100.0), thresholds(70, true, 0), SETTINGS, NOW);

            assertEquals(CalibrationStatus.ADJUSTED, a.status());
            assertEquals(68.0, a.thresholds().minConfidence(), EPS);
            assertEquals(1.0, a.thresholds().consensusAgreementBonus(), EPS);
            assertTrue(a.thresholds().consensusRequired());
        }

        @Test
        @DisplayName("relax is floored at minMinConfidence, bonus capped at max")
        void relaxFloored() {
            ThresholdAdjuster.Adjustment a = ThresholdAdjuster.adjust(
                metrics(30, 95.0), thresholds(51, true, 5), SETTINGS, NOW);

            assertEquals(50.0, a.thresholds().minConfidence(), EPS);
            assertEquals(5.0, a.thresholds().consensusAgreementBonus(), EPS);
        }
    }
}
