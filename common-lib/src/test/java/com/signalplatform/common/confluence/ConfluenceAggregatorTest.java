package com.signalplatform.common.confluence;

import com.signalplatform.common.exception.InsufficientDataException;
import com.signalplatform.common.model.BiasDirection;
import com.signalplatform.common.model.ConfluenceResult;
import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.common.model.TimeframeBias;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.signalplatform.common.model.BiasDirection.*;
import static org.junit.jupiter.api.Assertions.*;

class ConfluenceAggregatorTest {

    private static final double EPS = 1e-9;

    private final ConfluenceAggregator aggregator =
        new ConfluenceAggregator(TimeframeSet.defaults(), ConfluenceSettings.defaults(), 50);

    /** Biases for 5m, 15m, 30m, 1h, 4h, 1d in that order. */
    private static List<TimeframeBias> biases(BiasDirection... directions) {
        Timeframe[] tfs = { Timeframe.M5, Timeframe.M15, Timeframe.M30, Timeframe.H1, Timeframe.H4, Timeframe.D1 };
        List<TimeframeBias> out = new ArrayList<>();
        for (int i = 0; i < directions.length; i++) {
            out.add(new TimeframeBias(tfs[i], directions[i], 0.8, TimeframeSet.defaults().weightOf(tfs[i]),
                                      0, 0, 0, List.of()));
        }
        return out;
    }

    // ── aggregate() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("aggregate(): counting rules")
    class AggregateTests {

        @Test
        @DisplayName("4/6 bullish with 4h and 1d agreeing → boosted confidence, no strong bonus")
        void higherTimeframesBoost() {
            ConfluenceResult r = aggregator.aggregate(biases(NEUTRAL, NEUTRAL, BULLISH, BULLISH, BULLISH, BULLISH));

            assertEquals(BULLISH, r.direction());
            assertTrue(r.sufficient());
            assertTrue(r.higherTimeframesConfirmed());
            assertEquals(4, r.agreeingTimeframes());
            assertEquals((0.5 + 0.5 * 4.0 / 6.0) * 1.10, r.confidence(), EPS);
        }

        @Test
        @DisplayName("5/6 bullish → capped at 0.95")
        void strongConfluenceCapped() {
            ConfluenceResult r = aggregator.aggregate(biases(NEUTRAL, BULLISH, BULLISH, BULLISH, BULLISH, BULLISH));

            assertEquals(BULLISH, r.direction());
            assertEquals(0.95, r.confidence(), EPS);
        }

        @Test
        @DisplayName("3 bearish without higher timeframe support → unboosted base confidence")
        void bearishWithoutHigherTimeframes() {
            ConfluenceResult r = aggregator.aggregate(biases(BEARISH, BEARISH, BEARISH, NEUTRAL, BULLISH, NEUTRAL));

            assertEquals(BEARISH, r.direction());
            assertFalse(r.higherTimeframesConfirmed());
            assertEquals(0.75, r.confidence(), EPS);
            assertEquals(3, r.bearishCount());
            assertEquals(1, r.bullishCount());
            assertEquals(2, r.neutralCount());
        }

        @Test
        @DisplayName("3 bullish vs 3 bearish → insufficient, NEUTRAL at 0.5")
        void tieIsInsufficient() {
            ConfluenceResult r = aggregator.aggregate(biases(BULLISH, BULLISH, BULLISH, BEARISH, BEARISH, BEARISH));

            assertEquals(NEUTRAL, r.direction());
            assertFalse(r.sufficient());
            assertEquals(ConfluenceAggregator.NEUTRAL_CONFIDENCE, r.confidence(), EPS);
            assertTrue(r.explanation().startsWith("Insufficient confluence"));
        }

        @Test
        @DisplayName("neutral majority → insufficient")
        void neutralMajority() {
            ConfluenceResult r = aggregator.aggregate(biases(BULLISH, BULLISH, NEUTRAL, NEUTRAL, NEUTRAL, BEARISH));

            assertFalse(r.sufficient());
            assertEquals(NEUTRAL, r.direction());
        }

        @Test
        @DisplayName("plurality below minConfluence → insufficient")
        void belowMinConfluence() {
            ConfluenceResult r = aggregator.aggregate(biases(BULLISH, BULLISH, BEARISH, NEUTRAL));

            assertFalse(r.sufficient());
        }

        @Test
        @DisplayName("weighted scores sum strength x weight per side")
        void weightedScores() {
            ConfluenceResult r = aggregator.aggregate(biases(BEARISH, BEARISH, BEARISH, NEUTRAL, BULLISH, NEUTRAL));

            assertEquals(0.8 * 0.20, r.weightedBullishScore(), EPS);
            assertEquals(0.8 * (0.10 + 0.15 + 0.15), r.weightedBearishScore(), EPS);
        }
    }

    // ── evaluate() ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate(): snapshot handling")
    class EvaluateTests {

        @Test
        @DisplayName("six bullish snapshots → BULLISH at the cap")
        void allBullish() {
            Map<Timeframe, IndicatorSnapshot> snapshots = new EnumMap<>(Timeframe.class);
            for (Timeframe tf : TimeframeSet.defaults().timeframes()) {
                snapshots.put(tf, Snapshots.bullish(tf));
            }

            ConfluenceResult r = aggregator.evaluate(snapshots);

            assertEquals(BULLISH, r.direction());
            assertEquals(6, r.analyzedTimeframes());
            assertEquals(0.95, r.confidence(), EPS);
        }

        @Test
        @DisplayName("fewer than three analyzable timeframes → InsufficientDataException")
        void tooFewAnalyzable() {
            Map<Timeframe, IndicatorSnapshot> snapshots = new EnumMap<>(Timeframe.class);
            snapshots.put(Timeframe.M5, Snapshots.bullish(Timeframe.M5));
            snapshots.put(Timeframe.H1, Snapshots.bullish(Timeframe.H1));
            snapshots.put(Timeframe.D1, Snapshots.withCandles(Snapshots.bullish(Timeframe.D1), 20));

            InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> aggregator.evaluate(snapshots));
            assertTrue(ex.getMessage().contains("2 of 6"));
        }

        @Test
        @DisplayName("snapshot without its own timeframe label → counted under the requested timeframe")
        void unlabelledSnapshotsUseRequestedTimeframe() {
            Map<Timeframe, IndicatorSnapshot> snapshots = new EnumMap<>(Timeframe.class);
            for (Timeframe tf : List.of(Timeframe.M30, Timeframe.H1, Timeframe.H4, Timeframe.D1)) {
                snapshots.put(tf, Snapshots.withTimeframe(Snapshots.bullish(tf), null));
            }

            ConfluenceResult r = aggregator.evaluate(snapshots);

            assertEquals(BULLISH, r.direction());
            assertTrue(r.higherTimeframesConfirmed());
            assertEquals(List.of(Timeframe.M30, Timeframe.H1, Timeframe.H4, Timeframe.D1),
                         r.biases().stream().map(TimeframeBias::timeframe).toList());
        }

        @Test
        @DisplayName("mislabelled snapshot → requested timeframe wins")
        void mislabelledSnapshotUsesRequestedTimeframe() {
            Map<Timeframe, IndicatorSnapshot> snapshots = new EnumMap<>(Timeframe.class);
            snapshots.put(Timeframe.H1, Snapshots.bullish(Timeframe.H1));
            snapshots.put(Timeframe.H4, Snapshots.bullish(Timeframe.M5));
            snapshots.put(Timeframe.D1, Snapshots.bullish(Timeframe.M5));

            ConfluenceResult r = aggregator.evaluate(snapshots);

            assertTrue(r.higherTimeframesConfirmed());
        }

        @Test
        @DisplayName("snapshots for unconfigured timeframes are ignored")
        void unconfiguredIgnored() {
            Map<Timeframe, IndicatorSnapshot> snapshots = new EnumMap<>(Timeframe.class);
            snapshots.put(Timeframe.M1, Snapshots.bullish(Timeframe.M1));
            snapshots.put(Timeframe.M5, Snapshots.bullish(Timeframe.M5));
            snapshots.put(Timeframe.M15, Snapshots.bullish(Timeframe.M15));
            snapshots.put(Timeframe.M30, Snapshots.bearish(Timeframe.M30));

            ConfluenceResult r = aggregator.evaluate(snapshots);

            assertEquals(3, r.analyzedTimeframes());
            assertFalse(r.sufficient());
        }
    }
}
