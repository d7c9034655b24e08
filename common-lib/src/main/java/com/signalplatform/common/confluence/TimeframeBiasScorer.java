package com.signalplatform.common.confluence;

import com.signalplatform.common.model.BiasDirection;
import com.signalplatform.common.model.CandlestickPattern;
import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.common.model.TimeframeBias;
import com.signalplatform.common.model.VolumeTrend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure stateless scorer that turns one {@link IndicatorSnapshot} into a {@link TimeframeBias}.
 *
 * <h3>Point table</h3>
 * <pre>
 *   RSI        &gt;70 bearish +2 | &lt;30 bullish +2 | &gt;60 bullish +0.5 | &lt;40 bearish +0.5 | else neutral +1
 *   MACD hist  &gt;0 rising +1.5 / &gt;0 +1 bullish | &lt;0 falling +1.5 / &lt;0 +1 bearish | 0 neutral +0.5
 *   EMA stack  fast&gt;mid&gt;slow bullish +2 | fast&lt;mid&lt;slow bearish +2 | else price vs mid +0.5
 *   Bollinger  below lower bullish +1.5 | above upper bearish +1.5 | upper half +0.5 | lower half +0.5
 *   Volume     increasing volume confirms the price move +1.5 | decreasing neutral +0.5
 *   Pattern    strongest pattern +2 x strength to its side | neutral pattern neutral +1
 * </pre>
 *
 * <p>Direction is the strict maximum of the three totals; any tie at the top is NEUTRAL.
 * Strength is the winning share of all points, capped at {@value #MAX_STRENGTH}.
 */
public final class TimeframeBiasScorer {

    static final double RSI_OVERBOUGHT = 70.0;
    static final double RSI_OVERSOLD   = 30.0;
    static final double RSI_BULL_ZONE  = 60.0;
    static final double RSI_BEAR_ZONE  = 40.0;

    static final double EXTREME_POINTS  = 2.0;
    static final double MOMENTUM_POINTS = 1.5;
    static final double BASE_POINTS     = 1.0;
    static final double LEAN_POINTS     = 0.5;

    static final double MAX_STRENGTH = 0.95;

    private TimeframeBiasScorer() {}

    /** Scores a snapshot under the timeframe it carries itself. */
    public static TimeframeBias score(IndicatorSnapshot snapshot, double weight) {
        return score(snapshot, snapshot.timeframe(), weight);
    }

    /**
     * @param snapshot  analyzable snapshot (required groups may still be null; they are skipped)
     * @param timeframe timeframe the snapshot was requested for; wins over the snapshot's own label
     * @param weight    configured weight of that timeframe, carried through for audit
     * @return the timeframe's bias, never {@code null}
     */
    public static TimeframeBias score(IndicatorSnapshot snapshot, Timeframe timeframe, double weight) {
        Tally tally = new Tally();
        double price = snapshot.currentPrice();

        scoreRsi(snapshot.rsi(), tally);
        scoreMacd(snapshot.macd(), tally);
        scoreEma(price, snapshot.ema(), tally);
        scoreBollinger(price, snapshot.bollinger(), tally);
        scoreVolume(snapshot.volume(), snapshot.priceChangePercent(), tally);
        snapshot.strongestPattern().ifPresent(p -> scorePattern(p, tally));

        BiasDirection direction = tally.direction();
        return new TimeframeBias(timeframe, direction, tally.strength(direction), weight,
                                 tally.bullish, tally.bearish, tally.neutral, tally.factors);
    }

    // ── indicator rules ───────────────────────────────────────────────────────

    private static void scoreRsi(Double rsi, Tally tally) {
        if (rsi == null) return;
        String value = fmt(rsi);
        if (rsi > RSI_OVERBOUGHT)      tally.bearish(EXTREME_POINTS, "RSI overbought (" + value + ")");
        else if (rsi < RSI_OVERSOLD)   tally.bullish(EXTREME_POINTS, "RSI oversold (" + value + ")");
        else if (rsi > RSI_BULL_ZONE)  tally.bullish(LEAN_POINTS, "RSI bullish zone (" + value + ")");
        else if (rsi < RSI_BEAR_ZONE)  tally.bearish(LEAN_POINTS, "RSI bearish zone (" + value + ")");
        else                           tally.neutral(BASE_POINTS, "RSI neutral (" + value + ")");
    }

    private static void scoreMacd(IndicatorSnapshot.Macd macd, Tally tally) {
        if (macd == null) return;
        double hist = macd.histogram();
        Double prev = macd.previousHistogram();
        if (hist > 0) {
            if (prev != null && hist > prev) tally.bullish(MOMENTUM_POINTS, "MACD histogram positive and rising");
            else                             tally.bullish(BASE_POINTS, "MACD histogram positive");
        } else if (hist < 0) {
            if (prev != null && hist < prev) tally.bearish(MOMENTUM_POINTS, "MACD histogram negative and falling");
            else                             tally.bearish(BASE_POINTS, "MACD histogram negative");
        } else {
            tally.neutral(LEAN_POINTS, "MACD histogram flat");
        }
    }

    private static void scoreEma(double price, IndicatorSnapshot.Ema ema, Tally tally) {
        if (ema == null) return;
        if (ema.fast() > ema.mid() && ema.mid() > ema.slow()) {
            tally.bullish(EXTREME_POINTS, "EMA stack bullish");
        } else if (ema.fast() < ema.mid() && ema.mid() < ema.slow()) {
            tally.bearish(EXTREME_POINTS, "EMA stack bearish");
        } else if (price > ema.mid()) {
            tally.bullish(LEAN_POINTS, "Price above mid EMA");
        } else if (price < ema.mid()) {
            tally.bearish(LEAN_POINTS, "Price below mid EMA");
        }
    }

    private static void scoreBollinger(double price, IndicatorSnapshot.Bollinger bb, Tally tally) {
        if (bb == null) return;
        if (price < bb.lower())       tally.bullish(MOMENTUM_POINTS, "Price below lower Bollinger band");
        else if (price > bb.upper())  tally.bearish(MOMENTUM_POINTS, "Price above upper Bollinger band");
        else if (price > bb.middle()) tally.bullish(LEAN_POINTS, "Price in upper Bollinger half");
        else if (price < bb.middle()) tally.bearish(LEAN_POINTS, "Price in lower Bollinger half");
    }

    private static void scoreVolume(IndicatorSnapshot.VolumeProfile volume, double priceChangePercent, Tally tally) {
        if (volume == null || volume.trend() == null) return;
        if (volume.trend() == VolumeTrend.INCREASING) {
            if (priceChangePercent > 0)      tally.bullish(MOMENTUM_POINTS, "Rising volume confirms advance");
            else if (priceChangePercent < 0) tally.bearish(MOMENTUM_POINTS, "Rising volume confirms decline");
            else                             tally.neutral(LEAN_POINTS, "Rising volume without price move");
        } else if (volume.trend() == VolumeTrend.DECREASING) {
            tally.neutral(LEAN_POINTS, "Declining volume, move unconfirmed");
        }
    }

    private static void scorePattern(CandlestickPattern pattern, Tally tally) {
        double points = EXTREME_POINTS * Math.max(0.0, Math.min(1.0, pattern.strength()));
        switch (pattern.direction()) {
            case BULLISH -> tally.bullish(points, "Bullish pattern " + pattern.name());
            case BEARISH -> tally.bearish(points, "Bearish pattern " + pattern.name());
            case NEUTRAL -> tally.neutral(BASE_POINTS, "Indecision pattern " + pattern.name());
        }
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    // ── accumulator ───────────────────────────────────────────────────────────

    private static final class Tally {
        private double bullish;
        private double bearish;
        private double neutral;
        private final List<String> factors = new ArrayList<>();

        void bullish(double points, String factor) { bullish += points; factors.add(factor); }
        void bearish(double points, String factor) { bearish += points; factors.add(factor); }
        void neutral(double points, String factor) { neutral += points; factors.add(factor); }

        BiasDirection direction() {
            if (bullish > bearish && bullish > neutral) return BiasDirection.BULLISH;
            if (bearish > bullish && bearish > neutral) return BiasDirection.BEARISH;
            return BiasDirection.NEUTRAL;
        }

        double strength(BiasDirection direction) {
            double total = bullish + bearish + neutral;
            if (total <= 0.0) return 0.0;
            double winning = switch (direction) {
                case BULLISH -> bullish;
                case BEARISH -> bearish;
                case NEUTRAL -> Math.max(neutral, Math.max(bullish, bearish));
            };
            return Math.min(winning / total, MAX_STRENGTH);
        }
    }
}
