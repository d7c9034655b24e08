package com.signalplatform.common.confluence;

import com.signalplatform.common.exception.InsufficientDataException;
import com.signalplatform.common.model.BiasDirection;
import com.signalplatform.common.model.ConfluenceResult;
import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.common.model.TimeframeBias;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Combines per-timeframe biases into a single {@link ConfluenceResult}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Count timeframes per direction. BULLISH or BEARISH wins only when its count is
 *       strictly greater than both other counts AND at least {@code minConfluence}.</li>
 *   <li>Base confidence = {@code min(0.5 + 0.5 * agreeing / analyzed, cap)}.</li>
 *   <li>Every configured higher timeframe analyzed and agreeing: confidence x boost, capped.</li>
 *   <li>At least {@code strongConfluence} agreeing: + increment, capped.</li>
 * </ol>
 * Ties and neutral majorities yield an insufficient result (confidence 0.5), which the
 * pipeline maps to NO_TRADE.
 *
 * <p>Stateless and thread-safe once constructed.
 */
public class ConfluenceAggregator {

    static final double NEUTRAL_CONFIDENCE = 0.5;

    private final TimeframeSet timeframes;
    private final ConfluenceSettings settings;
    private final int minCandles;

    public ConfluenceAggregator(TimeframeSet timeframes, ConfluenceSettings settings, int minCandles) {
        this.timeframes = timeframes;
        this.settings   = settings;
        this.minCandles = minCandles;
    }

    public TimeframeSet timeframes() {
        return timeframes;
    }

    /**
     * Scores every analyzable configured snapshot and aggregates the biases.
     *
     * @param snapshots snapshots keyed by timeframe; missing or unanalyzable entries are skipped.
     *                  The key, not the snapshot's own label, decides which timeframe a bias counts for.
     * @throws InsufficientDataException when fewer than {@code minConfluence} timeframes are analyzable
     */
    public ConfluenceResult evaluate(Map<Timeframe, IndicatorSnapshot> snapshots) {
        List<TimeframeBias> biases = new ArrayList<>();
        for (Timeframe tf : timeframes.timeframes()) {
            IndicatorSnapshot snapshot = snapshots.get(tf);
            if (snapshot != null && snapshot.isAnalyzable(minCandles)) {
                biases.add(TimeframeBiasScorer.score(snapshot, tf, timeframes.weightOf(tf)));
            }
        }
        if (biases.size() < settings.minConfluence()) {
            throw new InsufficientDataException(String.format(Locale.ROOT,
                "Insufficient data: %d of %d timeframes analyzable, %d required",
                biases.size(), timeframes.weights().size(), settings.minConfluence()));
        }
        return aggregate(biases);
    }

    /**
     * Aggregates already-scored biases. Exposed separately so the counting rules can be
     * exercised without building snapshots.
     */
    public ConfluenceResult aggregate(List<TimeframeBias> biases) {
        int analyzed = biases.size();
        Map<BiasDirection, Long> counts = biases.stream()
            .collect(Collectors.groupingBy(TimeframeBias::direction, Collectors.counting()));
        int bullish = counts.getOrDefault(BiasDirection.BULLISH, 0L).intValue();
        int bearish = counts.getOrDefault(BiasDirection.BEARISH, 0L).intValue();
        int neutral = counts.getOrDefault(BiasDirection.NEUTRAL, 0L).intValue();

        double weightedBullish = weightedScore(biases, BiasDirection.BULLISH);
        double weightedBearish = weightedScore(biases, BiasDirection.BEARISH);

        BiasDirection winner = winner(bullish, bearish, neutral);
        if (winner == BiasDirection.NEUTRAL) {
            String explanation = String.format(Locale.ROOT,
                "Insufficient confluence: bullish=%d bearish=%d neutral=%d of %d timeframes (need %d agreeing)",
                bullish, bearish, neutral, analyzed, settings.minConfluence());
            return new ConfluenceResult(BiasDirection.NEUTRAL, NEUTRAL_CONFIDENCE, 0, analyzed,
                                        bullish, bearish, neutral, weightedBullish, weightedBearish,
                                        false, false, biases, explanation);
        }

        int agreeing = winner == BiasDirection.BULLISH ? bullish : bearish;
        double cap = settings.confidenceCap();
        double confidence = Math.min(NEUTRAL_CONFIDENCE + 0.5 * ((double) agreeing / analyzed), cap);

        boolean higherConfirmed = higherTimeframesAgree(biases, winner);
        if (higherConfirmed) {
            confidence = Math.min(confidence * settings.higherTimeframeBoost(), cap);
        }
        if (agreeing >= settings.strongConfluence()) {
            confidence = Math.min(confidence + settings.strongConfluenceIncrement(), cap);
        }

        String explanation = String.format(Locale.ROOT,
            "%d/%d timeframes %s%s%s",
            agreeing, analyzed, winner,
            higherConfirmed ? ", higher timeframes confirm" : "",
            agreeing >= settings.strongConfluence() ? ", strong confluence" : "");

        return new ConfluenceResult(winner, confidence, agreeing, analyzed, bullish, bearish, neutral,
                                    weightedBullish, weightedBearish, higherConfirmed, true,
                                    biases, explanation);
    }

    private BiasDirection winner(int bullish, int bearish, int neutral) {
        if (bullish > bearish && bullish > neutral && bullish >= settings.minConfluence()) {
            return BiasDirection.BULLISH;
        }
        if (bearish > bullish && bearish > neutral && bearish >= settings.minConfluence()) {
            return BiasDirection.BEARISH;
        }
        return BiasDirection.NEUTRAL;
    }

    private boolean higherTimeframesAgree(List<TimeframeBias> biases, BiasDirection direction) {
        List<Timeframe> higher = timeframes.higherTimeframes();
        if (higher.isEmpty()) return false;
        for (Timeframe tf : higher) {
            boolean agrees = biases.stream()
                .anyMatch(b -> b.timeframe() == tf && b.direction() == direction);
            if (!agrees) return false;
        }
        return true;
    }

    private static double weightedScore(List<TimeframeBias> biases, BiasDirection direction) {
        return biases.stream()
            .filter(b -> b.direction() == direction)
            .mapToDouble(b -> b.strength() * b.weight())
            .sum();
    }
}
