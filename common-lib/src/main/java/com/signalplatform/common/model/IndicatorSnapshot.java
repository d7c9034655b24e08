package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Precomputed indicator values for one instrument on one timeframe.
 *
 * <p>Indicator arithmetic happens upstream; this record only carries the results.
 * RSI, MACD, EMA and Bollinger groups are required for scoring; a snapshot missing any
 * of them, or built from too few candles, is excluded from confluence.
 */
public record IndicatorSnapshot(
    @JsonProperty("instrument") String instrument,
    @JsonProperty("timeframe") Timeframe timeframe,
    @JsonProperty("capturedAt") Instant capturedAt,
    @JsonProperty("candleCount") int candleCount,
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("priceChangePercent") double priceChangePercent,
    @JsonProperty("rsi") Double rsi,
    @JsonProperty("macd") Macd macd,
    @JsonProperty("ema") Ema ema,
    @JsonProperty("bollinger") Bollinger bollinger,
    @JsonProperty("stochastic") Stochastic stochastic,
    @JsonProperty("atr") Double atr,
    @JsonProperty("volume") VolumeProfile volume,
    @JsonProperty("patterns") List<CandlestickPattern> patterns
) {

    public IndicatorSnapshot {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    /** MACD line, signal line and histogram; {@code previousHistogram} gives the slope. */
    public record Macd(
        @JsonProperty("macd") double macd,
        @JsonProperty("signal") double signal,
        @JsonProperty("histogram") double histogram,
        @JsonProperty("previousHistogram") Double previousHistogram
    ) {}

    public record Ema(
        @JsonProperty("fast") double fast,
        @JsonProperty("mid") double mid,
        @JsonProperty("slow") double slow
    ) {}

    public record Bollinger(
        @JsonProperty("upper") double upper,
        @JsonProperty("middle") double middle,
        @JsonProperty("lower") double lower
    ) {}

    public record Stochastic(
        @JsonProperty("k") double k,
        @JsonProperty("d") double d
    ) {}

    public record VolumeProfile(
        @JsonProperty("current") double current,
        @JsonProperty("average") double average,
        @JsonProperty("trend") VolumeTrend trend
    ) {}

    /**
     * @return {@code true} when the required indicator groups are present and the
     *         snapshot was computed over at least {@code minCandles} candles
     */
    public boolean isAnalyzable(int minCandles) {
        return candleCount >= minCandles
            && rsi != null
            && macd != null
            && ema != null
            && bollinger != null;
    }

    /** Highest-strength detected pattern, if any. */
    public Optional<CandlestickPattern> strongestPattern() {
        return patterns.stream().max(Comparator.comparingDouble(CandlestickPattern::strength));
    }
}
