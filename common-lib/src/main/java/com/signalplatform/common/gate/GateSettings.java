package com.signalplatform.common.gate;

import java.util.EnumSet;
import java.util.Set;

/**
 * Thresholds and toggles for {@link PreTradeGate}. Percentages are on a 0-100 scale.
 *
 * @param minCandles        candles required before any filter runs
 * @param minAggregateScore mean filter score required on top of the critical vetoes
 */
public record GateSettings(
    Spread spread,
    Volatility volatility,
    Liquidity liquidity,
    Session session,
    PriceAction priceAction,
    int minCandles,
    double minAggregateScore
) {

    public record Spread(boolean enabled, double maxSpreadPercent, double maxSpreadPips) {}

    /**
     * @param lowVolatilityFactor multiplier on the floor for low-volatility instrument classes
     */
    public record Volatility(boolean enabled, double minVolatilityPercent, double maxVolatilityPercent,
                             int window, double lowVolatilityFactor) {}

    public record Liquidity(boolean enabled, double minVolumeRatio, double minAbsoluteVolume, int window) {}

    public record Session(boolean enabled, Set<TradingSession> allowedSessions, int newsBufferMinutes) {
        public Session {
            allowedSessions = allowedSessions == null || allowedSessions.isEmpty()
                ? EnumSet.allOf(TradingSession.class)
                : EnumSet.copyOf(allowedSessions);
        }
    }

    /**
     * @param lowVolatilityFactor multiplier on the minimum body for low-volatility instrument classes
     */
    public record PriceAction(boolean enabled, double maxGapPercent, double minCandleBodyPercent,
                              double lowVolatilityFactor) {}

    public static GateSettings defaults() {
        return new GateSettings(
            new Spread(true, 0.05, 5.0),
            new Volatility(true, 0.01, 2.0, 10, 0.1),
            new Liquidity(true, 0.5, 1000.0, 20),
            new Session(true, EnumSet.allOf(TradingSession.class), 30),
            new PriceAction(true, 0.5, 0.01, 0.1),
            5,
            0.6);
    }
}
