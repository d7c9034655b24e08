package com.signalplatform.common.model;

import java.util.Locale;
import java.util.Set;

/**
 * Broad asset class of an instrument. Drives per-class widening of the gate thresholds.
 */
public enum InstrumentClass {
    FOREX(true, false),
    CRYPTO(false, true),
    EQUITY(false, true),
    COMMODITY(false, true),
    INDEX(false, true);

    private static final Set<String> CRYPTO_BASES = Set.of("BTC", "ETH", "SOL", "XRP", "LTC", "ADA", "DOGE");
    private static final Set<String> FIAT_CODES   = Set.of("USD", "EUR", "GBP", "JPY", "CHF", "AUD", "NZD",
                                                           "CAD", "SEK", "NOK", "SGD", "HKD");

    private final boolean lowVolatility;
    private final boolean hasVolumeSignal;

    InstrumentClass(boolean lowVolatility, boolean hasVolumeSignal) {
        this.lowVolatility   = lowVolatility;
        this.hasVolumeSignal = hasVolumeSignal;
    }

    public boolean lowVolatility() {
        return lowVolatility;
    }

    /** Spot FX has no centralised volume; tick volume is not a liquidity signal. */
    public boolean hasVolumeSignal() {
        return hasVolumeSignal;
    }

    /**
     * Best-effort classification from the instrument symbol: {@code EUR/USD}, {@code EURUSD}
     * and {@code EUR_USD} are FOREX, {@code BTC/USD} and {@code BTCUSDT} are CRYPTO,
     * everything else defaults to EQUITY.
     */
    public static InstrumentClass infer(String instrument) {
        if (instrument == null || instrument.isBlank()) return EQUITY;
        String upper = instrument.trim().toUpperCase(Locale.ROOT);
        String[] legs = upper.split("[/_]");
        if (legs.length == 2) {
            String base = legs[0].trim();
            if (CRYPTO_BASES.contains(base)) return CRYPTO;
            if (FIAT_CODES.contains(base) && FIAT_CODES.contains(legs[1].trim())) return FOREX;
            return EQUITY;
        }
        for (String crypto : CRYPTO_BASES) {
            if (upper.startsWith(crypto) && upper.length() > crypto.length()
                && FIAT_CODES.contains(upper.substring(crypto.length(), Math.min(upper.length(), crypto.length() + 3)))) {
                return CRYPTO;
            }
        }
        if (upper.length() == 6
            && FIAT_CODES.contains(upper.substring(0, 3))
            && FIAT_CODES.contains(upper.substring(3))) {
            return FOREX;
        }
        return EQUITY;
    }

    /** JPY-quoted pairs are priced to two decimals; every other pair to four. */
    public static double pipSize(String instrument) {
        return instrument != null && instrument.toUpperCase(Locale.ROOT).contains("JPY") ? 0.01 : 0.0001;
    }
}
