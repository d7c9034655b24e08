package com.signalplatform.common.model;

import java.util.Locale;

public enum TradeDecision {
    BUY,
    SELL,
    NO_TRADE;

    /**
     * Lenient mapping for free-text judge output. Anything not recognisably
     * directional becomes {@link #NO_TRADE}.
     */
    public static TradeDecision fromText(String text) {
        if (text == null) return NO_TRADE;
        return switch (text.trim().toUpperCase(Locale.ROOT).replace(' ', '_')) {
            case "BUY", "UP", "CALL", "BULLISH", "LONG"    -> BUY;
            case "SELL", "DOWN", "PUT", "BEARISH", "SHORT" -> SELL;
            default                                       -> NO_TRADE;
        };
    }

    public static TradeDecision fromBias(BiasDirection direction) {
        return switch (direction) {
            case BULLISH -> BUY;
            case BEARISH -> SELL;
            case NEUTRAL -> NO_TRADE;
        };
    }

    public boolean isDirectional() {
        return this != NO_TRADE;
    }
}
