package com.signalplatform.common.gate;

import java.util.Locale;

/**
 * Major FX trading sessions, bounded by whole UTC hours.
 *
 * <ul>
 *   <li>{@link #ASIAN}    23:00-08:00 UTC (wraps midnight)</li>
 *   <li>{@link #LONDON}   07:00-16:00 UTC</li>
 *   <li>{@link #NEW_YORK} 12:00-21:00 UTC</li>
 * </ul>
 */
public enum TradingSession {
    ASIAN(23, 8),
    LONDON(7, 16),
    NEW_YORK(12, 21);

    private final int startHourUtc;
    private final int endHourUtc;

    TradingSession(int startHourUtc, int endHourUtc) {
        this.startHourUtc = startHourUtc;
        this.endHourUtc   = endHourUtc;
    }

    /** Start inclusive, end exclusive. */
    public boolean contains(int hourUtc) {
        if (startHourUtc > endHourUtc) {
            return hourUtc >= startHourUtc || hourUtc < endHourUtc;
        }
        return hourUtc >= startHourUtc && hourUtc < endHourUtc;
    }

    /** Accepts {@code "newyork"}, {@code "new_york"} or {@code "NEW-YORK"}. */
    public static TradingSession fromText(String text) {
        String normalised = text.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (TradingSession session : values()) {
            if (session.name().replace("_", "").equals(normalised)) return session;
        }
        throw new IllegalArgumentException("Unknown trading session: " + text);
    }
}
