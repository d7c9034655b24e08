package com.signalplatform.common.gate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Pure stateless classifier mapping a UTC {@link Instant} to the FX sessions open at that moment.
 *
 * <p>Sessions overlap (London/New York 12:00-16:00 UTC), so the result is a set.
 * The high-impact news window is the first {@code bufferMinutes} of each hour between
 * 12:00 and 16:00 UTC, when US data releases land on the London/New York overlap.
 * The end hour is exclusive, so 16:xx is outside the window.
 */
public final class TradingSessionClassifier {

    static final int NEWS_WINDOW_START_HOUR = 12;
    static final int NEWS_WINDOW_END_HOUR   = 16;

    private TradingSessionClassifier() {}

    /**
     * @return the sessions open at {@code now}; empty outside all of them, never null
     */
    public static Set<TradingSession> activeSessions(Instant now) {
        int hour = now.atZone(ZoneOffset.UTC).getHour();
        Set<TradingSession> active = EnumSet.noneOf(TradingSession.class);
        for (TradingSession session : TradingSession.values()) {
            if (session.contains(hour)) active.add(session);
        }
        return active;
    }

    public static boolean isNewsWindow(Instant now, int bufferMinutes) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        int hour = utc.getHour();
        return hour >= NEWS_WINDOW_START_HOUR
            && hour < NEWS_WINDOW_END_HOUR
            && utc.getMinute() < bufferMinutes;
    }
}
