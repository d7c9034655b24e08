package com.signalplatform.orchestrator.scheduler;

import com.signalplatform.common.gate.TradingSessionClassifier;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Session-aware signal cadence.
 *
 * <ul>
 *   <li>Weekend (Friday 21:00 to Sunday 21:00 UTC): {@link #OFF_SESSION_INTERVAL}</li>
 *   <li>At least one FX session open: {@link #ACTIVE_INTERVAL}</li>
 *   <li>Weekday gap between New York close and Asian open: {@link #OFF_SESSION_INTERVAL}</li>
 * </ul>
 * {@link #FALLBACK_INTERVAL} is used after a failed cycle.
 */
public final class CadenceStrategy {

    public static final Duration ACTIVE_INTERVAL      = Duration.ofMinutes(1);
    public static final Duration OFF_SESSION_INTERVAL = Duration.ofMinutes(15);
    public static final Duration FALLBACK_INTERVAL    = Duration.ofMinutes(5);

    static final int WEEK_BOUNDARY_HOUR_UTC = 21;

    private CadenceStrategy() {}

    public static Duration resolve(Instant now) {
        if (isWeekend(now)) return OFF_SESSION_INTERVAL;
        return TradingSessionClassifier.activeSessions(now).isEmpty()
            ? OFF_SESSION_INTERVAL
            : ACTIVE_INTERVAL;
    }

    static boolean isWeekend(Instant now) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        DayOfWeek day = utc.getDayOfWeek();
        int hour = utc.getHour();
        return switch (day) {
            case SATURDAY -> true;
            case FRIDAY   -> hour >= WEEK_BOUNDARY_HOUR_UTC;
            case SUNDAY   -> hour < WEEK_BOUNDARY_HOUR_UTC;
            default       -> false;
        };
    }
}
